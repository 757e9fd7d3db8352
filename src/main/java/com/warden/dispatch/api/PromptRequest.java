package com.warden.dispatch.api;

public record PromptRequest(String content, Boolean done) {

    public boolean isDone() {
        return Boolean.TRUE.equals(done);
    }
}

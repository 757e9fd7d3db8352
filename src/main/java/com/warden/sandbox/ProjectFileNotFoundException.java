package com.warden.sandbox;

public class ProjectFileNotFoundException extends RuntimeException {

    public ProjectFileNotFoundException(String jobId, String path) {
        super("No such file in project of job " + jobId + ": " + path);
    }
}

package com.warden.egress;

/**
 * A resolved credential, attached to outbound requests only inside the proxy.
 */
public record InjectedCredential(String header, String value) {

    @Override
    public String toString() {
        return "InjectedCredential[header=" + header + ", value=****]";
    }
}

package com.warden.egress;

public enum EgressDecision {
    ALLOWED,
    DENIED,
    UNAUTHENTICATED
}

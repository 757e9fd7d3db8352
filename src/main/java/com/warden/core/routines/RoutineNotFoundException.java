package com.warden.core.routines;

public class RoutineNotFoundException extends RuntimeException {

    public RoutineNotFoundException(String message) {
        super(message);
    }
}

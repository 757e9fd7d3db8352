package com.warden.core.persistence;

/**
 * A durable store could not complete an operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

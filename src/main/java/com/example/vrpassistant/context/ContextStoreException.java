package com.example.vrpassistant.context;

/**
 * Raised when a caller gives up waiting for the store lock. No mutation has happened when
 * this is thrown.
 */
public class ContextStoreException extends RuntimeException {

    public ContextStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

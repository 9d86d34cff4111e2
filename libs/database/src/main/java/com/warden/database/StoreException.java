package com.warden.database;

/** Failure of a store operation. Subtypes mark the cases callers branch on. */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}

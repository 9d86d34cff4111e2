package com.warden.database;

/** An insert or update collided with a unique constraint. */
public class UniqueViolationException extends StoreException {

    public UniqueViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}

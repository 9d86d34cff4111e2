package com.warden.database;

/** A single-row query matched nothing. */
public class NoRowsException extends StoreException {

    public NoRowsException(String message) {
        super(message);
    }
}

package com.warden.security;

/**
 * Thrown when a bearer token cannot be trusted: bad signature, expired,
 * malformed, or issued by an unexpected issuer.
 */
public class TokenValidationException extends RuntimeException {

    public TokenValidationException(String message) {
        super(message);
    }

    public TokenValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.warden.security;

/**
 * Thrown by external verifiers when a bearer token or ticket is rejected.
 */
public class TokenVerificationException extends Exception {

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

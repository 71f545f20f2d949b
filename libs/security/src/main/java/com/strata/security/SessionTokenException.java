package com.strata.security;

/**
 * A bearer token is missing, malformed, wrongly signed or expired. Always maps to an
 * {@code Unauthorized} response.
 */
public class SessionTokenException extends RuntimeException {

    public SessionTokenException(String message) {
        super(message);
    }

    public SessionTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}

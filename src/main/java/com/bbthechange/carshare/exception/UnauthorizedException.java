package com.bbthechange.carshare.exception;

/**
 * Exception thrown when a credential or bearer token is missing, unknown or expired.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}

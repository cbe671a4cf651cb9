package com.bbthechange.carshare.exception;

/**
 * Exception thrown when input is missing or malformed, or when a request breaks a policy threshold
 * such as the maximum distance between a rider and the car they want to rent.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.bbthechange.carshare.exception;

/**
 * Exception thrown when the requested transition collides with current state:
 * the client already rents a car, the car is taken, the email is registered,
 * or another request won the race for the same car.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

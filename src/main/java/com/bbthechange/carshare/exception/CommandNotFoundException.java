package com.bbthechange.carshare.exception;

/**
 * Exception thrown when a car acknowledges a command that is unknown, belongs to another VIN,
 * or has already been acknowledged.
 */
public class CommandNotFoundException extends ResourceNotFoundException {

    public CommandNotFoundException(String message) {
        super(message);
    }
}

package com.bbthechange.carshare.exception;

/**
 * Exception thrown when a VIN is unknown to the fleet.
 */
public class CarNotFoundException extends ResourceNotFoundException {

    public CarNotFoundException(String message) {
        super(message);
    }
}

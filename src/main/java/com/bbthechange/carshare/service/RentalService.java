package com.bbthechange.carshare.service;

import com.bbthechange.carshare.dto.RentalResult;
import com.bbthechange.carshare.model.Rental;

import java.util.List;

/**
 * Rental state machine. The only place that changes a car's rental status or closes a rental.
 *
 * A car has at most one open rental and a client holds at most one active rental.
 * Neither transition waits for the vehicle: the unlock or lock instruction is queued
 * and delivered through the command channel.
 */
public interface RentalService {

    /**
     * Rent an available car within reach of the client's last known location.
     *
     * @throws com.bbthechange.carshare.exception.ConflictException if the client already rents a car,
     *         the car is taken, or a concurrent start won the car
     * @throws com.bbthechange.carshare.exception.ValidationException if the client is too far from the car
     *         or has no known location
     */
    RentalResult start(String clientId, String vin);

    /**
     * End the client's rental of this car, judged on the latest telematics the car reported.
     *
     * @throws com.bbthechange.carshare.exception.PreconditionFailedException listing every unsafe flag;
     *         nothing changes and the car is asked to refresh its state
     * @throws com.bbthechange.carshare.exception.ConflictException if the client holds no open rental of the car
     */
    RentalResult end(String clientId, String vin);

    /**
     * Rental history, newest first.
     */
    List<Rental> getRentals(String clientId);
}

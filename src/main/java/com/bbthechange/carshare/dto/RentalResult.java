package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.Rental;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a rental transition: the rental, the car after the transition, and the command queued for the car.
 */
@Getter
@AllArgsConstructor
public class RentalResult {

    private final Rental rental;
    private final Car car;
    private final CarCommand command;
}

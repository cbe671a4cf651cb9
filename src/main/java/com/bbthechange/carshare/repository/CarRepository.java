package com.bbthechange.carshare.repository;

import com.bbthechange.carshare.model.Car;

import java.util.List;
import java.util.Optional;

public interface CarRepository {

    /**
     * Add a car to the fleet. Fails with VersionConflictException if the VIN exists.
     */
    Car save(Car car);

    Optional<Car> findByVin(String vin);

    List<Car> findAll();

    List<Car> findAvailable();

    /**
     * Compare-and-set on the car's version
     */
    Car update(Car car);

    long count();
}

package com.bbthechange.carshare.repository;

import com.bbthechange.carshare.model.CarCommand;

import java.util.List;
import java.util.Optional;

public interface CarCommandRepository {

    /**
     * Append a command to its car's queue. Assigns the sequence number that orders the queue.
     */
    CarCommand save(CarCommand command);

    Optional<CarCommand> findById(String commandId);

    /**
     * Pending commands for a car, in the order they were saved
     */
    List<CarCommand> findPendingByVin(String vin);

    long countPendingByVin(String vin);

    /**
     * Compare-and-set on the command's version
     */
    CarCommand update(CarCommand command);
}

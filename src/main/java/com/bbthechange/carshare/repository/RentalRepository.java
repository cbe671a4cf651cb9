package com.bbthechange.carshare.repository;

import com.bbthechange.carshare.model.Rental;

import java.util.List;
import java.util.Optional;

public interface RentalRepository {

    Rental save(Rental rental);

    Optional<Rental> findById(String rentalId);

    /**
     * The open rental (endedAt == null) of this client for this car, if any
     */
    Optional<Rental> findOpenRental(String clientId, String vin);

    /**
     * All rentals of a client, newest first
     */
    List<Rental> findByClientId(String clientId);

    /**
     * Compare-and-set on the rental's version
     */
    Rental update(Rental rental);
}

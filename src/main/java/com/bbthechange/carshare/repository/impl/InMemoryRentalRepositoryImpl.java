package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.model.Rental;
import com.bbthechange.carshare.repository.RentalRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class InMemoryRentalRepositoryImpl implements RentalRepository {

    private final InMemoryItemStore<Rental> store = new InMemoryItemStore<>("Rental", Rental::new);

    @Override
    public Rental save(Rental rental) {
        return store.insert(rental);
    }

    @Override
    public Optional<Rental> findById(String rentalId) {
        return store.find(rentalId);
    }

    @Override
    public Optional<Rental> findOpenRental(String clientId, String vin) {
        return store.findAll(rental -> rental.isOpen()
                        && rental.getClientId().equals(clientId)
                        && rental.getVin().equals(vin))
                .stream()
                .findFirst();
    }

    @Override
    public List<Rental> findByClientId(String clientId) {
        return store.findAll(rental -> rental.getClientId().equals(clientId))
                .stream()
                .sorted(Comparator.comparing(Rental::getStartedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public Rental update(Rental rental) {
        return store.update(rental);
    }
}

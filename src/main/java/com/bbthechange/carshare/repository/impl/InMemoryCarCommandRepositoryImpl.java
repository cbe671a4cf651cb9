package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.repository.CarCommandRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
public class InMemoryCarCommandRepositoryImpl implements CarCommandRepository {

    private final InMemoryItemStore<CarCommand> store = new InMemoryItemStore<>("CarCommand", CarCommand::new);
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public CarCommand save(CarCommand command) {
        CarCommand toStore = new CarCommand(command);
        toStore.setSequence(sequence.incrementAndGet());
        return store.insert(toStore);
    }

    @Override
    public Optional<CarCommand> findById(String commandId) {
        return store.find(commandId);
    }

    @Override
    public List<CarCommand> findPendingByVin(String vin) {
        return store.findAll(command -> command.isPending() && command.getVin().equals(vin))
                .stream()
                .sorted(Comparator.comparingLong(CarCommand::getSequence))
                .collect(Collectors.toList());
    }

    @Override
    public long countPendingByVin(String vin) {
        return store.findAll(command -> command.isPending() && command.getVin().equals(vin)).size();
    }

    @Override
    public CarCommand update(CarCommand command) {
        return store.update(command);
    }
}

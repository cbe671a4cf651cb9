package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.repository.CarRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class InMemoryCarRepositoryImpl implements CarRepository {

    private final InMemoryItemStore<Car> store = new InMemoryItemStore<>("Car", Car::new);

    @Override
    public Car save(Car car) {
        return store.insert(car);
    }

    @Override
    public Optional<Car> findByVin(String vin) {
        return store.find(vin);
    }

    @Override
    public List<Car> findAll() {
        return sortedByVin(store.findAll(car -> true));
    }

    @Override
    public List<Car> findAvailable() {
        return sortedByVin(store.findAll(Car::isAvailable));
    }

    @Override
    public Car update(Car car) {
        return store.update(car);
    }

    @Override
    public long count() {
        return store.count();
    }

    private static List<Car> sortedByVin(List<Car> cars) {
        return cars.stream()
                .sorted(Comparator.comparing(Car::getVin))
                .collect(Collectors.toList());
    }
}

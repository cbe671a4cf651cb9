package com.bbthechange.carshare.service.impl;

import com.bbthechange.carshare.dto.CarDTO;
import com.bbthechange.carshare.dto.HeartbeatResponse;
import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.exception.CarNotFoundException;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.repository.CarCommandRepository;
import com.bbthechange.carshare.repository.CarRepository;
import com.bbthechange.carshare.service.FleetService;
import com.bbthechange.carshare.util.GeoDistance;
import com.bbthechange.carshare.util.OptimisticRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Service
public class FleetServiceImpl implements FleetService {

    private static final Logger logger = LoggerFactory.getLogger(FleetServiceImpl.class);

    private final CarRepository carRepository;
    private final CarCommandRepository carCommandRepository;

    public FleetServiceImpl(CarRepository carRepository, CarCommandRepository carCommandRepository) {
        this.carRepository = carRepository;
        this.carCommandRepository = carCommandRepository;
    }

    @Override
    public List<CarDTO> listAvailable(Location from) {
        List<Car> available = carRepository.findAvailable();
        logger.debug("Listing {} available cars from {}", available.size(), from);

        if (from == null) {
            return available.stream()
                    .map(CarDTO::new)
                    .collect(Collectors.toList());
        }
        if (!from.isValid()) {
            throw new ValidationException("location must have lat in [-90, 90] and lon in [-180, 180]");
        }
        return available.stream()
                .map(car -> new CarDTO(car, GeoDistance.roundKm(GeoDistance.haversineKm(from, car.getLocation()))))
                .sorted(Comparator.comparingDouble(CarDTO::getDistanceKm).thenComparing(CarDTO::getVin))
                .collect(Collectors.toList());
    }

    @Override
    public Car getByVin(String vin) {
        return carRepository.findByVin(vin)
                .orElseThrow(() -> new CarNotFoundException("Car not found: " + vin));
    }

    @Override
    public boolean exists(String vin) {
        return carRepository.findByVin(vin).isPresent();
    }

    @Override
    public Car applyTelematicsUpdate(String vin, TelematicsUpdateRequest update) {
        Car updated = modify(vin, car -> {
            if (update != null) {
                if (update.getDoorsClosed() != null) {
                    car.setDoorsClosed(update.getDoorsClosed());
                }
                if (update.getLightsOff() != null) {
                    car.setLightsOff(update.getLightsOff());
                }
                if (update.getEngineOff() != null) {
                    car.setEngineOff(update.getEngineOff());
                }
                if (update.getLocked() != null) {
                    car.setLocked(update.getLocked());
                }
                if (update.getBatteryPct() != null) {
                    car.setBatteryPct(update.getBatteryPct());
                }
            }
        });
        logger.info("Telematics for {}: doorsClosed={} lightsOff={} engineOff={} locked={} battery={}%",
                vin, updated.isDoorsClosed(), updated.isLightsOff(), updated.isEngineOff(),
                updated.isLocked(), updated.getBatteryPct());
        return updated;
    }

    @Override
    public Car setLocked(String vin, boolean locked) {
        Car updated = modify(vin, car -> car.setLocked(locked));
        logger.info("Car {} is now {}", vin, locked ? "locked" : "unlocked");
        return updated;
    }

    @Override
    public Car recordSeen(String vin) {
        return modify(vin, car -> { });
    }

    @Override
    public HeartbeatResponse heartbeat(String vin, TelematicsUpdateRequest update) {
        Car car = update != null && update.hasUpdates() ? applyTelematicsUpdate(vin, update) : recordSeen(vin);
        long pending = carCommandRepository.countPendingByVin(vin);
        logger.debug("Heartbeat from {}: {} pending commands", vin, pending);
        return new HeartbeatResponse(vin, pending, new CarDTO(car));
    }

    private Car modify(String vin, Consumer<Car> mutation) {
        return OptimisticRetry.update("car " + vin,
                () -> getByVin(vin),
                car -> {
                    mutation.accept(car);
                    car.setLastSeenAt(Instant.now());
                },
                carRepository::update);
    }
}

package com.bbthechange.carshare.service.impl;

import com.bbthechange.carshare.config.CarShareProperties;
import com.bbthechange.carshare.dto.RentalResult;
import com.bbthechange.carshare.event.RentalTransitionEvent;
import com.bbthechange.carshare.exception.ConflictException;
import com.bbthechange.carshare.exception.PreconditionFailedException;
import com.bbthechange.carshare.exception.ResourceNotFoundException;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.Client;
import com.bbthechange.carshare.model.CommandKind;
import com.bbthechange.carshare.model.Rental;
import com.bbthechange.carshare.repository.CarRepository;
import com.bbthechange.carshare.repository.ClientRepository;
import com.bbthechange.carshare.repository.RentalRepository;
import com.bbthechange.carshare.service.CommandChannelService;
import com.bbthechange.carshare.service.FleetService;
import com.bbthechange.carshare.service.RentalService;
import com.bbthechange.carshare.util.GeoDistance;
import com.bbthechange.carshare.util.OptimisticRetry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

@Service
public class RentalServiceImpl implements RentalService {

    private static final Logger logger = LoggerFactory.getLogger(RentalServiceImpl.class);

    private static final String ACTION_START = "start";
    private static final String ACTION_END = "end";

    private final ClientRepository clientRepository;
    private final CarRepository carRepository;
    private final RentalRepository rentalRepository;
    private final FleetService fleetService;
    private final CommandChannelService commandChannelService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final CarShareProperties properties;

    public RentalServiceImpl(ClientRepository clientRepository,
                             CarRepository carRepository,
                             RentalRepository rentalRepository,
                             FleetService fleetService,
                             CommandChannelService commandChannelService,
                             ApplicationEventPublisher eventPublisher,
                             MeterRegistry meterRegistry,
                             CarShareProperties properties) {
        this.clientRepository = clientRepository;
        this.carRepository = carRepository;
        this.rentalRepository = rentalRepository;
        this.fleetService = fleetService;
        this.commandChannelService = commandChannelService;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    @Override
    public RentalResult start(String clientId, String vin) {
        return recordOutcome(ACTION_START, () -> doStart(clientId, vin));
    }

    @Override
    public RentalResult end(String clientId, String vin) {
        return recordOutcome(ACTION_END, () -> doEnd(clientId, vin));
    }

    @Override
    public List<Rental> getRentals(String clientId) {
        loadClient(clientId);
        return rentalRepository.findByClientId(clientId);
    }

    private RentalResult doStart(String clientId, String vin) {
        Client client = loadClient(clientId);
        Car car = fleetService.getByVin(vin);

        if (client.hasActiveRental()) {
            throw new ConflictException("Client already has an active rental (" + client.getActiveRentalVin() + ")");
        }
        if (!car.isAvailable()) {
            throw new ConflictException("Car " + vin + " is not available");
        }
        if (client.getLocation() == null) {
            throw new ValidationException("Client location is unknown; report a location before renting");
        }
        double distanceKm = GeoDistance.haversineKm(client.getLocation(), car.getLocation());
        double maxDistanceKm = properties.getRental().getMaxStartDistanceKm();
        if (distanceKm > maxDistanceKm) {
            throw new ValidationException(String.format("Car %s is %.3f km away; rentals start within %.1f km",
                    vin, distanceKm, maxDistanceKm));
        }

        claimClient(clientId, vin);
        Car rentedCar;
        try {
            rentedCar = claimCar(clientId, vin);
        } catch (RuntimeException e) {
            releaseClient(clientId, vin);
            throw e;
        }

        Rental rental = rentalRepository.save(new Rental(clientId, vin));
        CarCommand unlock = commandChannelService.enqueue(vin, CommandKind.UNLOCK);

        logger.info("Rental {} started: client {} took car {} at {} km", rental.getId(), clientId, vin,
                GeoDistance.roundKm(distanceKm));
        eventPublisher.publishEvent(new RentalTransitionEvent(RentalTransitionEvent.Action.STARTED, rental));
        return new RentalResult(rental, rentedCar, unlock);
    }

    private RentalResult doEnd(String clientId, String vin) {
        Car car = fleetService.getByVin(vin);
        Rental openRental = rentalRepository.findOpenRental(clientId, vin)
                .orElseThrow(() -> new ConflictException("No active rental of car " + vin + " for this client"));
        if (!car.isRentedBy(clientId)) {
            throw new ConflictException("Car " + vin + " is not rented by this client");
        }

        List<String> issues = car.safetyIssues();
        if (!issues.isEmpty()) {
            commandChannelService.enqueueUnlessPending(vin, CommandKind.STATE_QUERY);
            logger.warn("End of rental {} rejected, car {} unsafe: {}", openRental.getId(), vin, issues);
            throw new PreconditionFailedException("Car is not safe to lock", issues);
        }

        Car releasedCar = OptimisticRetry.update("car " + vin,
                () -> fleetService.getByVin(vin),
                current -> {
                    if (!current.isRentedBy(clientId)) {
                        throw new ConflictException("Car " + vin + " is not rented by this client");
                    }
                    List<String> currentIssues = current.safetyIssues();
                    if (!currentIssues.isEmpty()) {
                        throw new PreconditionFailedException("Car is not safe to lock", currentIssues);
                    }
                    current.markAvailable();
                },
                carRepository::update);

        Instant endedAt = Instant.now();
        Rental closed = OptimisticRetry.update("rental " + openRental.getId(),
                () -> rentalRepository.findById(openRental.getId())
                        .orElseThrow(() -> new ResourceNotFoundException("Rental not found: " + openRental.getId())),
                rental -> {
                    if (!rental.isOpen()) {
                        throw new ConflictException("Rental " + rental.getId() + " is already closed");
                    }
                    rental.close(endedAt);
                },
                rentalRepository::update);
        releaseClient(clientId, vin);

        CarCommand lock = commandChannelService.enqueue(vin, CommandKind.LOCK);
        logger.info("Rental {} ended: client {} returned car {}", closed.getId(), clientId, vin);
        eventPublisher.publishEvent(new RentalTransitionEvent(RentalTransitionEvent.Action.ENDED, closed));
        return new RentalResult(closed, releasedCar, lock);
    }

    private void claimClient(String clientId, String vin) {
        OptimisticRetry.update("client " + clientId,
                () -> loadClient(clientId),
                client -> {
                    if (client.hasActiveRental()) {
                        throw new ConflictException("Client already has an active rental (" + client.getActiveRentalVin() + ")");
                    }
                    client.setActiveRentalVin(vin);
                },
                clientRepository::update);
    }

    private Car claimCar(String clientId, String vin) {
        return OptimisticRetry.update("car " + vin,
                () -> fleetService.getByVin(vin),
                car -> {
                    if (!car.isAvailable()) {
                        throw new ConflictException("Car " + vin + " is not available");
                    }
                    car.markRentedBy(clientId);
                },
                carRepository::update);
    }

    private void releaseClient(String clientId, String vin) {
        OptimisticRetry.update("client " + clientId,
                () -> loadClient(clientId),
                client -> {
                    if (vin.equals(client.getActiveRentalVin())) {
                        client.setActiveRentalVin(null);
                    }
                },
                clientRepository::update);
    }

    private Client loadClient(String clientId) {
        return clientRepository.findById(clientId)
                .orElseThrow(() -> new ResourceNotFoundException("Client not found: " + clientId));
    }

    private RentalResult recordOutcome(String action, Supplier<RentalResult> transition) {
        try {
            RentalResult result = transition.get();
            meterRegistry.counter("rental_transition_total", "action", action, "outcome", "ok").increment();
            return result;
        } catch (ConflictException e) {
            meterRegistry.counter("rental_transition_total", "action", action, "outcome", "conflict").increment();
            logger.warn("Rental {} conflict: {}", action, e.getMessage());
            throw e;
        } catch (ValidationException | PreconditionFailedException e) {
            meterRegistry.counter("rental_transition_total", "action", action, "outcome", "rejected").increment();
            throw e;
        }
    }
}

package com.bbthechange.carshare.service.impl;

import com.bbthechange.carshare.config.CarShareProperties;
import com.bbthechange.carshare.dto.RentalResult;
import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.event.RentalTransitionEvent;
import com.bbthechange.carshare.exception.CarNotFoundException;
import com.bbthechange.carshare.exception.ConflictException;
import com.bbthechange.carshare.exception.PreconditionFailedException;
import com.bbthechange.carshare.exception.ResourceNotFoundException;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.CarStatus;
import com.bbthechange.carshare.model.Client;
import com.bbthechange.carshare.model.CommandKind;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.model.Rental;
import com.bbthechange.carshare.model.RentalStatus;
import com.bbthechange.carshare.repository.impl.InMemoryCarCommandRepositoryImpl;
import com.bbthechange.carshare.repository.impl.InMemoryCarRepositoryImpl;
import com.bbthechange.carshare.repository.impl.InMemoryClientRepositoryImpl;
import com.bbthechange.carshare.repository.impl.InMemoryRentalRepositoryImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RentalServiceImplTest {

    private static final Location NEAR_VIN_001 = new Location(47.1590, 27.6010);
    private static final Location FAR_AWAY = new Location(47.30, 27.80);

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryClientRepositoryImpl clientRepository;
    private InMemoryCarRepositoryImpl carRepository;
    private InMemoryRentalRepositoryImpl rentalRepository;
    private CommandChannelServiceImpl commandChannelService;
    private FleetServiceImpl fleetService;
    private SimpleMeterRegistry meterRegistry;
    private RentalServiceImpl rentalService;

    private String clientId;

    @BeforeEach
    void setUp() {
        clientRepository = new InMemoryClientRepositoryImpl();
        carRepository = new InMemoryCarRepositoryImpl();
        rentalRepository = new InMemoryRentalRepositoryImpl();
        InMemoryCarCommandRepositoryImpl commandRepository = new InMemoryCarCommandRepositoryImpl();
        meterRegistry = new SimpleMeterRegistry();

        fleetService = new FleetServiceImpl(carRepository, commandRepository);
        commandChannelService = new CommandChannelServiceImpl(commandRepository, fleetService, eventPublisher, meterRegistry);
        rentalService = new RentalServiceImpl(clientRepository, carRepository, rentalRepository, fleetService,
                commandChannelService, eventPublisher, meterRegistry, new CarShareProperties());

        carRepository.save(new Car("VIN-001", "Hatchback", new Location(47.1585, 27.6014)));
        carRepository.save(new Car("VIN-002", "SUV", new Location(47.1622, 27.5889)));
        clientId = newClient("ana@example.com", NEAR_VIN_001);
    }

    private String newClient(String email, Location location) {
        Client client = new Client("Rider", email, "DL-" + email, "card", "hash");
        client.setLocation(location);
        return clientRepository.save(client).getId();
    }

    private Car car(String vin) {
        return carRepository.findByVin(vin).orElseThrow();
    }

    private Client client(String id) {
        return clientRepository.findById(id).orElseThrow();
    }

    private double transitions(String action, String outcome) {
        return meterRegistry.counter("rental_transition_total", "action", action, "outcome", outcome).count();
    }

    @Nested
    class Start {

        @Test
        void start_NearbyAvailableCar_RentsCarAndQueuesUnlock() {
            // When
            RentalResult result = rentalService.start(clientId, "VIN-001");

            // Then
            assertThat(result.getRental().getStatus()).isEqualTo(RentalStatus.ACTIVE);
            assertThat(result.getRental().getClientId()).isEqualTo(clientId);
            assertThat(result.getCar().getStatus()).isEqualTo(CarStatus.RENTED);
            assertThat(result.getCommand().getKind()).isEqualTo(CommandKind.UNLOCK);

            assertThat(car("VIN-001").isRentedBy(clientId)).isTrue();
            assertThat(client(clientId).getActiveRentalVin()).isEqualTo("VIN-001");
            assertThat(commandChannelService.poll("VIN-001")).extracting(CarCommand::getKind)
                    .containsExactly(CommandKind.UNLOCK);
            assertThat(transitions("start", "ok")).isEqualTo(1.0);
        }

        @Test
        void start_PublishesStartedEvent() {
            rentalService.start(clientId, "VIN-001");

            ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
            verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
            assertThat(captor.getAllValues())
                    .filteredOn(RentalTransitionEvent.class::isInstance)
                    .singleElement()
                    .satisfies(event -> assertThat(((RentalTransitionEvent) event).getAction())
                            .isEqualTo(RentalTransitionEvent.Action.STARTED));
        }

        @Test
        void start_CarFartherThanTwoKm_ThrowsValidationExceptionWithoutChanges() {
            // Given
            String farClient = newClient("far@example.com", FAR_AWAY);

            // When / Then
            assertThatThrownBy(() -> rentalService.start(farClient, "VIN-001"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("km");
            assertThat(car("VIN-001").isAvailable()).isTrue();
            assertThat(client(farClient).hasActiveRental()).isFalse();
            assertThat(rentalRepository.findByClientId(farClient)).isEmpty();
            assertThat(transitions("start", "rejected")).isEqualTo(1.0);
        }

        @Test
        void start_ClientWithoutLocation_ThrowsValidationException() {
            String lost = newClient("lost@example.com", null);

            assertThatThrownBy(() -> rentalService.start(lost, "VIN-001")).isInstanceOf(ValidationException.class);
        }

        @Test
        void start_CarAlreadyRented_ThrowsConflictException() {
            // Given
            String other = newClient("other@example.com", NEAR_VIN_001);
            rentalService.start(other, "VIN-001");

            // When / Then
            assertThatThrownBy(() -> rentalService.start(clientId, "VIN-001"))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("not available");
            assertThat(car("VIN-001").getRentedBy()).isEqualTo(other);
            assertThat(client(clientId).hasActiveRental()).isFalse();
            assertThat(transitions("start", "conflict")).isEqualTo(1.0);
        }

        @Test
        void start_ClientAlreadyRenting_ThrowsConflictException() {
            rentalService.start(clientId, "VIN-001");

            assertThatThrownBy(() -> rentalService.start(clientId, "VIN-002"))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("active rental");
            assertThat(car("VIN-002").isAvailable()).isTrue();
        }

        @Test
        void start_UnknownCar_ThrowsCarNotFoundException() {
            assertThatThrownBy(() -> rentalService.start(clientId, "VIN-404"))
                    .isInstanceOf(CarNotFoundException.class);
        }

        @Test
        void start_UnknownClient_ThrowsResourceNotFoundException() {
            assertThatThrownBy(() -> rentalService.start("ghost", "VIN-001"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void start_ConcurrentRidersSameCar_ExactlyOneWins() throws Exception {
            // Given
            int riders = 6;
            List<String> clientIds = new ArrayList<>();
            for (int i = 0; i < riders; i++) {
                clientIds.add(newClient("rider" + i + "@example.com", NEAR_VIN_001));
            }
            ExecutorService executor = Executors.newFixedThreadPool(riders);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<Boolean>> outcomes = new ArrayList<>();

            // When
            for (String id : clientIds) {
                Callable<Boolean> attempt = () -> {
                    go.await();
                    try {
                        rentalService.start(id, "VIN-001");
                        return true;
                    } catch (ConflictException e) {
                        return false;
                    }
                };
                outcomes.add(executor.submit(attempt));
            }
            go.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            // Then
            int wins = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get()) {
                    wins++;
                }
            }
            assertThat(wins).isEqualTo(1);
            String winner = car("VIN-001").getRentedBy();
            assertThat(clientIds).contains(winner);
            for (String id : clientIds) {
                assertThat(client(id).hasActiveRental()).isEqualTo(id.equals(winner));
            }
        }
    }

    @Nested
    class End {

        @Test
        void end_SafeCar_ReleasesCarClosesRentalAndQueuesLock() {
            // Given
            RentalResult started = rentalService.start(clientId, "VIN-001");

            // When
            RentalResult ended = rentalService.end(clientId, "VIN-001");

            // Then
            assertThat(ended.getRental().getId()).isEqualTo(started.getRental().getId());
            assertThat(ended.getRental().getStatus()).isEqualTo(RentalStatus.ENDED);
            assertThat(ended.getRental().getEndedAt()).isNotNull();
            assertThat(ended.getCommand().getKind()).isEqualTo(CommandKind.LOCK);
            assertThat(car("VIN-001").isAvailable()).isTrue();
            assertThat(car("VIN-001").getRentedBy()).isNull();
            assertThat(client(clientId).hasActiveRental()).isFalse();
            assertThat(commandChannelService.poll("VIN-001")).extracting(CarCommand::getKind)
                    .containsExactly(CommandKind.UNLOCK, CommandKind.LOCK);
        }

        @Test
        void end_DoorsOpenAndLightsOn_ThrowsPreconditionFailedListingBothIssues() {
            // Given
            rentalService.start(clientId, "VIN-001");
            fleetService.applyTelematicsUpdate("VIN-001",
                    TelematicsUpdateRequest.builder().doorsClosed(false).lightsOff(false).build());

            // When / Then
            assertThatThrownBy(() -> rentalService.end(clientId, "VIN-001"))
                    .isInstanceOfSatisfying(PreconditionFailedException.class, e ->
                            assertThat(e.getIssues()).containsExactly(Car.ISSUE_DOORS_OPEN, Car.ISSUE_LIGHTS_ON));

            assertThat(car("VIN-001").isRentedBy(clientId)).isTrue();
            assertThat(client(clientId).getActiveRentalVin()).isEqualTo("VIN-001");
            assertThat(rentalRepository.findOpenRental(clientId, "VIN-001")).isPresent();
            assertThat(transitions("end", "rejected")).isEqualTo(1.0);
        }

        @Test
        void end_UnsafeTwice_QueuesSingleStateQuery() {
            // Given
            rentalService.start(clientId, "VIN-001");
            fleetService.applyTelematicsUpdate("VIN-001", TelematicsUpdateRequest.builder().engineOff(false).build());

            // When
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> rentalService.end(clientId, "VIN-001"))
                        .isInstanceOf(PreconditionFailedException.class);
            }

            // Then
            assertThat(commandChannelService.poll("VIN-001")).extracting(CarCommand::getKind)
                    .containsExactly(CommandKind.UNLOCK, CommandKind.STATE_QUERY);
        }

        @Test
        void end_AfterFixingIssues_Succeeds() {
            rentalService.start(clientId, "VIN-001");
            fleetService.applyTelematicsUpdate("VIN-001", TelematicsUpdateRequest.builder().doorsClosed(false).build());
            assertThatThrownBy(() -> rentalService.end(clientId, "VIN-001"))
                    .isInstanceOf(PreconditionFailedException.class);

            fleetService.applyTelematicsUpdate("VIN-001", TelematicsUpdateRequest.builder().doorsClosed(true).build());

            assertThat(rentalService.end(clientId, "VIN-001").getRental().getStatus()).isEqualTo(RentalStatus.ENDED);
        }

        @Test
        void end_CarRentedBySomeoneElse_ThrowsConflictException() {
            String other = newClient("other@example.com", NEAR_VIN_001);
            rentalService.start(other, "VIN-001");

            assertThatThrownBy(() -> rentalService.end(clientId, "VIN-001"))
                    .isInstanceOf(ConflictException.class);
            assertThat(car("VIN-001").isRentedBy(other)).isTrue();
        }

        @Test
        void end_NoActiveRental_ThrowsConflictException() {
            assertThatThrownBy(() -> rentalService.end(clientId, "VIN-001"))
                    .isInstanceOf(ConflictException.class);
            verify(eventPublisher, never()).publishEvent(any(RentalTransitionEvent.class));
        }

        @Test
        void end_Twice_SecondThrowsConflictException() {
            rentalService.start(clientId, "VIN-001");
            rentalService.end(clientId, "VIN-001");

            assertThatThrownBy(() -> rentalService.end(clientId, "VIN-001"))
                    .isInstanceOf(ConflictException.class);
            assertThat(transitions("end", "ok")).isEqualTo(1.0);
            assertThat(transitions("end", "conflict")).isEqualTo(1.0);
        }

        @Test
        void end_ConcurrentEndsSameRental_ExactlyOneWins() throws Exception {
            // Given
            rentalService.start(clientId, "VIN-001");
            int attempts = 8;
            ExecutorService executor = Executors.newFixedThreadPool(attempts);
            CountDownLatch go = new CountDownLatch(1);
            AtomicReference<RentalResult> winning = new AtomicReference<>();
            List<Future<Boolean>> outcomes = new ArrayList<>();

            // When
            for (int i = 0; i < attempts; i++) {
                Callable<Boolean> attempt = () -> {
                    go.await();
                    try {
                        winning.set(rentalService.end(clientId, "VIN-001"));
                        return true;
                    } catch (ConflictException e) {
                        return false;
                    }
                };
                outcomes.add(executor.submit(attempt));
            }
            go.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            // Then
            int wins = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get()) {
                    wins++;
                }
            }
            assertThat(wins).isEqualTo(1);
            assertThat(transitions("end", "ok")).isEqualTo(1.0);
            assertThat(transitions("end", "conflict")).isEqualTo(attempts - 1.0);

            List<Rental> rentals = rentalRepository.findByClientId(clientId);
            assertThat(rentals).hasSize(1);
            assertThat(rentals.get(0).getStatus()).isEqualTo(RentalStatus.ENDED);
            assertThat(rentals.get(0).getEndedAt()).isEqualTo(winning.get().getRental().getEndedAt());
            assertThat(car("VIN-001").isAvailable()).isTrue();
            assertThat(client(clientId).hasActiveRental()).isFalse();
            assertThat(commandChannelService.poll("VIN-001")).extracting(CarCommand::getKind)
                    .containsExactly(CommandKind.UNLOCK, CommandKind.LOCK);
        }
    }

    @Test
    void getRentals_ReturnsHistoryIncludingClosedRentals() {
        // Given
        rentalService.start(clientId, "VIN-001");
        rentalService.end(clientId, "VIN-001");
        rentalService.start(clientId, "VIN-001");

        // When
        List<Rental> rentals = rentalService.getRentals(clientId);

        // Then
        assertThat(rentals).hasSize(2);
        assertThat(rentals).filteredOn(Rental::isOpen).hasSize(1);
    }

    @Test
    void getRentals_UnknownClient_ThrowsResourceNotFoundException() {
        assertThatThrownBy(() -> rentalService.getRentals("ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}

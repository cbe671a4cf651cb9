package com.bbthechange.carshare.service.impl;

import com.bbthechange.carshare.event.CommandEnqueuedEvent;
import com.bbthechange.carshare.exception.CommandNotFoundException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.CommandKind;
import com.bbthechange.carshare.model.CommandStatus;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.repository.impl.InMemoryCarCommandRepositoryImpl;
import com.bbthechange.carshare.repository.impl.InMemoryCarRepositoryImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandChannelServiceImplTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryCarRepositoryImpl carRepository;
    private SimpleMeterRegistry meterRegistry;
    private CommandChannelServiceImpl commandChannelService;

    @BeforeEach
    void setUp() {
        carRepository = new InMemoryCarRepositoryImpl();
        carRepository.save(new Car("VIN-001", "Hatchback", new Location(47.1585, 27.6014)));
        carRepository.save(new Car("VIN-002", "SUV", new Location(47.1622, 27.5889)));

        InMemoryCarCommandRepositoryImpl commandRepository = new InMemoryCarCommandRepositoryImpl();
        meterRegistry = new SimpleMeterRegistry();
        commandChannelService = new CommandChannelServiceImpl(commandRepository,
                new FleetServiceImpl(carRepository, commandRepository), eventPublisher, meterRegistry);
    }

    @Test
    void enqueue_PublishesEventAndCounts() {
        // When
        CarCommand command = commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);

        // Then
        ArgumentCaptor<CommandEnqueuedEvent> captor = ArgumentCaptor.forClass(CommandEnqueuedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getCommand().getId()).isEqualTo(command.getId());
        assertThat(meterRegistry.counter("car_command_total", "kind", "unlock", "event", "enqueued").count())
                .isEqualTo(1.0);
    }

    @Test
    void poll_ReturnsPendingInFifoOrderAndMarksCarSeen() {
        // Given
        CarCommand unlock = commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);
        CarCommand lock = commandChannelService.enqueue("VIN-001", CommandKind.LOCK);
        commandChannelService.enqueue("VIN-002", CommandKind.UNLOCK);

        // When
        List<CarCommand> pending = commandChannelService.poll("VIN-001");

        // Then
        assertThat(pending).extracting(CarCommand::getId).containsExactly(unlock.getId(), lock.getId());
        assertThat(carRepository.findByVin("VIN-001").orElseThrow().getLastSeenAt()).isNotNull();
    }

    @Test
    void poll_DoesNotConsumeCommands() {
        commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);

        commandChannelService.poll("VIN-001");

        assertThat(commandChannelService.poll("VIN-001")).hasSize(1);
    }

    @Test
    void ack_SuccessfulUnlock_MarksAckedAndUnlocksCar() {
        // Given
        CarCommand unlock = commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);

        // When
        CarCommand acked = commandChannelService.ack("VIN-001", unlock.getId(), true, "done");

        // Then
        assertThat(acked.getStatus()).isEqualTo(CommandStatus.ACKNOWLEDGED);
        assertThat(acked.getAckedAt()).isNotNull();
        assertThat(acked.getNote()).isEqualTo("done");
        assertThat(carRepository.findByVin("VIN-001").orElseThrow().isLocked()).isFalse();
        assertThat(commandChannelService.poll("VIN-001")).isEmpty();
        assertThat(meterRegistry.counter("car_command_total", "kind", "unlock", "event", "acknowledged").count())
                .isEqualTo(1.0);
    }

    @Test
    void ack_FailedUnlock_LeavesCarLocked() {
        CarCommand unlock = commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);

        CarCommand acked = commandChannelService.ack("VIN-001", unlock.getId(), false, "actuator jammed");

        assertThat(acked.getSuccess()).isFalse();
        assertThat(carRepository.findByVin("VIN-001").orElseThrow().isLocked()).isTrue();
    }

    @Test
    void ack_SuccessfulLock_LocksCar() {
        // Given - car currently unlocked
        commandChannelService.ack("VIN-001", commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK).getId(), true, null);
        CarCommand lock = commandChannelService.enqueue("VIN-001", CommandKind.LOCK);

        // When
        commandChannelService.ack("VIN-001", lock.getId(), true, null);

        // Then
        assertThat(carRepository.findByVin("VIN-001").orElseThrow().isLocked()).isTrue();
    }

    @Test
    void ack_Twice_SecondThrowsCommandNotFoundException() {
        CarCommand unlock = commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);
        commandChannelService.ack("VIN-001", unlock.getId(), true, null);

        assertThatThrownBy(() -> commandChannelService.ack("VIN-001", unlock.getId(), true, null))
                .isInstanceOf(CommandNotFoundException.class)
                .hasMessageContaining("already acknowledged");
    }

    @Test
    void ack_CommandOfOtherCar_ThrowsCommandNotFoundException() {
        CarCommand unlock = commandChannelService.enqueue("VIN-001", CommandKind.UNLOCK);

        assertThatThrownBy(() -> commandChannelService.ack("VIN-002", unlock.getId(), true, null))
                .isInstanceOf(CommandNotFoundException.class);
        assertThat(commandChannelService.pendingCount("VIN-001")).isEqualTo(1);
    }

    @Test
    void ack_UnknownCommand_ThrowsCommandNotFoundException() {
        assertThatThrownBy(() -> commandChannelService.ack("VIN-001", "missing", true, null))
                .isInstanceOf(CommandNotFoundException.class)
                .hasMessage("Command not found: missing");
    }

    @Test
    void enqueueUnlessPending_SameKindAlreadyQueued_ReturnsEmpty() {
        // Given
        Optional<CarCommand> first = commandChannelService.enqueueUnlessPending("VIN-001", CommandKind.STATE_QUERY);

        // When
        Optional<CarCommand> second = commandChannelService.enqueueUnlessPending("VIN-001", CommandKind.STATE_QUERY);

        // Then
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(commandChannelService.pendingCount("VIN-001")).isEqualTo(1);
    }

    @Test
    void enqueueUnlessPending_AfterAck_QueuesAgain() {
        CarCommand query = commandChannelService.enqueueUnlessPending("VIN-001", CommandKind.STATE_QUERY).orElseThrow();
        commandChannelService.ack("VIN-001", query.getId(), true, null);

        assertThat(commandChannelService.enqueueUnlessPending("VIN-001", CommandKind.STATE_QUERY)).isPresent();
    }

    @Test
    void findPending_MatchesOnlyPendingCommandOfSameCar() {
        CarCommand query = commandChannelService.enqueue("VIN-001", CommandKind.STATE_QUERY);

        assertThat(commandChannelService.findPending("VIN-001", query.getId())).isPresent();
        assertThat(commandChannelService.findPending("VIN-002", query.getId())).isEmpty();
        assertThat(commandChannelService.findPending("VIN-001", null)).isEmpty();
    }
}

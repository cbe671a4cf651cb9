package com.bbthechange.carshare.service.impl;

import com.bbthechange.carshare.event.CommandEnqueuedEvent;
import com.bbthechange.carshare.exception.CommandNotFoundException;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.CommandKind;
import com.bbthechange.carshare.repository.CarCommandRepository;
import com.bbthechange.carshare.service.CommandChannelService;
import com.bbthechange.carshare.service.FleetService;
import com.bbthechange.carshare.util.OptimisticRetry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Service
public class CommandChannelServiceImpl implements CommandChannelService {

    private static final Logger logger = LoggerFactory.getLogger(CommandChannelServiceImpl.class);

    private final CarCommandRepository carCommandRepository;
    private final FleetService fleetService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    // Serializes check-then-enqueue per VIN
    private final ConcurrentMap<String, Object> enqueueLocks = new ConcurrentHashMap<>();

    public CommandChannelServiceImpl(CarCommandRepository carCommandRepository,
                                     FleetService fleetService,
                                     ApplicationEventPublisher eventPublisher,
                                     MeterRegistry meterRegistry) {
        this.carCommandRepository = carCommandRepository;
        this.fleetService = fleetService;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public CarCommand enqueue(String vin, CommandKind kind) {
        CarCommand saved = carCommandRepository.save(new CarCommand(vin, kind));
        logger.info("Queued {} command {} for {} (seq {})", kind, saved.getId(), vin, saved.getSequence());
        meterRegistry.counter("car_command_total", "kind", kind.getAction(), "event", "enqueued").increment();
        eventPublisher.publishEvent(new CommandEnqueuedEvent(saved));
        return saved;
    }

    @Override
    public Optional<CarCommand> enqueueUnlessPending(String vin, CommandKind kind) {
        synchronized (enqueueLocks.computeIfAbsent(vin, k -> new Object())) {
            boolean alreadyQueued = carCommandRepository.findPendingByVin(vin).stream()
                    .anyMatch(command -> command.getKind() == kind);
            if (alreadyQueued) {
                logger.debug("{} already pending for {}, not queueing another", kind, vin);
                return Optional.empty();
            }
            return Optional.of(enqueue(vin, kind));
        }
    }

    @Override
    public List<CarCommand> poll(String vin) {
        fleetService.recordSeen(vin);
        List<CarCommand> pending = carCommandRepository.findPendingByVin(vin);
        logger.debug("Car {} polled {} pending commands", vin, pending.size());
        return pending;
    }

    @Override
    public CarCommand ack(String vin, String commandId, boolean success, String note) {
        CarCommand acked = OptimisticRetry.update("command " + commandId,
                () -> carCommandRepository.findById(commandId)
                        .filter(command -> command.getVin().equals(vin))
                        .orElseThrow(() -> new CommandNotFoundException("Command not found: " + commandId)),
                command -> {
                    if (!command.isPending()) {
                        throw new CommandNotFoundException("Command already acknowledged: " + commandId);
                    }
                    command.acknowledge(success, note);
                },
                carCommandRepository::update);

        logger.info("Car {} acked {} command {}: success={} note={}", vin, acked.getKind(), commandId, success, note);
        meterRegistry.counter("car_command_total", "kind", acked.getKind().getAction(), "event", "acknowledged").increment();

        if (success && acked.getKind().changesLock()) {
            fleetService.setLocked(vin, acked.getKind() == CommandKind.LOCK);
        } else {
            fleetService.recordSeen(vin);
        }
        return acked;
    }

    @Override
    public Optional<CarCommand> findPending(String vin, String commandId) {
        if (commandId == null) {
            return Optional.empty();
        }
        return carCommandRepository.findById(commandId)
                .filter(command -> command.getVin().equals(vin))
                .filter(CarCommand::isPending);
    }

    @Override
    public long pendingCount(String vin) {
        return carCommandRepository.countPendingByVin(vin);
    }
}

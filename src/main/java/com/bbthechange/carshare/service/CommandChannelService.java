package com.bbthechange.carshare.service;

import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.CommandKind;

import java.util.List;
import java.util.Optional;

/**
 * Per-vehicle FIFO queue of commands, drained by polling or by a connected channel.
 */
public interface CommandChannelService {

    /**
     * Append a PENDING command and notify any connected channel. Never waits on the vehicle.
     */
    CarCommand enqueue(String vin, CommandKind kind);

    /**
     * Enqueue unless a command of the same kind is already pending for the car.
     * @return the new command, or empty if one was already queued
     */
    Optional<CarCommand> enqueueUnlessPending(String vin, CommandKind kind);

    /**
     * Pending commands of the car in enqueue order. Does not acknowledge anything.
     */
    List<CarCommand> poll(String vin);

    /**
     * Acknowledge a pending command of this car. Unknown ids, commands of other cars and
     * repeated acks fail with CommandNotFoundException. A successful lock or unlock ack
     * updates the car's locked flag.
     */
    CarCommand ack(String vin, String commandId, boolean success, String note);

    Optional<CarCommand> findPending(String vin, String commandId);

    long pendingCount(String vin);
}

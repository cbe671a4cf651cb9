package com.bbthechange.carshare.event;

import com.bbthechange.carshare.model.CarCommand;

/**
 * Published after a command is appended to a car's queue.
 */
public class CommandEnqueuedEvent {

    private final CarCommand command;

    public CommandEnqueuedEvent(CarCommand command) {
        this.command = command;
    }

    public CarCommand getCommand() {
        return command;
    }

    public String getVin() {
        return command.getVin();
    }
}

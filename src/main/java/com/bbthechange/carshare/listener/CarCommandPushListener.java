package com.bbthechange.carshare.listener;

import com.bbthechange.carshare.event.CommandEnqueuedEvent;
import com.bbthechange.carshare.websocket.ChannelMessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Pushes newly queued commands to the car when it is connected on the channel.
 * Cars that are not connected pick the command up on their next poll.
 */
@Component
public class CarCommandPushListener {

    private static final Logger logger = LoggerFactory.getLogger(CarCommandPushListener.class);

    private final ChannelMessageDispatcher dispatcher;

    public CarCommandPushListener(ChannelMessageDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @EventListener
    public void onCommandEnqueued(CommandEnqueuedEvent event) {
        try {
            if (dispatcher.pushCommand(event.getCommand())) {
                logger.debug("Pushed {} command {} to {}", event.getCommand().getKind(), event.getCommand().getId(), event.getVin());
            } else {
                logger.debug("Car {} not connected, command {} waits for poll", event.getVin(), event.getCommand().getId());
            }
        } catch (Exception e) {
            // The command stays queued; the car still receives it by polling or on reconnect
            logger.error("Error pushing command {} to {}", event.getCommand().getId(), event.getVin(), e);
        }
    }
}

package com.bbthechange.carshare.listener;

import com.bbthechange.carshare.event.RentalTransitionEvent;
import com.bbthechange.carshare.websocket.ChannelMessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Sends NOTIFY to the rider's channel connection on rental transitions.
 */
@Component
public class RentalNotificationListener {

    private static final Logger logger = LoggerFactory.getLogger(RentalNotificationListener.class);

    private final ChannelMessageDispatcher dispatcher;

    public RentalNotificationListener(ChannelMessageDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @EventListener
    public void onRentalTransition(RentalTransitionEvent event) {
        String text = event.getAction() == RentalTransitionEvent.Action.STARTED
                ? "Car " + event.getVin() + " unlock requested"
                : "Rental " + event.getRental().getId() + " ended, car " + event.getVin() + " lock requested";
        try {
            boolean sent = dispatcher.notifyRider(event.getClientId(), text);
            logger.debug("Rental {} {} notification for {}: {}", event.getRental().getId(), event.getAction(),
                    event.getClientId(), sent ? "sent" : "rider not connected");
        } catch (Exception e) {
            logger.error("Error notifying rider {} of rental {}", event.getClientId(), event.getRental().getId(), e);
        }
    }
}

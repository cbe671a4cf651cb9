package com.bbthechange.carshare.event;

import com.bbthechange.carshare.model.Rental;

/**
 * Published after a rental started or ended successfully.
 */
public class RentalTransitionEvent {

    public enum Action {
        STARTED,
        ENDED
    }

    private final Action action;
    private final Rental rental;

    public RentalTransitionEvent(Action action, Rental rental) {
        this.action = action;
        this.rental = rental;
    }

    public Action getAction() {
        return action;
    }

    public Rental getRental() {
        return rental;
    }

    public String getClientId() {
        return rental.getClientId();
    }

    public String getVin() {
        return rental.getVin();
    }
}

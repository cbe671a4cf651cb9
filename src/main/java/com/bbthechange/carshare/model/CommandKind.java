package com.bbthechange.carshare.model;

/**
 * Instructions the backend can queue for a vehicle.
 */
public enum CommandKind {
    UNLOCK("unlock"),
    LOCK("lock"),
    STATE_QUERY("state_query");

    private final String action;

    CommandKind(String action) {
        this.action = action;
    }

    /**
     * Lower-case name used on the car-client wire format.
     */
    public String getAction() {
        return action;
    }

    public boolean changesLock() {
        return this == UNLOCK || this == LOCK;
    }
}

package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A fleet vehicle identified by its VIN.
 *
 * Status and {@code rentedBy} only change together through {@link #markRentedBy(String)} and
 * {@link #markAvailable()}, so {@code status == RENTED} holds exactly when {@code rentedBy} is set.
 * The telematics flags reflect the last report from the vehicle and are not validated here.
 */
public class Car extends BaseItem {

    public static final String ISSUE_DOORS_OPEN = "doors_open";
    public static final String ISSUE_LIGHTS_ON = "lights_on";
    public static final String ISSUE_ENGINE_ON = "engine_on";

    private String vin;
    private String model;
    private Location location;
    private CarStatus status = CarStatus.AVAILABLE;
    private String rentedBy;

    // Telematics snapshot
    private boolean doorsClosed = true;
    private boolean lightsOff = true;
    private boolean engineOff = true;
    private boolean locked = true;
    private int batteryPct = 100;
    private Instant lastSeenAt;

    // Default constructor for serialization
    public Car() {
        super();
    }

    public Car(String vin, String model, Location location) {
        super();
        this.vin = vin;
        this.model = model;
        this.location = location;
    }

    public Car(Car other) {
        super(other);
        this.vin = other.vin;
        this.model = other.model;
        this.location = other.location != null ? new Location(other.location) : null;
        this.status = other.status;
        this.rentedBy = other.rentedBy;
        this.doorsClosed = other.doorsClosed;
        this.lightsOff = other.lightsOff;
        this.engineOff = other.engineOff;
        this.locked = other.locked;
        this.batteryPct = other.batteryPct;
        this.lastSeenAt = other.lastSeenAt;
    }

    @Override
    public String getKey() {
        return vin;
    }

    public String getVin() {
        return vin;
    }

    public void setVin(String vin) {
        this.vin = vin;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public CarStatus getStatus() {
        return status;
    }

    public String getRentedBy() {
        return rentedBy;
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status == CarStatus.AVAILABLE;
    }

    public boolean isRentedBy(String clientId) {
        return status == CarStatus.RENTED && rentedBy != null && rentedBy.equals(clientId);
    }

    public void markRentedBy(String clientId) {
        if (clientId == null) {
            throw new IllegalArgumentException("A rented car needs a renter");
        }
        this.status = CarStatus.RENTED;
        this.rentedBy = clientId;
    }

    public void markAvailable() {
        this.status = CarStatus.AVAILABLE;
        this.rentedBy = null;
    }

    public boolean isDoorsClosed() {
        return doorsClosed;
    }

    public void setDoorsClosed(boolean doorsClosed) {
        this.doorsClosed = doorsClosed;
    }

    public boolean isLightsOff() {
        return lightsOff;
    }

    public void setLightsOff(boolean lightsOff) {
        this.lightsOff = lightsOff;
    }

    public boolean isEngineOff() {
        return engineOff;
    }

    public void setEngineOff(boolean engineOff) {
        this.engineOff = engineOff;
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public int getBatteryPct() {
        return batteryPct;
    }

    public void setBatteryPct(int batteryPct) {
        this.batteryPct = Math.max(0, Math.min(100, batteryPct));
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    /**
     * Flags that keep the car from being handed back, in a fixed order.
     * Empty when doors are closed, lights are off and the engine is off.
     */
    public List<String> safetyIssues() {
        List<String> issues = new ArrayList<>();
        if (!doorsClosed) {
            issues.add(ISSUE_DOORS_OPEN);
        }
        if (!lightsOff) {
            issues.add(ISSUE_LIGHTS_ON);
        }
        if (!engineOff) {
            issues.add(ISSUE_ENGINE_ON);
        }
        return issues;
    }

    @Override
    public String toString() {
        return "Car{vin=" + vin + ", status=" + status + ", rentedBy=" + rentedBy + ", locked=" + locked + "}";
    }
}

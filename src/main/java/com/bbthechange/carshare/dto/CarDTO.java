package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarStatus;
import com.bbthechange.carshare.model.Location;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Car snapshot returned to riders, optionally annotated with the distance from the rider.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CarDTO {

    private String vin;
    private String model;
    private Location location;
    private CarStatus status;
    private String rentedBy;
    private TelematicsDTO telematics;
    private int batteryPct;
    private Instant lastSeenAt;
    private Double distanceKm;

    public CarDTO() {}

    public CarDTO(Car car) {
        this.vin = car.getVin();
        this.model = car.getModel();
        this.location = car.getLocation();
        this.status = car.getStatus();
        this.rentedBy = car.getRentedBy();
        this.telematics = new TelematicsDTO(car.isLocked(), car.isDoorsClosed(), car.isLightsOff(), car.isEngineOff());
        this.batteryPct = car.getBatteryPct();
        this.lastSeenAt = car.getLastSeenAt();
    }

    public CarDTO(Car car, double distanceKm) {
        this(car);
        this.distanceKm = distanceKm;
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

    public void setStatus(CarStatus status) {
        this.status = status;
    }

    public String getRentedBy() {
        return rentedBy;
    }

    public void setRentedBy(String rentedBy) {
        this.rentedBy = rentedBy;
    }

    public TelematicsDTO getTelematics() {
        return telematics;
    }

    public void setTelematics(TelematicsDTO telematics) {
        this.telematics = telematics;
    }

    public int getBatteryPct() {
        return batteryPct;
    }

    public void setBatteryPct(int batteryPct) {
        this.batteryPct = batteryPct;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public Double getDistanceKm() {
        return distanceKm;
    }

    public void setDistanceKm(Double distanceKm) {
        this.distanceKm = distanceKm;
    }
}

package com.bbthechange.carshare.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class HeartbeatResponse {

    private String vin;
    private long pendingCommands;
    private CarDTO car;

    public HeartbeatResponse() {}

    public HeartbeatResponse(String vin, long pendingCommands, CarDTO car) {
        this.vin = vin;
        this.pendingCommands = pendingCommands;
        this.car = car;
    }

    public String getVin() {
        return vin;
    }

    public void setVin(String vin) {
        this.vin = vin;
    }

    @JsonProperty("pending_commands")
    public long getPendingCommands() {
        return pendingCommands;
    }

    public void setPendingCommands(long pendingCommands) {
        this.pendingCommands = pendingCommands;
    }

    public CarDTO getCar() {
        return car;
    }

    public void setCar(CarDTO car) {
        this.car = car;
    }
}

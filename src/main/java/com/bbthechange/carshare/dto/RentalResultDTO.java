package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.Rental;
import com.fasterxml.jackson.annotation.JsonProperty;

public class RentalResultDTO {

    private String message;
    private Rental rental;
    private CarDTO car;
    private CarCommandDTO carCommand;

    public RentalResultDTO() {}

    public RentalResultDTO(String message, RentalResult result) {
        this.message = message;
        this.rental = result.getRental();
        this.car = new CarDTO(result.getCar());
        this.carCommand = result.getCommand() != null ? new CarCommandDTO(result.getCommand()) : null;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Rental getRental() {
        return rental;
    }

    public void setRental(Rental rental) {
        this.rental = rental;
    }

    public CarDTO getCar() {
        return car;
    }

    public void setCar(CarDTO car) {
        this.car = car;
    }

    @JsonProperty("car_command")
    public CarCommandDTO getCarCommand() {
        return carCommand;
    }

    public void setCarCommand(CarCommandDTO carCommand) {
        this.carCommand = carCommand;
    }
}

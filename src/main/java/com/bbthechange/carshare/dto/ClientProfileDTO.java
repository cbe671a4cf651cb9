package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.Client;
import com.bbthechange.carshare.model.Location;

/**
 * Public view of a client. Never carries the PIN hash.
 */
public class ClientProfileDTO {

    private String id;
    private String name;
    private String email;
    private String driverLicense;
    private String paymentMethod;
    private Location location;
    private String activeRentalVin;

    public ClientProfileDTO() {}

    public ClientProfileDTO(Client client) {
        this.id = client.getId();
        this.name = client.getName();
        this.email = client.getEmail();
        this.driverLicense = client.getDriverLicense();
        this.paymentMethod = client.getPaymentMethod();
        this.location = client.getLocation();
        this.activeRentalVin = client.getActiveRentalVin();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getDriverLicense() {
        return driverLicense;
    }

    public void setDriverLicense(String driverLicense) {
        this.driverLicense = driverLicense;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public String getActiveRentalVin() {
        return activeRentalVin;
    }

    public void setActiveRentalVin(String activeRentalVin) {
        this.activeRentalVin = activeRentalVin;
    }
}

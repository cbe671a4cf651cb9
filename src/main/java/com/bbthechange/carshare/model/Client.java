package com.bbthechange.carshare.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A registered rider. Holds at most one active rental at a time ({@code activeRentalVin}).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(exclude = "pinHash")
@NoArgsConstructor
public class Client extends BaseItem {

    private String id;
    private String name;
    private String email;              // Always stored lower-cased
    private String driverLicense;
    private String paymentMethod;      // Opaque payment reference, never charged here
    private String pinHash;            // BCrypt hash of the PIN
    private Integer age;
    private LocalDate licenseValidUntil;
    private Location location;         // Last position reported by the rider
    private String activeRentalVin;

    public Client(String name, String email, String driverLicense, String paymentMethod, String pinHash) {
        super();
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.email = email;
        this.driverLicense = driverLicense;
        this.paymentMethod = paymentMethod;
        this.pinHash = pinHash;
    }

    public Client(Client other) {
        super(other);
        this.id = other.id;
        this.name = other.name;
        this.email = other.email;
        this.driverLicense = other.driverLicense;
        this.paymentMethod = other.paymentMethod;
        this.pinHash = other.pinHash;
        this.age = other.age;
        this.licenseValidUntil = other.licenseValidUntil;
        this.location = other.location != null ? new Location(other.location) : null;
        this.activeRentalVin = other.activeRentalVin;
    }

    @Override
    public String getKey() {
        return id;
    }

    public boolean hasActiveRental() {
        return activeRentalVin != null;
    }
}

package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.Location;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rider registration profile. Accepts both camelCase and the snake_case names used by the CLI client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterClientRequest {

    @NotBlank(message = "name is required")
    @JsonAlias("fullName")
    private String name;

    @NotBlank(message = "email is required")
    @Email(message = "email is malformed")
    private String email;

    @NotBlank(message = "driverLicense is required")
    @JsonAlias({"driver_license", "drivingLicenseNumber"})
    private String driverLicense;

    @NotBlank(message = "paymentMethod is required")
    @JsonAlias({"payment_method", "paymentToken"})
    private String paymentMethod;

    @NotBlank(message = "pin is required")
    @Pattern(regexp = "\\d{4,8}", message = "pin must be 4 to 8 digits")
    private String pin;

    private Integer age;

    @JsonAlias("license_valid_until")
    private String licenseValidUntil;

    private Location location;

    public RegisterClientRequest(String name, String email, String driverLicense, String paymentMethod, String pin) {
        this.name = name;
        this.email = email;
        this.driverLicense = driverLicense;
        this.paymentMethod = paymentMethod;
        this.pin = pin;
    }
}

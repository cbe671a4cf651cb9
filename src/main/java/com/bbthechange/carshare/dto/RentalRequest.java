package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.Location;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of /rentals/start and /rentals/end. The location, when present, updates the rider's position first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RentalRequest {

    @NotBlank(message = "vin is required")
    private String vin;

    private Location location;

    public RentalRequest(String vin) {
        this.vin = vin;
    }
}

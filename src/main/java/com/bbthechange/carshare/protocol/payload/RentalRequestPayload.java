package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.protocol.MessagePayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * START_RENTAL and END_RENTAL. END_RENTAL may omit the VIN to end the rider's active rental.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RentalRequestPayload implements MessagePayload {

    private String vin;

    public boolean hasVin() {
        return vin != null && !vin.isBlank();
    }
}

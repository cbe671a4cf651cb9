package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.protocol.MessagePayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryCarsPayload implements MessagePayload {

    private Location location;

    @Override
    public void validate() {
        if (location != null && !location.isValid()) {
            throw new ValidationException("location must have lat in [-90, 90] and lon in [-180, 180]");
        }
    }
}

package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.dto.CarDTO;
import com.bbthechange.carshare.dto.RentalResult;
import com.bbthechange.carshare.model.Rental;
import com.bbthechange.carshare.protocol.MessagePayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RentalResultPayload implements MessagePayload {

    private Rental rental;
    private CarDTO car;

    public RentalResultPayload(RentalResult result) {
        this(result.getRental(), new CarDTO(result.getCar()));
    }
}

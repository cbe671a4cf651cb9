package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.protocol.MessagePayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CAR_UNLOCK, CAR_LOCK and CAR_STATE_QUERY pushed to a connected car.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CarCommandPayload implements MessagePayload {

    private String vin;
    private String commandId;
    private String action;

    public CarCommandPayload(CarCommand command) {
        this(command.getVin(), command.getId(), command.getKind().getAction());
    }
}

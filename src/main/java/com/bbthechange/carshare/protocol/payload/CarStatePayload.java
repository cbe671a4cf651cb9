package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.protocol.MessagePayload;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CAR_STATE_RESPONSE: the car's telematics, optionally acknowledging the command named
 * by the envelope's correlationId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarStatePayload implements MessagePayload {

    private String vin;

    @JsonAlias("doors_closed")
    private Boolean doorsClosed;

    @JsonAlias("lights_off")
    private Boolean lightsOff;

    @JsonAlias("engine_off")
    private Boolean engineOff;

    private Boolean locked;

    @JsonAlias("battery_pct")
    private Integer batteryPct;

    private Boolean success;
    private String note;

    @Override
    public void validate() {
        if (vin == null || vin.isBlank()) {
            throw new ValidationException("CAR_STATE_RESPONSE requires a vin");
        }
    }

    public TelematicsUpdateRequest toTelematicsUpdate() {
        return new TelematicsUpdateRequest(doorsClosed, lightsOff, engineOff, locked, batteryPct);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return success == null || success;
    }
}

package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.protocol.MessagePayload;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CarConnectPayload implements MessagePayload {

    private String vin;

    @JsonAlias("api_key")
    private String apiKey;

    @Override
    public void validate() {
        if (vin == null || vin.isBlank()) {
            throw new ValidationException("CAR_CONNECT requires a vin");
        }
    }
}

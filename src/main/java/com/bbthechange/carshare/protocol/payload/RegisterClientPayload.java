package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.dto.RegisterClientRequest;
import com.bbthechange.carshare.protocol.MessagePayload;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * REGISTER_CLIENT: either a rider token to bind this connection to an existing session,
 * or a full registration profile for a new rider.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class RegisterClientPayload extends RegisterClientRequest implements MessagePayload {

    private String token;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}

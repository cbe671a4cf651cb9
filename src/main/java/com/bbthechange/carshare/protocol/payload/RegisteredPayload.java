package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.dto.ClientProfileDTO;
import com.bbthechange.carshare.protocol.MessagePayload;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REGISTER_CLIENT_OK. Riders get their profile and token; cars get a message and their car token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegisteredPayload implements MessagePayload {

    private ClientProfileDTO client;
    private String token;
    private String message;

    public static RegisteredPayload rider(ClientProfileDTO client, String token) {
        return new RegisteredPayload(client, token, null);
    }

    public static RegisteredPayload car(String message, String token) {
        return new RegisteredPayload(null, token, message);
    }
}

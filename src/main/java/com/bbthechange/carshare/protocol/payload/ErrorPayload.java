package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.protocol.MessagePayload;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorPayload implements MessagePayload {

    private String reason;
    private String code;
    private List<String> issues;
    private String recommendedAction;

    public ErrorPayload(String reason, String code) {
        this.reason = reason;
        this.code = code;
    }
}

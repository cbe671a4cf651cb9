package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.protocol.MessagePayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyPayload implements MessagePayload {

    private String message;
}

package com.bbthechange.carshare.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelematicsDTO {

    private boolean locked;
    private boolean doorsClosed;
    private boolean lightsOff;
    private boolean engineOff;
}

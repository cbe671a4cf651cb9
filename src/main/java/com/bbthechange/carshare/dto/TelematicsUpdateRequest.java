package com.bbthechange.carshare.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial telematics report. Absent fields are left unchanged.
 * Used by heartbeats, the simulation PATCH endpoint and channel state responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelematicsUpdateRequest {

    @JsonAlias("doors_closed")
    private Boolean doorsClosed;

    @JsonAlias("lights_off")
    private Boolean lightsOff;

    @JsonAlias("engine_off")
    private Boolean engineOff;

    private Boolean locked;

    @JsonAlias("battery_pct")
    private Integer batteryPct;

    public boolean hasUpdates() {
        return doorsClosed != null || lightsOff != null || engineOff != null || locked != null || batteryPct != null;
    }
}

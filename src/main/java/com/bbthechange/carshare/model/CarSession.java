package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Session of a vehicle's telematics client. Authorizes heartbeat, command poll and ack calls for one VIN.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class CarSession extends BaseItem {

    private String sessionId;
    private String vin;
    private Instant expiresAt;

    public CarSession(String vin, Duration ttl) {
        super();
        this.sessionId = UUID.randomUUID().toString();
        this.vin = vin;
        this.expiresAt = getCreatedAt().plus(ttl);
    }

    public CarSession(CarSession other) {
        super(other);
        this.sessionId = other.sessionId;
        this.vin = other.vin;
        this.expiresAt = other.expiresAt;
    }

    @Override
    public String getKey() {
        return sessionId;
    }

    @JsonIgnore
    public boolean isExpired() {
        return expiresAt != null && expiresAt.isBefore(Instant.now());
    }
}

package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Rider login session. The bearer token handed to the rider references this record by id.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Session extends BaseItem {

    private String sessionId;
    private String clientId;
    private Instant expiresAt;

    public Session(String clientId, Duration ttl) {
        super();
        this.sessionId = UUID.randomUUID().toString();
        this.clientId = clientId;
        this.expiresAt = getCreatedAt().plus(ttl);
    }

    public Session(Session other) {
        super(other);
        this.sessionId = other.sessionId;
        this.clientId = other.clientId;
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

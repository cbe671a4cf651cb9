package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One rental of a car by a client. Open while {@code endedAt} is null.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Rental extends BaseItem {

    private String id;
    private String clientId;
    private String vin;
    private Instant startedAt;
    private Instant endedAt;
    private RentalStatus status;

    public Rental(String clientId, String vin) {
        super();
        this.id = UUID.randomUUID().toString();
        this.clientId = clientId;
        this.vin = vin;
        this.startedAt = getCreatedAt();
        this.status = RentalStatus.ACTIVE;
    }

    public Rental(Rental other) {
        super(other);
        this.id = other.id;
        this.clientId = other.clientId;
        this.vin = other.vin;
        this.startedAt = other.startedAt;
        this.endedAt = other.endedAt;
        this.status = other.status;
    }

    @Override
    public String getKey() {
        return id;
    }

    @JsonIgnore
    public boolean isOpen() {
        return endedAt == null;
    }

    public void close(Instant when) {
        if (!isOpen()) {
            throw new IllegalStateException("Rental " + id + " is already closed");
        }
        this.endedAt = when;
        this.status = RentalStatus.ENDED;
    }
}

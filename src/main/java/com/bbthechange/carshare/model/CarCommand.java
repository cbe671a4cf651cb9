package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A command queued for one vehicle. Moves from PENDING to ACKNOWLEDGED exactly once,
 * when the car client confirms it.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class CarCommand extends BaseItem {

    private String id;
    private String vin;
    private CommandKind kind;
    private long sequence;          // Assigned by the repository; orders the per-VIN queue
    private CommandStatus status;
    private Instant ackedAt;
    private Boolean success;
    private String note;

    public CarCommand(String vin, CommandKind kind) {
        super();
        this.id = UUID.randomUUID().toString();
        this.vin = vin;
        this.kind = kind;
        this.status = CommandStatus.PENDING;
    }

    public CarCommand(CarCommand other) {
        super(other);
        this.id = other.id;
        this.vin = other.vin;
        this.kind = other.kind;
        this.sequence = other.sequence;
        this.status = other.status;
        this.ackedAt = other.ackedAt;
        this.success = other.success;
        this.note = other.note;
    }

    @Override
    public String getKey() {
        return id;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == CommandStatus.PENDING;
    }

    public void acknowledge(boolean success, String note) {
        if (!isPending()) {
            throw new IllegalStateException("Command " + id + " is already acknowledged");
        }
        this.status = CommandStatus.ACKNOWLEDGED;
        this.ackedAt = Instant.now();
        this.success = success;
        this.note = note;
    }
}

package com.bbthechange.carshare.dto;

import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.CommandStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Command as seen by the car client (snake_case wire names).
 */
public class CarCommandDTO {

    private String id;
    private String action;
    private String status;
    private Instant createdAt;
    private Instant ackedAt;
    private Boolean success;
    private String note;

    public CarCommandDTO() {}

    public CarCommandDTO(CarCommand command) {
        this.id = command.getId();
        this.action = command.getKind().getAction();
        this.status = command.getStatus() == CommandStatus.PENDING ? "pending" : "acked";
        this.createdAt = command.getCreatedAt();
        this.ackedAt = command.getAckedAt();
        this.success = command.getSuccess();
        this.note = command.getNote();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @JsonProperty("acked_at")
    public Instant getAckedAt() {
        return ackedAt;
    }

    public void setAckedAt(Instant ackedAt) {
        this.ackedAt = ackedAt;
    }

    public Boolean getSuccess() {
        return success;
    }

    public void setSuccess(Boolean success) {
        this.success = success;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }
}

package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Base class for all items kept by the repositories.
 * Carries the version used for compare-and-set updates plus audit timestamps.
 */
public abstract class BaseItem {

    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    protected BaseItem() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    protected BaseItem(BaseItem other) {
        this.version = other.version;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    /**
     * Key the item is stored under.
     */
    @JsonIgnore
    public abstract String getKey();

    @JsonIgnore
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }
}

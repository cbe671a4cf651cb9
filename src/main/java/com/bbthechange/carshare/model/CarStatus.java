package com.bbthechange.carshare.model;

public enum CarStatus {
    AVAILABLE,
    RENTED
}

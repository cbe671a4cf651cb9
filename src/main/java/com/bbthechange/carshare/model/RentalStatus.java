package com.bbthechange.carshare.model;

public enum RentalStatus {
    ACTIVE,
    ENDED
}

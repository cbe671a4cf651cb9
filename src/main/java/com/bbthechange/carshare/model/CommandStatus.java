package com.bbthechange.carshare.model;

public enum CommandStatus {
    PENDING,
    ACKNOWLEDGED
}

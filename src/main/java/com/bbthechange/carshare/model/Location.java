package com.bbthechange.carshare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Represents a geographic position as latitude and longitude in degrees.
 */
public class Location {
    private double lat;
    private double lon;

    // Constructors
    public Location() {}

    public Location(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    public Location(Location other) {
        this(other.lat, other.lon);
    }

    public double getLat() {
        return lat;
    }

    public void setLat(double lat) {
        this.lat = lat;
    }

    public double getLon() {
        return lon;
    }

    public void setLon(double lon) {
        this.lon = lon;
    }

    @JsonIgnore
    public boolean isValid() {
        return lat >= -90 && lat <= 90 && lon >= -180 && lon <= 180;
    }

    @Override
    public String toString() {
        return String.format("Location{lat=%.6f, lon=%.6f}", lat, lon);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location location = (Location) o;
        return Double.compare(lat, location.lat) == 0 && Double.compare(lon, location.lon) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(lat, lon);
    }
}

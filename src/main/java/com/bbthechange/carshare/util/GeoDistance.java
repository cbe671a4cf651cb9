package com.bbthechange.carshare.util;

import com.bbthechange.carshare.model.Location;

/**
 * Straight-line distance between two positions on the Earth's surface (Haversine formula).
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
        // Utility class
    }

    public static double haversineKm(Location from, Location to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both locations are required");
        }
        double dLat = Math.toRadians(to.getLat() - from.getLat());
        double dLon = Math.toRadians(to.getLon() - from.getLon());
        double lat1 = Math.toRadians(from.getLat());
        double lat2 = Math.toRadians(to.getLat());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Rounds a distance to metre precision for display.
     */
    public static double roundKm(double km) {
        return Math.round(km * 1000.0) / 1000.0;
    }
}

package com.bbthechange.carshare.service;

import com.bbthechange.carshare.dto.CarDTO;
import com.bbthechange.carshare.dto.HeartbeatResponse;
import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.Location;

import java.util.List;

/**
 * Fleet inventory and the latest telematics reported by each car.
 * Rental status is owned by RentalService and never changed here.
 */
public interface FleetService {

    /**
     * Available cars, nearest first. Without a location the cars come back in VIN order
     * and carry no distance.
     */
    List<CarDTO> listAvailable(Location from);

    Car getByVin(String vin);

    boolean exists(String vin);

    /**
     * Apply a partial telematics report. Battery is clamped to 0..100 and lastSeenAt always refreshes.
     */
    Car applyTelematicsUpdate(String vin, TelematicsUpdateRequest update);

    Car setLocked(String vin, boolean locked);

    Car recordSeen(String vin);

    /**
     * Telematics report from a polling car, answered with its pending command count.
     */
    HeartbeatResponse heartbeat(String vin, TelematicsUpdateRequest update);
}

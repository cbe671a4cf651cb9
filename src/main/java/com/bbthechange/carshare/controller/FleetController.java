package com.bbthechange.carshare.controller;

import com.bbthechange.carshare.dto.CarDTO;
import com.bbthechange.carshare.dto.ClientProfileDTO;
import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.service.AuthService;
import com.bbthechange.carshare.service.FleetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Fleet", description = "Available cars and telematics")
public class FleetController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(FleetController.class);

    private final FleetService fleetService;
    private final AuthService authService;

    public FleetController(FleetService fleetService, AuthService authService) {
        this.fleetService = fleetService;
        this.authService = authService;
    }

    @GetMapping("/cars")
    @Operation(summary = "List available cars, nearest first",
               description = "When lat and lon are given they also update the rider's position")
    public ResponseEntity<Map<String, Object>> listCars(
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lon,
            HttpServletRequest httpRequest) {

        String clientId = extractClientId(httpRequest);
        ClientProfileDTO client;
        if (lat != null && lon != null) {
            client = authService.updateLocation(clientId, new Location(lat, lon));
        } else if (lat != null || lon != null) {
            throw new ValidationException("lat and lon must be given together");
        } else {
            client = authService.getProfile(clientId);
        }

        List<CarDTO> cars = fleetService.listAvailable(client.getLocation());
        logger.debug("Client {} sees {} available cars", clientId, cars.size());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cars", cars);
        body.put("client", client.getEmail());
        return ResponseEntity.ok(body);
    }

    @PatchMapping("/cars/{vin}/telematics")
    @Operation(summary = "Overwrite reported telematics (simulation hook)")
    public ResponseEntity<CarDTO> updateTelematics(
            @PathVariable String vin,
            @RequestBody(required = false) TelematicsUpdateRequest request) {

        Car car = fleetService.applyTelematicsUpdate(vin, request);
        return ResponseEntity.ok(new CarDTO(car));
    }
}

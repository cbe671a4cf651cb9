package com.bbthechange.carshare.controller;

import com.bbthechange.carshare.dto.RentalRequest;
import com.bbthechange.carshare.dto.RentalResult;
import com.bbthechange.carshare.dto.RentalResultDTO;
import com.bbthechange.carshare.model.Rental;
import com.bbthechange.carshare.service.AuthService;
import com.bbthechange.carshare.service.RentalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Rental lifecycle for the authenticated rider. Both transitions answer as soon as the
 * decision is committed; the car receives its unlock or lock through the command channel.
 */
@RestController
@RequestMapping("/rentals")
@Tag(name = "Rentals", description = "Start and end rentals")
public class RentalController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(RentalController.class);

    private final RentalService rentalService;
    private final AuthService authService;

    public RentalController(RentalService rentalService, AuthService authService) {
        this.rentalService = rentalService;
        this.authService = authService;
    }

    @GetMapping("/me")
    @Operation(summary = "Rental history of the authenticated rider, newest first")
    public ResponseEntity<Map<String, List<Rental>>> myRentals(HttpServletRequest httpRequest) {
        String clientId = extractClientId(httpRequest);
        return ResponseEntity.ok(Map.of("rentals", rentalService.getRentals(clientId)));
    }

    @PostMapping("/start")
    @Operation(summary = "Start renting a car")
    public ResponseEntity<RentalResultDTO> start(@Valid @RequestBody RentalRequest request,
                                                 HttpServletRequest httpRequest) {
        String clientId = extractClientId(httpRequest);
        if (request.getLocation() != null) {
            authService.updateLocation(clientId, request.getLocation());
        }
        logger.info("Client {} starting rental of {}", clientId, request.getVin());

        RentalResult result = rentalService.start(clientId, request.getVin());
        return ResponseEntity.ok(new RentalResultDTO("Rental started, unlock queued", result));
    }

    @PostMapping("/end")
    @Operation(summary = "End the rental of a car")
    public ResponseEntity<RentalResultDTO> end(@Valid @RequestBody RentalRequest request,
                                               HttpServletRequest httpRequest) {
        String clientId = extractClientId(httpRequest);
        logger.info("Client {} ending rental of {}", clientId, request.getVin());

        RentalResult result = rentalService.end(clientId, request.getVin());
        return ResponseEntity.ok(new RentalResultDTO("Rental ended, lock queued", result));
    }
}

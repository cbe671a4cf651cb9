package com.bbthechange.carshare.controller;

import com.bbthechange.carshare.dto.AckCommandRequest;
import com.bbthechange.carshare.dto.CarCommandDTO;
import com.bbthechange.carshare.dto.CarRegisterRequest;
import com.bbthechange.carshare.dto.HeartbeatResponse;
import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.service.AuthService;
import com.bbthechange.carshare.service.CommandChannelService;
import com.bbthechange.carshare.service.FleetService;
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Endpoints for polling telematics clients: register, heartbeat, poll, ack.
 */
@RestController
@RequestMapping("/car")
@Tag(name = "Car client", description = "Telematics client registration and command polling")
public class CarClientController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(CarClientController.class);

    private final AuthService authService;
    private final FleetService fleetService;
    private final CommandChannelService commandChannelService;

    public CarClientController(AuthService authService,
                               FleetService fleetService,
                               CommandChannelService commandChannelService) {
        this.authService = authService;
        this.fleetService = fleetService;
        this.commandChannelService = commandChannelService;
    }

    @PostMapping("/register")
    @Operation(summary = "Open a car session with the shared car API key")
    public ResponseEntity<Map<String, String>> register(@Valid @RequestBody CarRegisterRequest request) {
        String token = authService.registerCar(request.getVin(), request.getApiKey());

        Map<String, String> body = new LinkedHashMap<>();
        body.put("vin", request.getVin());
        body.put("car_token", token);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/heartbeat")
    @Operation(summary = "Report telematics and get the pending command count")
    public ResponseEntity<HeartbeatResponse> heartbeat(@RequestBody(required = false) TelematicsUpdateRequest request,
                                                       HttpServletRequest httpRequest) {
        String vin = extractVin(httpRequest);
        return ResponseEntity.ok(fleetService.heartbeat(vin, request));
    }

    @GetMapping("/commands")
    @Operation(summary = "Poll pending commands in queue order")
    public ResponseEntity<Map<String, Object>> commands(HttpServletRequest httpRequest) {
        String vin = extractVin(httpRequest);
        List<CarCommandDTO> commands = commandChannelService.poll(vin).stream()
                .map(CarCommandDTO::new)
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vin", vin);
        body.put("commands", commands);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/ack")
    @Operation(summary = "Acknowledge a command")
    public ResponseEntity<Map<String, Object>> ack(@Valid @RequestBody AckCommandRequest request,
                                                   HttpServletRequest httpRequest) {
        String vin = extractVin(httpRequest);
        CarCommand command = commandChannelService.ack(vin, request.getCommandId(), request.isSuccessful(), request.getNote());
        logger.debug("Ack of {} by {} recorded", command.getId(), vin);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vin", vin);
        body.put("command", new CarCommandDTO(command));
        return ResponseEntity.ok(body);
    }
}

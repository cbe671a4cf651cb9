package com.bbthechange.carshare.controller;

import com.bbthechange.carshare.dto.ClientProfileDTO;
import com.bbthechange.carshare.dto.LoginRequest;
import com.bbthechange.carshare.dto.LoginResponse;
import com.bbthechange.carshare.dto.RegisterClientRequest;
import com.bbthechange.carshare.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Authentication", description = "Rider registration, login and profile")
public class AuthController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a new rider")
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterClientRequest request) {
        ClientProfileDTO client = authService.register(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Client registered");
        body.put("client", client);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/login")
    @Operation(summary = "Log in with email and PIN")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        LoginResponse response = authService.login(request.getEmail(), request.getPin());
        logger.debug("Issued rider token for {}", response.getClient().getId());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/me")
    @Operation(summary = "Get the authenticated rider's profile")
    public ResponseEntity<ClientProfileDTO> me(HttpServletRequest httpRequest) {
        String clientId = extractClientId(httpRequest);
        return ResponseEntity.ok(authService.getProfile(clientId));
    }
}

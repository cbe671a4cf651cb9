package com.bbthechange.carshare.service;

import com.bbthechange.carshare.dto.ClientProfileDTO;
import com.bbthechange.carshare.dto.LoginResponse;
import com.bbthechange.carshare.dto.RegisterClientRequest;
import com.bbthechange.carshare.model.Location;

import java.util.Optional;

/**
 * Rider and car-client identity: registration, credentials and session tokens.
 */
public interface AuthService {

    /**
     * Register a new rider. The email is stored lower-cased and the PIN only as a hash.
     * Throws ValidationException on missing or malformed fields, ConflictException if the email is taken.
     */
    ClientProfileDTO register(RegisterClientRequest request);

    /**
     * Open a rider session. Unknown email and wrong PIN both fail with the same UnauthorizedException.
     */
    LoginResponse login(String email, String pin);

    /**
     * Client id behind a rider token, or UnauthorizedException.
     */
    String authenticate(String token);

    Optional<String> resolveClientId(String token);

    /**
     * Open a car session for a fleet VIN presenting the shared car API key.
     * @return the signed car token
     */
    String registerCar(String vin, String apiKey);

    /**
     * VIN behind a car token, or UnauthorizedException.
     */
    String authenticateCar(String token);

    Optional<String> resolveVin(String token);

    ClientProfileDTO getProfile(String clientId);

    ClientProfileDTO updateLocation(String clientId, Location location);
}

package com.bbthechange.carshare.service.impl;

import com.bbthechange.carshare.config.CarShareProperties;
import com.bbthechange.carshare.dto.ClientProfileDTO;
import com.bbthechange.carshare.dto.LoginResponse;
import com.bbthechange.carshare.dto.RegisterClientRequest;
import com.bbthechange.carshare.exception.CarNotFoundException;
import com.bbthechange.carshare.exception.ResourceNotFoundException;
import com.bbthechange.carshare.exception.UnauthorizedException;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.exception.VersionConflictException;
import com.bbthechange.carshare.model.CarSession;
import com.bbthechange.carshare.model.Client;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.model.Session;
import com.bbthechange.carshare.repository.CarSessionRepository;
import com.bbthechange.carshare.repository.ClientRepository;
import com.bbthechange.carshare.repository.SessionRepository;
import com.bbthechange.carshare.service.AuthService;
import com.bbthechange.carshare.service.FleetService;
import com.bbthechange.carshare.service.JwtService;
import com.bbthechange.carshare.service.JwtService.TokenType;
import com.bbthechange.carshare.service.PinHashingService;
import com.bbthechange.carshare.util.OptimisticRetry;
import io.jsonwebtoken.Claims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
public class AuthServiceImpl implements AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthServiceImpl.class);

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern PIN_PATTERN = Pattern.compile("^\\d{4,8}$");
    private static final int MINIMUM_AGE = 18;
    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final ClientRepository clientRepository;
    private final SessionRepository sessionRepository;
    private final CarSessionRepository carSessionRepository;
    private final FleetService fleetService;
    private final JwtService jwtService;
    private final PinHashingService pinHashingService;
    private final CarShareProperties properties;

    public AuthServiceImpl(ClientRepository clientRepository,
                           SessionRepository sessionRepository,
                           CarSessionRepository carSessionRepository,
                           FleetService fleetService,
                           JwtService jwtService,
                           PinHashingService pinHashingService,
                           CarShareProperties properties) {
        this.clientRepository = clientRepository;
        this.sessionRepository = sessionRepository;
        this.carSessionRepository = carSessionRepository;
        this.fleetService = fleetService;
        this.jwtService = jwtService;
        this.pinHashingService = pinHashingService;
        this.properties = properties;
    }

    @Override
    public ClientProfileDTO register(RegisterClientRequest request) {
        if (request == null) {
            throw new ValidationException("Registration profile is required");
        }
        String name = requireText(request.getName(), "name");
        String email = requireText(request.getEmail(), "email").toLowerCase(Locale.ROOT);
        String driverLicense = requireText(request.getDriverLicense(), "driverLicense");
        String paymentMethod = requireText(request.getPaymentMethod(), "paymentMethod");
        String pin = requireText(request.getPin(), "pin");

        if (!EMAIL_PATTERN.matcher(email).matches()) {
            throw new ValidationException("email is malformed");
        }
        if (!PIN_PATTERN.matcher(pin).matches()) {
            throw new ValidationException("pin must be 4 to 8 digits");
        }
        if (request.getAge() != null && request.getAge() < MINIMUM_AGE) {
            throw new ValidationException("Client must be at least " + MINIMUM_AGE + " years old");
        }
        LocalDate licenseValidUntil = parseLicenseExpiry(request.getLicenseValidUntil());
        if (request.getLocation() != null && !request.getLocation().isValid()) {
            throw new ValidationException("location must have lat in [-90, 90] and lon in [-180, 180]");
        }

        if (clientRepository.findByEmail(email).isPresent()) {
            logger.warn("Registration rejected, email already registered: {}", email);
            throw new ValidationException("Email already registered");
        }

        Client client = new Client(name, email, driverLicense, paymentMethod, pinHashingService.hashPin(pin));
        client.setAge(request.getAge());
        client.setLicenseValidUntil(licenseValidUntil);
        client.setLocation(request.getLocation());

        try {
            Client saved = clientRepository.save(client);
            logger.info("Registered client {} ({})", saved.getId(), email);
            return new ClientProfileDTO(saved);
        } catch (VersionConflictException e) {
            // Lost a race with a concurrent registration of the same email
            logger.warn("Registration rejected, email registered concurrently: {}", email);
            throw new ValidationException("Email already registered");
        }
    }

    @Override
    public LoginResponse login(String email, String pin) {
        if (email == null || pin == null) {
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }
        Client client = clientRepository.findByEmail(email.trim().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> {
                    logger.warn("Login failed, unknown email");
                    return new UnauthorizedException(INVALID_CREDENTIALS);
                });
        if (!pinHashingService.matches(pin, client.getPinHash())) {
            logger.warn("Login failed, PIN mismatch for client {}", client.getId());
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }

        Session session = sessionRepository.save(new Session(client.getId(), properties.getAuth().getRiderSessionTtl()));
        String token = jwtService.generateToken(TokenType.RIDER, client.getId(), session.getSessionId(),
                properties.getAuth().getRiderSessionTtl());

        logger.info("Client {} logged in, session {}", client.getId(), session.getSessionId());
        return new LoginResponse(token, "Bearer", properties.getAuth().getRiderSessionTtl().getSeconds(),
                new ClientProfileDTO(client));
    }

    @Override
    public String authenticate(String token) {
        return resolveClientId(token)
                .orElseThrow(() -> new UnauthorizedException("Invalid or expired token"));
    }

    @Override
    public Optional<String> resolveClientId(String token) {
        Optional<Claims> claims = jwtService.parseToken(token, TokenType.RIDER);
        if (claims.isEmpty()) {
            return Optional.empty();
        }
        String clientId = claims.get().getSubject();
        return sessionRepository.findById(claims.get().getId())
                .filter(session -> !session.isExpired())
                .filter(session -> clientId.equals(session.getClientId()))
                .map(Session::getClientId);
    }

    @Override
    public String registerCar(String vin, String apiKey) {
        if (vin == null || vin.isBlank()) {
            throw new ValidationException("vin is required");
        }
        if (!apiKeyMatches(apiKey)) {
            logger.warn("Car registration rejected for {}: bad API key", vin);
            throw new UnauthorizedException("Invalid car API key");
        }
        if (!fleetService.exists(vin)) {
            throw new CarNotFoundException("Unknown VIN: " + vin);
        }

        CarSession session = carSessionRepository.save(new CarSession(vin, properties.getAuth().getCarSessionTtl()));
        fleetService.recordSeen(vin);
        logger.info("Car {} registered, session {}", vin, session.getSessionId());
        return jwtService.generateToken(TokenType.CAR, vin, session.getSessionId(), properties.getAuth().getCarSessionTtl());
    }

    @Override
    public String authenticateCar(String token) {
        return resolveVin(token)
                .orElseThrow(() -> new UnauthorizedException("Invalid or expired car token"));
    }

    @Override
    public Optional<String> resolveVin(String token) {
        Optional<Claims> claims = jwtService.parseToken(token, TokenType.CAR);
        if (claims.isEmpty()) {
            return Optional.empty();
        }
        String vin = claims.get().getSubject();
        return carSessionRepository.findById(claims.get().getId())
                .filter(session -> !session.isExpired())
                .filter(session -> vin.equals(session.getVin()))
                .map(CarSession::getVin);
    }

    @Override
    public ClientProfileDTO getProfile(String clientId) {
        return new ClientProfileDTO(loadClient(clientId));
    }

    @Override
    public ClientProfileDTO updateLocation(String clientId, Location location) {
        if (location == null || !location.isValid()) {
            throw new ValidationException("location must have lat in [-90, 90] and lon in [-180, 180]");
        }
        Client updated = OptimisticRetry.update("client " + clientId,
                () -> loadClient(clientId),
                client -> client.setLocation(location),
                clientRepository::update);
        logger.debug("Client {} location updated to {}", clientId, location);
        return new ClientProfileDTO(updated);
    }

    private Client loadClient(String clientId) {
        return clientRepository.findById(clientId)
                .orElseThrow(() -> new ResourceNotFoundException("Client not found: " + clientId));
    }

    private boolean apiKeyMatches(String apiKey) {
        String expected = properties.getAuth().getCarApiKey();
        if (apiKey == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(apiKey.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }

    private static LocalDate parseLicenseExpiry(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        LocalDate expiry;
        try {
            expiry = LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("licenseValidUntil must be an ISO date (yyyy-MM-dd)", e);
        }
        if (expiry.isBefore(LocalDate.now())) {
            throw new ValidationException("Driver license has expired");
        }
        return expiry;
    }
}

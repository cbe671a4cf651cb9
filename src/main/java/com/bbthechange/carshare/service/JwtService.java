package com.bbthechange.carshare.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Signs and parses the bearer tokens handed to riders and car clients.
 *
 * Tokens carry the session id ({@code jti}), the principal ({@code sub}: client id or VIN)
 * and a {@code type} claim. The type keeps the two namespaces apart: a rider token never
 * parses as a car token and vice versa.
 */
@Service
public class JwtService {

    public enum TokenType {
        RIDER("rider"),
        CAR("car");

        private final String claimValue;

        TokenType(String claimValue) {
            this.claimValue = claimValue;
        }

        public String getClaimValue() {
            return claimValue;
        }
    }

    private static final String TYPE_CLAIM = "type";

    /**
     * Signing secret, injected from 'jwt.secret'. The default only exists so local runs and
     * builds start without extra setup; deployed environments override it.
     */
    @Value("${jwt.secret:default_secret_for_local_development_only_12345}")
    private String secretKey;

    private SecretKey key;

    @PostConstruct
    public void init() {
        if (secretKey == null || secretKey.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was "
                    + (secretKey == null ? 0 : secretKey.length()) + ")");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(TokenType type, String subject, String sessionId, Duration ttl) {
        Instant now = Instant.now();
        return Jwts.builder()
                .id(sessionId)
                .subject(subject)
                .claim(TYPE_CLAIM, type.getClaimValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Parse a token of the expected type.
     *
     * @return the claims, or empty if the signature is bad, the token expired, or the type differs
     */
    public Optional<Claims> parseToken(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = extractClaims(token);
            if (!expectedType.getClaimValue().equals(claims.get(TYPE_CLAIM))) {
                return Optional.empty();
            }
            if (claims.getId() == null || claims.getSubject() == null) {
                return Optional.empty();
            }
            return Optional.of(claims);
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private Claims extractClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

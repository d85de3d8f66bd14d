package com.studioledger.backup.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads bearer tokens issued by the studio application and signs the short-lived tokens
 * this service hands out itself (OAuth state). Both use the shared {@code jwt.secret};
 * user tokens are never issued here.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    static final int MIN_SECRET_LENGTH = 32;

    @Value("${jwt.secret}")
    private String jwtSecret;

    private SecretKey key;

    @PostConstruct
    public void init() {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            throw new IllegalStateException(
                "JWT_SECRET environment variable must be set to the secret shared with the studio application."
            );
        }

        if (jwtSecret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                "JWT_SECRET must be at least " + MIN_SECRET_LENGTH + " characters. " +
                "Current length: " + jwtSecret.length()
            );
        }

        this.key = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT token provider initialized");
    }

    /**
     * Principal carried by a bearer token, or empty when the token is invalid, expired,
     * belongs to a deactivated account, or lacks a user id or role.
     */
    public Optional<AuthenticatedUser> readUser(String token) {
        Claims claims;
        try {
            claims = getAllClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Bearer token rejected: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }

        if (Boolean.FALSE.equals(claims.get("active", Boolean.class))) {
            log.warn("Rejected token of inactive user {}", claims.getSubject());
            return Optional.empty();
        }

        String role = claims.get("role", String.class);
        if (role == null || role.isBlank() || claims.getSubject() == null) {
            return Optional.empty();
        }

        UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException e) {
            log.debug("Bearer token subject is not a user id");
            return Optional.empty();
        }
        return Optional.of(new AuthenticatedUser(userId, claims.get("email", String.class), role));
    }

    /**
     * Sign a token carrying arbitrary claims, valid for {@code ttl}.
     */
    public String generateShortLivedToken(String subject, Map<String, ?> claims, Duration ttl) {
        Date now = new Date();
        return Jwts.builder()
                .claims(claims)
                .subject(subject)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + ttl.toMillis()))
                .signWith(key)
                .compact();
    }

    /**
     * @throws JwtException if the token is malformed, tampered with or expired
     */
    public Claims getAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

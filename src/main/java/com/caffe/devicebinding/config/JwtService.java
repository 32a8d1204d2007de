package com.caffe.devicebinding.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.*;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    static final String ROLES_CLAIM = "roles";
    static final String OBSERVER_ID_CLAIM = "observerId";

    private final Key key;
    private final long ttlSeconds;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    /* ------------------------ token creation ------------------------ */

    public String generateToken(String username, String observerId, Set<String> roles) {
        Instant now = Instant.now();

        log.debug("Generating JWT token for user: {}, observer: {}, roles: {}", username, observerId, roles);

        return Jwts.builder()
                .setSubject(username)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .claim(ROLES_CLAIM, roles == null ? List.of() : new ArrayList<>(roles))
                .claim(OBSERVER_ID_CLAIM, observerId)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Set<String> getRoles(String token) {
        try {
            Object rolesObj = parse(token).getBody().get(ROLES_CLAIM);
            if (rolesObj instanceof Collection<?> col) {
                Set<String> roles = new HashSet<>();
                for (Object o : col) {
                    roles.add(String.valueOf(o));
                }
                return roles;
            }
            return Set.of();
        } catch (Exception e) {
            log.warn("Failed to extract roles from token: {}", e.getMessage());
            return Set.of();
        }
    }

    public Optional<String> getObserverId(String token) {
        try {
            Object observerId = parse(token).getBody().get(OBSERVER_ID_CLAIM);
            return Optional.ofNullable(observerId == null ? null : String.valueOf(observerId));
        } catch (Exception e) {
            log.warn("Failed to extract observer ID from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isTokenExpired(String token) {
        try {
            return parse(token).getBody().getExpiration().before(new Date());
        } catch (Exception e) {
            log.debug("Token validation failed: {}", e.getMessage());
            return true;
        }
    }
}

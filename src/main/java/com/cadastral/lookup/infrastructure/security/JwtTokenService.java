package com.cadastral.lookup.infrastructure.security;

import com.cadastral.lookup.infrastructure.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and verifies HS256 access tokens. The subject is the user id.
 */
@Service
public class JwtTokenService {

    private static final Logger logger = LoggerFactory.getLogger(JwtTokenService.class);

    private final SecretKey signingKey;
    private final Duration tokenLifetime;
    private final String audience;
    private final Clock clock;

    @Autowired
    public JwtTokenService(AuthProperties authProperties) {
        this(authProperties, Clock.systemUTC());
    }

    JwtTokenService(AuthProperties authProperties, Clock clock) {
        String secret = authProperties.getJwtSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("app.auth.jwt-secret (JWT_SECRET) must be configured");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenLifetime = authProperties.getTokenLifetime();
        this.audience = authProperties.getAudience();
        this.clock = clock;
    }

    public String issueToken(Long userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .setAudience(audience)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(tokenLifetime)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return the user id carried by a valid, unexpired token; empty otherwise
     */
    public Optional<Long> parseUserId(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireAudience(audience)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return Optional.of(Long.valueOf(claims.getSubject()));
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("Rejected access token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Duration getTokenLifetime() {
        return tokenLifetime;
    }
}

package com.cadastral.lookup.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.auth")
@Getter
@Setter
public class AuthProperties {

    /**
     * HMAC key for access tokens; at least 32 bytes.
     */
    private String jwtSecret;

    private Duration tokenLifetime = Duration.ofHours(1);

    private String audience = "cadastral-lookup:auth";
}

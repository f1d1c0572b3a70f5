package com.cadastral.lookup.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the outbound resolver call and for the built-in stub resolver endpoint.
 */
@ConfigurationProperties(prefix = "app.resolver")
@Getter
@Setter
public class ResolverProperties {

    private String baseUrl = "http://127.0.0.1:8080";

    private String path = "/result";

    private Duration timeout = Duration.ofSeconds(60);

    private Stub stub = new Stub();

    @Getter
    @Setter
    public static class Stub {
        private Duration minDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
    }
}

package com.cadastral.lookup.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.seeding")
@Getter
@Setter
public class SeedingProperties {

    private boolean enabled;

    private String superuserEmail;

    private String superuserPassword;
}

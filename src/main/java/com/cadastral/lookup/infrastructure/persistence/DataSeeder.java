package com.cadastral.lookup.infrastructure.persistence;

import com.cadastral.lookup.application.port.out.UserRepository;
import com.cadastral.lookup.application.service.UserAccountService;
import com.cadastral.lookup.infrastructure.config.SeedingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the first superuser on start-up when app.seeding.enabled=true.
 * Does nothing if an account with the configured email already exists.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedSuperuser(
        SeedingProperties seedingProperties,
        UserRepository userRepository,
        UserAccountService userAccountService
    ) {
        return args -> {
            String email = seedingProperties.getSuperuserEmail();
            if (email == null || email.isBlank() || seedingProperties.getSuperuserPassword() == null) {
                logger.warn("Superuser seeding enabled but email or password is missing, skipping");
                return;
            }

            if (userRepository.existsByEmailIgnoreCase(email)) {
                logger.info("Superuser {} already exists, skipping", email);
                return;
            }

            userAccountService.register(email, seedingProperties.getSuperuserPassword(), true);
            logger.info("Seeded superuser {}", email);
        };
    }
}

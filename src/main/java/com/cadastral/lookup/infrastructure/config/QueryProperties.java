package com.cadastral.lookup.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.query")
@Getter
@Setter
public class QueryProperties {

    /**
     * Reject a submission whose (latitude, longitude) pair is already stored.
     * <p>
     * The check is a read before the insert, so two concurrent submissions of the same
     * pair can both pass it. For a hard guarantee also add the constraint
     * {@code ALTER TABLE queryhistory ADD CONSTRAINT uq_queryhistory_coordinates UNIQUE (latitude, longitude)};
     * its violations are reported the same way as the check.
     */
    private boolean enforceUniqueCoordinates = false;
}

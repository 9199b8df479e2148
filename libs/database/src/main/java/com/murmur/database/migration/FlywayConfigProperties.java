package com.murmur.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Flyway settings for the event store database, bound from {@code murmur.flyway}.
 *
 * <pre>{@code
 * murmur:
 *   flyway:
 *     events:
 *       url: jdbc:postgresql://localhost:5432/murmur
 *       username: murmur
 *       password: murmur_dev_password
 *       locations: classpath:db/migration/events
 *       enabled: true
 * }</pre>
 *
 * @param events event log and processed-events database
 */
@Validated
@ConfigurationProperties(prefix = "murmur.flyway")
public record FlywayConfigProperties(@NotNull @Valid DatabaseConfig events) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/events";

    /**
     * @param locations Flyway migration locations; defaults to {@value #DEFAULT_LOCATIONS}
     * @param enabled whether to migrate on startup
     */
    public record DatabaseConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            String locations,
            boolean enabled) {

        public DatabaseConfig {
            if (locations == null || locations.isBlank()) {
                locations = DEFAULT_LOCATIONS;
            }
        }
    }
}

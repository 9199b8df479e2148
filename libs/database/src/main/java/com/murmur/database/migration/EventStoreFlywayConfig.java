package com.murmur.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the event store schema on startup.
 *
 * <p>Uses its own Flyway instance and connection settings, so services importing this should
 * switch off Spring Boot's Flyway auto-configuration ({@code spring.flyway.enabled: false}).
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "murmur.flyway.events", name = "enabled", havingValue = "true")
public class EventStoreFlywayConfig {

    public static final String EVENT_STORE_FLYWAY_BEAN = "eventStoreFlyway";

    /** Configured Flyway for the event store; {@code migrate} runs when the bean initializes. */
    @Bean(name = EVENT_STORE_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway eventStoreFlyway(FlywayConfigProperties properties) {
        return createFlyway(properties.events());
    }

    @Bean
    public MigrationService migrationService(Flyway eventStoreFlyway, FlywayConfigProperties properties) {
        return new MigrationService("events", properties.events().url(), eventStoreFlyway);
    }

    static Flyway createFlyway(FlywayConfigProperties.DatabaseConfig config) {
        DataSource dataSource = DataSourceBuilder.create()
                .url(config.url())
                .username(config.username())
                .password(config.password())
                .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}

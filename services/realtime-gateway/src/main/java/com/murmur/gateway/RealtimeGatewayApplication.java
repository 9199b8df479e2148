package com.murmur.gateway;

import com.murmur.database.migration.EventStoreFlywayConfig;
import com.murmur.gateway.config.EventBackboneProperties;
import com.murmur.gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Murmur realtime gateway: hosts the event backbone (log, publisher, idempotent listeners, relay)
 * and fans committed events out to the sockets connected to this instance.
 *
 * <p>The default profile runs everything in memory on a single node. The {@code local} profile
 * switches the log and idempotency store to PostgreSQL and the broker to Redis, and applies the
 * event store migrations on startup.
 */
@SpringBootApplication
@EnableScheduling
@Import(EventStoreFlywayConfig.class)
@EnableConfigurationProperties({GatewayProperties.class, EventBackboneProperties.class})
public class RealtimeGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(RealtimeGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RealtimeGatewayApplication.class, args);
        log.info("Murmur realtime gateway started");
    }
}

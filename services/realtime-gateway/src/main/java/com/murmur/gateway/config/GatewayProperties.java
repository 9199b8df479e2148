package com.murmur.gateway.config;

import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this gateway process, bound from {@code murmur.service.*}.
 *
 * <pre>
 * murmur:
 *   service:
 *     name: realtime-gateway
 *     environment: production
 *     instance-id: gw-eu-1a
 * </pre>
 *
 * @param name service name used in logs, metrics and traces
 * @param environment deployment environment, defaults to {@code development}
 * @param instanceId gateway instance id matched against presence entries; generated when absent
 */
@ConfigurationProperties(prefix = "murmur.service")
@Validated
public record GatewayProperties(@NotBlank String name, String environment, String instanceId) {

    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = (name == null ? "gateway" : name) + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}

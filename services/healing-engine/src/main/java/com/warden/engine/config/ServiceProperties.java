package com.warden.engine.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code warden.service.*}.
 *
 * <pre>
 * warden:
 *   service:
 *     name: healing-engine
 *     environment: production
 *     description: Self-healing observability engine
 * </pre>
 *
 * @param name Service name used for logging, metrics, and tracing. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for the info endpoint.
 */
@ConfigurationProperties(prefix = "warden.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}

package com.warden.engine.config;

import java.net.URI;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * S3 client for the object storage probe. Created only when {@code warden.storage.enabled=true};
 * credentials come from the default AWS provider chain. Every call is capped at the probe timeout.
 */
@Configuration
@ConditionalOnProperty(prefix = "warden.storage", name = "enabled", havingValue = "true")
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(StorageProperties storage, ProbeProperties probes) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(storage.region()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofMillis(probes.timeoutMs()))
                        .build());
        if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.endpoint())).forcePathStyle(true);
        }
        return builder.build();
    }
}

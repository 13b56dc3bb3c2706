package com.warden.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Object storage probed by the health check, bound from {@code warden.storage.*}.
 *
 * @param enabled whether the storage probe is registered (default false).
 * @param bucket bucket whose existence is checked.
 * @param region AWS region (default us-east-1).
 * @param endpoint optional endpoint override for S3-compatible stores.
 */
@ConfigurationProperties(prefix = "warden.storage")
public record StorageProperties(boolean enabled, String bucket, String region, String endpoint) {

    public StorageProperties {
        if (region == null || region.isBlank()) {
            region = "us-east-1";
        }
        if (enabled && (bucket == null || bucket.isBlank())) {
            throw new IllegalArgumentException("warden.storage.bucket is required when storage is enabled");
        }
    }
}

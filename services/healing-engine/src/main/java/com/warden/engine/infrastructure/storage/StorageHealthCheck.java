package com.warden.engine.infrastructure.storage;

import com.warden.observability.ComponentHealth;
import com.warden.observability.TimedHealthCheck;
import java.util.Map;
import java.util.concurrent.Executor;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;

/**
 * Object storage probe: {@code HeadBucket} on the configured bucket.
 */
public class StorageHealthCheck extends TimedHealthCheck {

    public static final String NAME = "storage";

    private final S3Client s3;
    private final String bucket;

    public StorageHealthCheck(S3Client s3, String bucket, Executor executor) {
        super(NAME, executor);
        this.s3 = s3;
        this.bucket = bucket;
    }

    @Override
    protected ComponentHealth probe(long startNanos) {
        s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        return ComponentHealth.healthy(NAME, elapsedMs(startNanos), Map.of("bucket", bucket));
    }
}

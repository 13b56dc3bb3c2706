package com.warden.engine.domain.metrics;

import java.time.Instant;

/**
 * One handled HTTP request.
 */
public record ApiCall(String path, String method, int statusCode, long responseTimeMs, Instant timestamp) {

    /** Server errors count against the error rate; client errors do not. */
    public boolean isError() {
        return statusCode >= 500;
    }
}

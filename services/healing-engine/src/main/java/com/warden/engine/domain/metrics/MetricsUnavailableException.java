package com.warden.engine.domain.metrics;

/**
 * Thrown when a summary is requested before any metrics snapshot exists.
 */
public class MetricsUnavailableException extends RuntimeException {

    public MetricsUnavailableException(String message) {
        super(message);
    }
}

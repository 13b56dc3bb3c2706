package com.warden.engine.domain.metrics;

import java.time.Instant;

/**
 * An unexpected error observed by the engine.
 *
 * @param component where the error surfaced: {@code api} for the HTTP layer, or the scheduler
 *                  origin of a failed monitoring lane such as {@code scheduler:fast}
 */
public record ErrorLogEntry(String component, String message, Instant timestamp) {
}

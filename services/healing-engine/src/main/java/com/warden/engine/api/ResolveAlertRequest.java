package com.warden.engine.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code PUT /api/v1/alerts/{id}/resolve}.
 */
public record ResolveAlertRequest(
        @NotBlank @Size(max = 128) String resolvedBy,
        @Size(max = 2000) String resolutionMessage) {
}

package com.warden.engine.domain.recovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one call to {@link RecoveryEngine#handleSystemDegradation}.
 *
 * <p>{@code details.status} is {@code skipped}, {@code completed} or {@code failed}.
 */
public record RecoveryResult(boolean success, List<String> actionsTaken, Map<String, Object> details) {

    public static final String STATUS = "status";
    public static final String SKIPPED = "skipped";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    static final String ALREADY_IN_PROGRESS = "Recovery already in progress";

    public RecoveryResult {
        actionsTaken = List.copyOf(actionsTaken);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    static RecoveryResult skipped() {
        return new RecoveryResult(false, List.of(ALREADY_IN_PROGRESS), Map.of(STATUS, SKIPPED));
    }

    public boolean isSkipped() {
        return SKIPPED.equals(details.get(STATUS));
    }

    public String status() {
        return String.valueOf(details.get(STATUS));
    }
}

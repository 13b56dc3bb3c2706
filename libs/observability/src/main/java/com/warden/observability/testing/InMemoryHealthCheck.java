package com.warden.observability.testing;

import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthCheck;
import com.warden.observability.HealthStatus;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A controllable health check for testing health aggregation logic.
 * <p>
 * Allows tests to set the reported status, make the check fail, or make it hang so
 * that the registry's timeout handling can be exercised. Placed in {@code src/main/java}
 * for cross-module test use.
 */
public final class InMemoryHealthCheck implements HealthCheck {

    private enum Mode { REPORT, FAIL, HANG }

    private final String componentName;
    private final AtomicReference<HealthStatus> status = new AtomicReference<>(HealthStatus.HEALTHY);
    private final AtomicReference<String> error = new AtomicReference<>();
    private final AtomicReference<Map<String, Object>> detail = new AtomicReference<>(Map.of());
    private final AtomicReference<Mode> mode = new AtomicReference<>(Mode.REPORT);
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final AtomicInteger invocations = new AtomicInteger();

    /**
     * Creates an InMemoryHealthCheck that starts as HEALTHY.
     *
     * @param componentName the component name reported in health results
     */
    public InMemoryHealthCheck(String componentName) {
        this.componentName = componentName;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        invocations.incrementAndGet();
        switch (mode.get()) {
            case FAIL:
                return CompletableFuture.failedFuture(failure.get());
            case HANG:
                return new CompletableFuture<>();
            default:
                return CompletableFuture.completedFuture(
                        new ComponentHealth(componentName, status.get(), 0, error.get(), detail.get()));
        }
    }

    /** Sets this check to HEALTHY. */
    public InMemoryHealthCheck setHealthy() {
        return report(HealthStatus.HEALTHY, null);
    }

    /** Sets this check to DEGRADED with the given message. */
    public InMemoryHealthCheck setDegraded(String message) {
        return report(HealthStatus.DEGRADED, message);
    }

    /** Sets this check to UNHEALTHY with the given message. */
    public InMemoryHealthCheck setUnhealthy(String message) {
        return report(HealthStatus.UNHEALTHY, message);
    }

    /** Sets the detail map reported with the status. */
    public InMemoryHealthCheck setDetail(Map<String, Object> detail) {
        this.detail.set(Map.copyOf(detail));
        return this;
    }

    /** Makes the returned future complete exceptionally with {@code exception}. */
    public InMemoryHealthCheck failWith(RuntimeException exception) {
        this.failure.set(exception);
        this.mode.set(Mode.FAIL);
        return this;
    }

    /** Makes the returned future never complete. */
    public InMemoryHealthCheck hang() {
        this.mode.set(Mode.HANG);
        return this;
    }

    /** Returns how many times {@link #check()} has been called. */
    public int invocations() {
        return invocations.get();
    }

    /** Returns the component name. */
    public String componentName() {
        return componentName;
    }

    private InMemoryHealthCheck report(HealthStatus newStatus, String message) {
        this.status.set(newStatus);
        this.error.set(message);
        this.mode.set(Mode.REPORT);
        return this;
    }
}

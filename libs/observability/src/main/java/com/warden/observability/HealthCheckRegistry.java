package com.warden.observability;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry that aggregates multiple {@link HealthCheck} instances and runs them
 * concurrently to produce a single {@link HealthReport}.
 * <p>
 * Checks are registered by component name and reported in registration order. When
 * {@link #checkAll()} is called every check is started before any is awaited; each future
 * is converted into a {@link ComponentHealth} that never completes exceptionally (errors,
 * timeouts and null results become {@link HealthStatus#UNHEALTHY}), and the registry
 * waits on all of them before reducing to the aggregate status.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual health checks (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();
    private final long timeoutMs;
    private final Clock clock;

    /**
     * Creates a registry with the default timeout.
     */
    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * Creates a registry with a custom timeout.
     *
     * @param timeoutMs timeout in milliseconds for each individual health check
     */
    public HealthCheckRegistry(long timeoutMs) {
        this(timeoutMs, Clock.systemUTC());
    }

    /**
     * Creates a registry with a custom timeout and clock for report timestamps.
     *
     * @param timeoutMs timeout in milliseconds for each individual health check
     * @param clock     clock used to stamp reports
     */
    public HealthCheckRegistry(long timeoutMs, Clock clock) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    /**
     * Registers a health check under the given component name.
     * Replaces any existing check for the same name, keeping its position.
     *
     * @param name  component name (e.g., "database", "cache")
     * @param check the health check to register
     */
    public synchronized void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Removes a health check by component name.
     *
     * @param name component name to deregister
     * @return true if a check was removed
     */
    public synchronized boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs all registered health checks concurrently and aggregates the results.
     * <p>
     * Returns {@link HealthStatus#HEALTHY} with no components if nothing is registered.
     *
     * @return the aggregate health report
     */
    public HealthReport checkAll() {
        Map<String, HealthCheck> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(checks);
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, HealthCheck> entry : snapshot.entrySet()) {
            futures.put(entry.getKey(), launch(entry.getKey(), entry.getValue()));
        }

        // Barrier: every probe has produced a result (or been converted to one)
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        futures.forEach((name, future) -> results.put(name, future.join()));
        return HealthReport.of(results, clock.instant());
    }

    private CompletableFuture<ComponentHealth> launch(String name, HealthCheck check) {
        long start = System.nanoTime();
        CompletableFuture<ComponentHealth> future;
        try {
            future = check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    ComponentHealth.unhealthy(name, TimedHealthCheck.describe(e), TimedHealthCheck.elapsedMs(start)));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(
                    ComponentHealth.unhealthy(name, "Health check returned no result", 0));
        }
        return future
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((result, error) -> toResult(name, result, error, start));
    }

    private ComponentHealth toResult(String name, ComponentHealth result, Throwable error, long start) {
        if (error == null && result != null) {
            return result;
        }
        long elapsed = TimedHealthCheck.elapsedMs(start);
        if (error == null) {
            return ComponentHealth.unhealthy(name, "Health check returned no result", elapsed);
        }
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return ComponentHealth.unhealthy(name, "Timed out after " + timeoutMs + " ms", elapsed);
        }
        return ComponentHealth.unhealthy(name, TimedHealthCheck.describe(cause), elapsed);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns the number of registered health checks.
     */
    public synchronized int size() {
        return checks.size();
    }

    /**
     * Returns the configured timeout in milliseconds.
     */
    public long timeoutMs() {
        return timeoutMs;
    }
}

package com.warden.engine.domain.recovery;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-flight guard for recovery. At most one {@link Permit} is outstanding at any instant;
 * callers that fail to acquire do not wait.
 *
 * <pre>{@code
 * Optional<RecoveryGuard.Permit> permit = guard.tryAcquire();
 * if (permit.isEmpty()) {
 *     return skipped;
 * }
 * try (RecoveryGuard.Permit held = permit.get()) {
 *     ...
 * }
 * }</pre>
 */
public final class RecoveryGuard {

    private final AtomicBoolean inProgress = new AtomicBoolean(false);

    /** Acquires the guard if it is free. */
    public Optional<Permit> tryAcquire() {
        if (inProgress.compareAndSet(false, true)) {
            return Optional.of(new Permit());
        }
        return Optional.empty();
    }

    public boolean isHeld() {
        return inProgress.get();
    }

    /**
     * Proof of ownership. Closing it releases the guard; closing it again has no effect.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inProgress.set(false);
            }
        }
    }
}

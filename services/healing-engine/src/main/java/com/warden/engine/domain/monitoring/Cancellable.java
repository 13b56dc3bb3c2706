package com.warden.engine.domain.monitoring;

@FunctionalInterface
public interface Cancellable {

    /** Stops future executions. A running execution is allowed to finish. */
    void cancel();
}

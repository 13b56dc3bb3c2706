package com.warden.engine.infrastructure.queue;

import com.warden.engine.domain.recovery.WorkerHandle;
import com.warden.engine.domain.recovery.WorkerRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link WorkerRegistry}. Workers register themselves on start.
 */
public class InMemoryWorkerRegistry implements WorkerRegistry {

    private final List<WorkerHandle> workers = new CopyOnWriteArrayList<>();

    public void register(WorkerHandle worker) {
        workers.add(worker);
    }

    public void deregister(WorkerHandle worker) {
        workers.remove(worker);
    }

    @Override
    public List<WorkerHandle> workers() {
        return List.copyOf(workers);
    }
}

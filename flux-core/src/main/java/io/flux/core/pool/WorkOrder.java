package io.flux.core.pool;

import io.flux.api.pool.Work;

/**
 * A task travelling from a submitter to a worker, paired with the context it was submitted with.
 * {@link #KILL} is the stop token: the worker that receives it exits.
 */
record WorkOrder(Object context, Work work) {

    static final WorkOrder KILL = new WorkOrder(null, null);

    boolean isKill() {
        return this == KILL;
    }
}

/* (C)2026 */
package com.ammann.qkd.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "simulation-executor" bean used by SimulationBatchService to run
 * independent simulations side by side. Each submitted run owns its random stream, so
 * the pool size only bounds CPU usage.
 */
@ApplicationScoped
public class ExecutorProducer {

    static final int MAX_PARALLEL_RUNS = 4;
    static final int MAX_QUEUED_RUNS = 128;

    /**
     * Produces a named ManagedExecutor for batch simulation runs.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("simulation-executor")
    @ApplicationScoped
    public ManagedExecutor createSimulationExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(MAX_PARALLEL_RUNS)
                .maxQueued(MAX_QUEUED_RUNS) // one full batch of qkd.batch.max-runs fits twice
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}

/* (C)2026 */
package com.ammann.qkd.service;

import com.ammann.qkd.enumeration.StatisticsStatus;
import com.ammann.qkd.exception.ApiException;
import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.exception.SomeThingWentWrongException;
import com.ammann.qkd.model.BatchRunSummary;
import com.ammann.qkd.model.BatchSummary;
import com.ammann.qkd.model.SimulationConfig;
import com.ammann.qkd.model.SimulationResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Executes independent runs of one configuration in parallel and aggregates their outcomes.
 *
 * <p>Each run gets its own seed derived from the batch seed, so workers never share a random stream
 * and the whole batch is reproducible. Results are collected in run order regardless of completion
 * order. The first failing run fails the batch.
 */
@ApplicationScoped
public class SimulationBatchService {

    private static final Logger LOG = Logger.getLogger(SimulationBatchService.class);

    static final String COMPONENT = "SimulationBatch";
    static final int DEFAULT_MAX_RUNS = 64;

    private final QuantumChannelSimulationService simulationService;
    private final ExecutorService executor;

    @ConfigProperty(name = "qkd.batch.max-runs", defaultValue = "64")
    int maxRuns = DEFAULT_MAX_RUNS;

    @Inject
    public SimulationBatchService(
            QuantumChannelSimulationService simulationService,
            @Named("simulation-executor") ExecutorService executor) {
        this.simulationService = simulationService;
        this.executor = executor;
    }

    /**
     * Runs {@code runs} simulations of {@code config}.
     *
     * @param config   configuration shared by all runs; its own seed is ignored
     * @param runs     number of runs, between 1 and {@code qkd.batch.max-runs}
     * @param baseSeed batch seed, null for a fresh one
     * @return aggregated summary with one entry per run
     */
    public BatchSummary runBatch(SimulationConfig config, int runs, Long baseSeed) {
        if (runs <= 0 || runs > maxRuns) {
            throw InvalidParameterException.of(COMPONENT, "runs", runs, "value in [1, " + maxRuns + "]");
        }
        long seed = baseSeed != null ? baseSeed : RandomStreams.freshSeed();

        List<CompletableFuture<SimulationResult>> futures = new ArrayList<>(runs);
        for (int i = 0; i < runs; i++) {
            SimulationConfig runConfig = config.withSeed(RandomStreams.deriveSeed(seed, i));
            futures.add(
                    CompletableFuture.supplyAsync(
                            () -> simulationService.runSimulation(runConfig), executor));
        }

        List<BatchRunSummary> summaries = new ArrayList<>(runs);
        for (int i = 0; i < runs; i++) {
            summaries.add(BatchRunSummary.of(i, await(futures.get(i))));
        }

        BatchSummary summary = aggregate(seed, config.trueOffset(), summaries);
        LOG.infof(
                "Batch seed=%d: %d runs, sync rate %.3f, mean QBER %.4f, %d degenerate",
                seed, runs, summary.syncSuccessRate(), summary.meanQber(), summary.degenerateRuns());
        return summary;
    }

    private SimulationResult await(CompletableFuture<SimulationResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ApiException apiException) {
                throw apiException;
            }
            throw new SomeThingWentWrongException(COMPONENT, e.getCause());
        }
    }

    static BatchSummary aggregate(long baseSeed, int trueOffset, List<BatchRunSummary> summaries) {
        int runs = summaries.size();
        int synced = 0;
        int degenerate = 0;
        double countSum = 0.0;
        double offsetErrorSum = 0.0;
        List<Double> qbers = new ArrayList<>(runs);

        for (BatchRunSummary run : summaries) {
            if (run.syncSuccess()) {
                synced++;
            }
            if (run.status() == StatisticsStatus.DEGENERATE) {
                degenerate++;
            } else {
                qbers.add(run.qber());
            }
            countSum += run.totalCounts();
            offsetErrorSum += Math.abs(run.peakOffset() - trueOffset);
        }

        double meanQber = qbers.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double qberVariance =
                qbers.stream().mapToDouble(q -> (q - meanQber) * (q - meanQber)).average().orElse(0.0);

        return new BatchSummary(
                runs,
                baseSeed,
                synced / (double) runs,
                meanQber,
                Math.sqrt(qberVariance),
                countSum / runs,
                offsetErrorSum / runs,
                degenerate,
                summaries);
    }
}

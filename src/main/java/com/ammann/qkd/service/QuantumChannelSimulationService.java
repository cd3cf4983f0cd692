/* (C)2026 */
package com.ammann.qkd.service;

import com.ammann.qkd.enumeration.RunOutcome;
import com.ammann.qkd.exception.ApiException;
import com.ammann.qkd.model.CorrelationResult;
import com.ammann.qkd.model.DetectionEvent;
import com.ammann.qkd.model.GeneratedStates;
import com.ammann.qkd.model.Histogram;
import com.ammann.qkd.model.HistogramPair;
import com.ammann.qkd.model.SimulationConfig;
import com.ammann.qkd.model.SimulationResult;
import com.ammann.qkd.model.SimulationStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.apache.commons.math3.random.RandomGenerator;
import org.jboss.logging.Logger;

/**
 * Runs the complete simulation pipeline for one configuration.
 *
 * <p>Stages execute strictly in order: state generation, channel, detection record, histograms,
 * correlation, statistics. The run owns a single seeded random stream that every stochastic stage
 * draws from, so a run is reproducible from its seed and independent runs can execute on separate
 * threads without coordination.
 *
 * <p>A run without any detection is a valid but degenerate outcome: the correlation is reported as
 * an all-zero series without synchronisation and the statistics are flagged DEGENERATE. Invalid
 * parameters abort the run with the rejecting component named in the exception.
 */
@ApplicationScoped
public class QuantumChannelSimulationService {

    private static final Logger LOG = Logger.getLogger(QuantumChannelSimulationService.class);

    private final StateGeneratorService stateGenerator;
    private final ChannelEffectsService channelEffects;
    private final DetectionHandlerService detectionHandler;
    private final DataPreprocessorService preprocessor;
    private final CorrelationEngineService correlationEngine;
    private final StatisticsCalculatorService statisticsCalculator;

    @Inject MeterRegistry meterRegistry;

    @Inject
    public QuantumChannelSimulationService(
            StateGeneratorService stateGenerator,
            ChannelEffectsService channelEffects,
            DetectionHandlerService detectionHandler,
            DataPreprocessorService preprocessor,
            CorrelationEngineService correlationEngine,
            StatisticsCalculatorService statisticsCalculator) {
        this.stateGenerator = stateGenerator;
        this.channelEffects = channelEffects;
        this.detectionHandler = detectionHandler;
        this.preprocessor = preprocessor;
        this.correlationEngine = correlationEngine;
        this.statisticsCalculator = statisticsCalculator;
    }

    /**
     * Executes one simulation run.
     *
     * @param config run parameters; a null seed draws a fresh one
     * @return correlation, statistics and raw series of the run
     * @throws com.ammann.qkd.exception.InvalidParameterException if any stage rejects its input
     */
    public SimulationResult runSimulation(SimulationConfig config) {
        return execute(config, true);
    }

    /**
     * Executes one run without recording it in the run metrics, for internal self-checks.
     */
    public SimulationResult runSelfTest(SimulationConfig config) {
        return execute(config, false);
    }

    private SimulationResult execute(SimulationConfig config, boolean recorded) {
        Objects.requireNonNull(config, "config");
        long seed = config.seed() != null ? config.seed() : RandomStreams.freshSeed();
        RandomGenerator rng = RandomStreams.forSeed(seed);
        long started = System.nanoTime();

        try {
            GeneratedStates states =
                    stateGenerator.generateStates(
                            config.signalPower(),
                            config.decoyPower(),
                            config.signalProbability(),
                            config.blockSize(),
                            rng);
            // window size depends on maxOffset, so the search range is checked before it is built
            correlationEngine.validateSearch(
                    states.size(), states.size(), config.maxOffset(), config.confidenceThreshold());

            List<DetectionEvent> survivors =
                    channelEffects.applyChannel(states, config.channelConfig(), rng);

            int window = config.detectionWindowBins();
            List<DetectionEvent> events =
                    detectionHandler.recordDetections(survivors, config.darkCountRate(), window, rng);

            SimulationResult result =
                    events.isEmpty()
                            ? degenerateRun(config, seed, states, events, window, started)
                            : correlatedRun(config, seed, states, events, window, started);

            if (recorded) {
                recordOutcome(RunOutcome.of(result.statistics()), result.durationNanos());
            }
            LOG.infof(
                    "Simulation seed=%d: peak offset %d (true %d), sync=%s, %d counts, QBER=%.4f",
                    seed,
                    result.correlation().peakOffset(),
                    config.trueOffset(),
                    result.statistics().syncSuccess(),
                    result.statistics().totalCounts(),
                    result.statistics().qber());
            return result;
        } catch (ApiException e) {
            if (recorded) {
                recordOutcome(RunOutcome.REJECTED, System.nanoTime() - started);
            }
            LOG.debugf("Simulation seed=%d rejected: %s", seed, e.getMessage());
            throw e;
        }
    }

    private SimulationResult correlatedRun(
            SimulationConfig config,
            long seed,
            GeneratedStates states,
            List<DetectionEvent> events,
            int window,
            long started) {
        HistogramPair histograms = preprocessor.buildHistograms(states, events, window);
        CorrelationResult correlation =
                correlationEngine.correlate(
                        histograms.reference(),
                        histograms.detected(),
                        config.maxOffset(),
                        config.confidenceThreshold());
        SimulationStatistics statistics =
                statisticsCalculator.computeStatistics(
                        events,
                        correlation,
                        states,
                        config.timeBinWidth(),
                        histograms.detected().length());

        return new SimulationResult(
                config,
                seed,
                correlation,
                statistics,
                histograms.reference(),
                histograms.detected(),
                System.nanoTime() - started);
    }

    private SimulationResult degenerateRun(
            SimulationConfig config,
            long seed,
            GeneratedStates states,
            List<DetectionEvent> events,
            int window,
            long started) {
        Histogram reference = preprocessor.referenceHistogram(states.size(), states.signalFlags());

        CorrelationResult correlation = CorrelationResult.empty(config.maxOffset());
        SimulationStatistics statistics =
                statisticsCalculator.computeStatistics(
                        events, correlation, states, config.timeBinWidth(), window);

        LOG.warnf(
                "Simulation seed=%d produced no detections (loss=%.4f, dark rate=%.4g)",
                seed, config.lossProbability(), config.darkCountRate());

        return new SimulationResult(
                config,
                seed,
                correlation,
                statistics,
                reference,
                Histogram.zeros(window),
                System.nanoTime() - started);
    }

    private void recordOutcome(RunOutcome outcome, long durationNanos) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("qkd_simulation_runs_total")
                .description("Total number of simulation runs by outcome")
                .tag("outcome", outcome.getTag())
                .register(meterRegistry)
                .increment();
        Timer.builder("qkd_simulation_duration")
                .description("Wall-clock duration of simulation runs")
                .register(meterRegistry)
                .record(Duration.ofNanos(durationNanos));
    }
}

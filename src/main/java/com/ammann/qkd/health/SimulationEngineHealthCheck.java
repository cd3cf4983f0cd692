/* (C)2026 */
package com.ammann.qkd.health;

import com.ammann.qkd.enumeration.LossModel;
import com.ammann.qkd.exception.ApiException;
import com.ammann.qkd.model.SimulationConfig;
import com.ammann.qkd.model.SimulationResult;
import com.ammann.qkd.service.QuantumChannelSimulationService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Health check for the simulation pipeline.
 * Runs a small fixed-seed simulation and verifies the clock offset is recovered.
 * Probe runs are kept out of the run metrics.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: Pipeline completed and found the configured offset</li>
 *   <li>DOWN: Pipeline rejected the probe or recovered a wrong offset</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class SimulationEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(SimulationEngineHealthCheck.class);

    static final String CHECK_NAME = "simulation-engine";
    static final SimulationConfig PROBE =
            SimulationConfig.builder()
                    .blockSize(256)
                    .signalProbability(0.5)
                    .lossProbability(0.5)
                    .darkCountRate(0.0)
                    .trueOffset(3)
                    .maxOffset(8)
                    .lossModel(LossModel.INTENSITY_WEIGHTED)
                    .seed(42L)
                    .build();

    @Inject QuantumChannelSimulationService simulationService;

    @Override
    public HealthCheckResponse call() {
        try {
            SimulationResult result = simulationService.runSelfTest(PROBE);
            int recovered = result.correlation().peakOffset();
            boolean operational = recovered == PROBE.trueOffset();

            return HealthCheckResponse.named(CHECK_NAME)
                    .status(operational)
                    .withData("recovered-offset", recovered)
                    .withData("expected-offset", PROBE.trueOffset())
                    .withData("sync", result.statistics().syncSuccess())
                    .withData("duration-ms", result.durationNanos() / 1_000_000L)
                    .build();
        } catch (ApiException e) {
            LOG.errorf(e, "Simulation probe rejected");
            return HealthCheckResponse.named(CHECK_NAME)
                    .down()
                    .withData("component", e.getComponent())
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}

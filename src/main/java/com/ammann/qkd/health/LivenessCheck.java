package com.ammann.qkd.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check for the simulator process. Reports UP while the JVM answers; pipeline
 * readiness is covered by {@link SimulationEngineHealthCheck}.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{
    static final String CHECK_NAME = "alive";

    @Override
    public HealthCheckResponse call()
    {
        Runtime runtime = Runtime.getRuntime();
        return HealthCheckResponse.named(CHECK_NAME)
                .up()
                .withData("available-processors", runtime.availableProcessors())
                .build();
    }
}

package com.ammann.qkd.service;

import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.GeneratedStates;
import com.ammann.qkd.model.PulseRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.random.RandomGenerator;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Draws the sender's sequence of signal and decoy pulses.
 *
 * <p>Each slot is an independent trial: signal intensity with probability
 * {@code signalProbability}, decoy intensity otherwise. No temporal correlation is introduced.
 */
@ApplicationScoped
public class StateGeneratorService
{
    private static final Logger LOG = Logger.getLogger(StateGeneratorService.class);

    static final String COMPONENT = "StateGenerator";
    static final int DEFAULT_MAX_BLOCK_SIZE = 1_000_000;

    @ConfigProperty(name = "qkd.simulation.max-block-size", defaultValue = "1000000")
    int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;

    /**
     * Generates one block of pulses.
     *
     * @param signalPower       mean photon number of signal pulses, at least 0
     * @param decoyPower        mean photon number of decoy pulses, at least 0
     * @param signalProbability probability of a signal pulse, in [0, 1]
     * @param blockSize         number of pulses, positive
     * @param rng               random stream of the run
     * @return pulses ordered by slot index
     * @throws InvalidParameterException if any argument is out of range
     */
    public GeneratedStates generateStates(double signalPower, double decoyPower, double signalProbability,
                                          int blockSize, RandomGenerator rng)
    {
        validate(signalPower, decoyPower, signalProbability, blockSize);
        Objects.requireNonNull(rng, "rng");

        List<PulseRecord> pulses = new ArrayList<>(blockSize);
        int signalCount = 0;
        for (int i = 0; i < blockSize; i++) {
            boolean signal = rng.nextDouble() < signalProbability;
            double intensity = signal ? signalPower : decoyPower;
            // equal powers make every pulse indistinguishable from a signal pulse
            boolean flag = signal || intensity == signalPower;
            pulses.add(new PulseRecord(i, intensity, flag));
            if (flag) {
                signalCount++;
            }
        }

        LOG.debugf("Generated %d pulses: %d signal (%.3f), %d decoy",
                blockSize, signalCount, signalCount / (double) blockSize, blockSize - signalCount);

        return new GeneratedStates(pulses, signalPower, decoyPower);
    }

    private void validate(double signalPower, double decoyPower, double signalProbability, int blockSize)
    {
        if (!(signalPower >= 0) || Double.isInfinite(signalPower)) {
            throw InvalidParameterException.of(COMPONENT, "signalPower", signalPower, "finite value >= 0");
        }
        if (!(decoyPower >= 0) || Double.isInfinite(decoyPower)) {
            throw InvalidParameterException.of(COMPONENT, "decoyPower", decoyPower, "finite value >= 0");
        }
        if (!(signalProbability >= 0 && signalProbability <= 1)) {
            throw InvalidParameterException.of(COMPONENT, "signalProbability", signalProbability, "value in [0, 1]");
        }
        if (blockSize <= 0) {
            throw InvalidParameterException.of(COMPONENT, "blockSize", blockSize, "positive integer");
        }
        if (blockSize > maxBlockSize) {
            throw InvalidParameterException.of(COMPONENT, "blockSize", blockSize, "at most " + maxBlockSize);
        }
    }
}

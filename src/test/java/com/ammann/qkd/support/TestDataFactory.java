/* (C)2026 */
package com.ammann.qkd.support;

import com.ammann.qkd.enumeration.DetectionOrigin;
import com.ammann.qkd.model.DetectionEvent;
import com.ammann.qkd.model.GeneratedStates;
import com.ammann.qkd.model.Histogram;
import com.ammann.qkd.model.PulseRecord;
import com.ammann.qkd.service.ChannelEffectsService;
import com.ammann.qkd.service.CorrelationEngineService;
import com.ammann.qkd.service.DataPreprocessorService;
import com.ammann.qkd.service.DetectionHandlerService;
import com.ammann.qkd.service.QuantumChannelSimulationService;
import com.ammann.qkd.service.StateGeneratorService;
import com.ammann.qkd.service.StatisticsCalculatorService;
import java.util.ArrayList;
import java.util.List;

public final class TestDataFactory {

    public static final double SIGNAL_POWER = 0.5;
    public static final double DECOY_POWER = 0.1;

    /** Marks with pairwise distinct differences: every shift but 0 overlaps in at most one mark. */
    public static final int[] GOLOMB_MARKS = {0, 1, 4, 9, 15, 22, 32, 34};

    private TestDataFactory() {}

    /**
     * Builds a block whose slot {@code i} is a signal pulse iff {@code flags[i]}.
     */
    public static GeneratedStates states(boolean... flags) {
        List<PulseRecord> pulses = new ArrayList<>(flags.length);
        for (int i = 0; i < flags.length; i++) {
            pulses.add(new PulseRecord(i, flags[i] ? SIGNAL_POWER : DECOY_POWER, flags[i]));
        }
        return new GeneratedStates(pulses, SIGNAL_POWER, DECOY_POWER);
    }

    public static GeneratedStates alternatingStates(int size) {
        boolean[] flags = new boolean[size];
        for (int i = 0; i < size; i++) {
            flags[i] = i % 2 == 0;
        }
        return states(flags);
    }

    public static DetectionEvent event(long bin, DetectionOrigin origin) {
        return new DetectionEvent(bin, origin);
    }

    /**
     * Sparse reference pattern of the given length with ones at the Golomb marks offset by {@code start}.
     */
    public static int[] golombPattern(int length, int start) {
        int[] pattern = new int[length];
        for (int mark : GOLOMB_MARKS) {
            pattern[start + mark] = 1;
        }
        return pattern;
    }

    /**
     * Copies {@code pattern} into a zero histogram of {@code length} bins, moved right by {@code shift}.
     */
    public static Histogram shifted(int[] pattern, int shift, int length) {
        int[] counts = new int[length];
        for (int i = 0; i < pattern.length; i++) {
            int target = i + shift;
            if (target >= 0 && target < length) {
                counts[target] = pattern[i];
            }
        }
        return Histogram.of(counts);
    }

    public static QuantumChannelSimulationService simulationService() {
        return new QuantumChannelSimulationService(
                new StateGeneratorService(),
                new ChannelEffectsService(),
                new DetectionHandlerService(),
                new DataPreprocessorService(),
                new CorrelationEngineService(),
                new StatisticsCalculatorService());
    }
}

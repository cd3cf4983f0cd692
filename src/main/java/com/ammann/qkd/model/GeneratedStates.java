package com.ammann.qkd.model;

import java.util.List;

/**
 * Block of pulses produced by the state generator, ordered by slot index.
 *
 * <p>Exposes the two parallel views of the block: the intensity sequence and the
 * signal flags. {@code signalFlags()[i]} is true iff {@code intensities()[i]} was drawn
 * at signal power.
 */
public record GeneratedStates(List<PulseRecord> pulses, double signalPower, double decoyPower)
{
    public GeneratedStates {
        pulses = List.copyOf(pulses);
    }

    public int size()
    {
        return pulses.size();
    }

    public double[] intensities()
    {
        double[] intensities = new double[pulses.size()];
        for (int i = 0; i < intensities.length; i++) {
            intensities[i] = pulses.get(i).intensity();
        }
        return intensities;
    }

    public boolean[] signalFlags()
    {
        boolean[] flags = new boolean[pulses.size()];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = pulses.get(i).signal();
        }
        return flags;
    }

    public long signalCount()
    {
        return pulses.stream().filter(PulseRecord::signal).count();
    }

    /**
     * Mean intensity of the block, 0 for an all-vacuum block.
     */
    public double meanIntensity()
    {
        return pulses.stream().mapToDouble(PulseRecord::intensity).average().orElse(0.0);
    }
}

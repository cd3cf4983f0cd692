package com.ammann.qkd.model;

import java.util.stream.IntStream;

/**
 * Cross-correlation of the reference and detected histograms over a symmetric offset range.
 *
 * <p>{@code offsets} and {@code correlationValues} are index-aligned. {@code peakOffset} is the
 * offset with the maximal value; ties go to the smallest magnitude, then to the smallest signed
 * offset. The noise floor statistics are computed over every evaluated offset except the peak.
 */
public record CorrelationResult(
        int[] offsets,
        double[] correlationValues,
        int peakOffset,
        double peakValue,
        boolean syncSuccess,
        double noiseFloorMean,
        double noiseFloorStd
) {
    public CorrelationResult {
        if (offsets.length != correlationValues.length) {
            throw new IllegalArgumentException("offsets and correlation values differ in length: "
                    + offsets.length + " vs " + correlationValues.length);
        }
        offsets = offsets.clone();
        correlationValues = correlationValues.clone();
    }

    /**
     * All-zero correlation over {@code [-maxOffset, maxOffset]}, reported when nothing was detected.
     */
    public static CorrelationResult empty(int maxOffset)
    {
        int[] offsets = IntStream.rangeClosed(-maxOffset, maxOffset).toArray();
        return new CorrelationResult(offsets, new double[offsets.length], 0, 0.0, false, 0.0, 0.0);
    }

    @Override
    public int[] offsets()
    {
        return offsets.clone();
    }

    @Override
    public double[] correlationValues()
    {
        return correlationValues.clone();
    }

    /**
     * Peak excess over the noise floor in units of its standard deviation, or 0 for a flat floor.
     */
    public double peakSignificance()
    {
        return noiseFloorStd > 0 ? (peakValue - noiseFloorMean) / noiseFloorStd : 0.0;
    }
}

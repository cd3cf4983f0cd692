package com.ammann.qkd.service;

import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.CorrelationResult;
import com.ammann.qkd.model.Histogram;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Recovers the receiver clock offset by discrete cross-correlation.
 *
 * <p>For every candidate offset {@code k} in {@code [-maxOffset, maxOffset]} computes
 * <pre>C(k) = sum_i reference[i] * detected[i + k]</pre>
 * over the indices where both histograms are defined. The offset with the largest value wins; ties
 * go to the smallest {@code |k|}, then to the smallest signed {@code k}.
 *
 * <p>Synchronisation is declared when the peak stands out of the noise floor formed by all other
 * offsets: {@code peak > mean + threshold * std} and {@code peak > 0}. A flat correlation never
 * synchronises.
 *
 * <p>Cost is O(maxOffset x reference length). Offsets are independent, so large searches are spread
 * over the common fork-join pool; the result does not depend on evaluation order.
 */
@ApplicationScoped
public class CorrelationEngineService
{
    private static final Logger LOG = Logger.getLogger(CorrelationEngineService.class);

    static final String COMPONENT = "CorrelationEngine";
    static final double DEFAULT_CONFIDENCE_THRESHOLD = 3.0;
    static final long DEFAULT_PARALLEL_THRESHOLD = 200_000L;

    @ConfigProperty(name = "qkd.correlation.confidence-threshold", defaultValue = "3.0")
    double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

    /**
     * Number of multiply-adds above which offsets are evaluated in parallel.
     */
    @ConfigProperty(name = "qkd.correlation.parallel-threshold", defaultValue = "200000")
    long parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

    public CorrelationResult correlate(Histogram reference, Histogram detected, int maxOffset)
    {
        return correlate(reference, detected, maxOffset, confidenceThreshold);
    }

    /**
     * Correlates the two histograms and decides whether the clock offset was found.
     *
     * @param reference           transmitted pattern
     * @param detected            receiver counts
     * @param maxOffset           largest offset magnitude, positive and below both histogram lengths
     * @param confidenceThreshold noise-floor standard deviations the peak must exceed, at least 0
     * @return offsets, values, peak and sync decision
     * @throws InvalidParameterException if the offset range or threshold is invalid
     */
    public CorrelationResult correlate(Histogram reference, Histogram detected, int maxOffset,
                                       double confidenceThreshold)
    {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(detected, "detected");
        validateSearch(reference.length(), detected.length(), maxOffset, confidenceThreshold);

        int[] ref = reference.toArray();
        int[] det = detected.toArray();
        int candidates = 2 * maxOffset + 1;
        int[] offsets = new int[candidates];
        double[] values = new double[candidates];

        IntStream indices = IntStream.range(0, candidates);
        if ((long) candidates * ref.length >= parallelThreshold) {
            indices = indices.parallel();
        }
        indices.forEach(j -> {
            offsets[j] = j - maxOffset;
            values[j] = correlationAt(ref, det, j - maxOffset);
        });

        int peakIndex = 0;
        for (int j = 1; j < candidates; j++) {
            if (isBetterPeak(offsets[j], values[j], offsets[peakIndex], values[peakIndex])) {
                peakIndex = j;
            }
        }

        double floorSum = 0.0;
        for (int j = 0; j < candidates; j++) {
            if (j != peakIndex) {
                floorSum += values[j];
            }
        }
        double floorMean = floorSum / (candidates - 1);
        double floorSquares = 0.0;
        for (int j = 0; j < candidates; j++) {
            if (j != peakIndex) {
                double d = values[j] - floorMean;
                floorSquares += d * d;
            }
        }
        double floorStd = Math.sqrt(floorSquares / (candidates - 1));

        double peakValue = values[peakIndex];
        boolean syncSuccess = peakValue > 0 && peakValue > floorMean + confidenceThreshold * floorStd;

        if (syncSuccess) {
            LOG.debugf("Correlation peak at offset %d (C=%.1f, floor %.2f +/- %.2f)",
                    offsets[peakIndex], peakValue, floorMean, floorStd);
        } else {
            LOG.warnf("No synchronisation: best offset %d (C=%.1f) within %.1f sigma of floor %.2f +/- %.2f",
                    offsets[peakIndex], peakValue, confidenceThreshold, floorMean, floorStd);
        }

        return new CorrelationResult(offsets, values, offsets[peakIndex], peakValue, syncSuccess, floorMean, floorStd);
    }

    /**
     * Checks an offset search against histogram sizes without running it.
     */
    public void validateSearch(int referenceLength, int detectedLength, int maxOffset, double confidenceThreshold)
    {
        if (referenceLength <= 0) {
            throw InvalidParameterException.of(COMPONENT, "reference.length", referenceLength, "positive length");
        }
        if (detectedLength <= 0) {
            throw InvalidParameterException.of(COMPONENT, "detected.length", detectedLength, "positive length");
        }
        if (maxOffset <= 0) {
            throw InvalidParameterException.of(COMPONENT, "maxOffset", maxOffset, "positive integer");
        }
        int bound = Math.min(referenceLength, detectedLength);
        if (maxOffset >= bound) {
            throw InvalidParameterException.of(COMPONENT, "maxOffset", maxOffset,
                    "less than the shorter histogram length " + bound);
        }
        if (!(confidenceThreshold >= 0) || Double.isInfinite(confidenceThreshold)) {
            throw InvalidParameterException.of(COMPONENT, "confidenceThreshold", confidenceThreshold,
                    "finite value >= 0");
        }
    }

    static double correlationAt(int[] ref, int[] det, int k)
    {
        int from = Math.max(0, -k);
        int to = Math.min(ref.length, det.length - k);
        long sum = 0;
        for (int i = from; i < to; i++) {
            if (ref[i] != 0) {
                sum += (long) ref[i] * det[i + k];
            }
        }
        return sum;
    }

    static boolean isBetterPeak(int offset, double value, int bestOffset, double bestValue)
    {
        if (value != bestValue) {
            return value > bestValue;
        }
        int magnitude = Math.abs(offset);
        int bestMagnitude = Math.abs(bestOffset);
        if (magnitude != bestMagnitude) {
            return magnitude < bestMagnitude;
        }
        return offset < bestOffset;
    }
}

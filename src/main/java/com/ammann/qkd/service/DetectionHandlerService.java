package com.ammann.qkd.service;

import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.DetectionEvent;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds the receiver's detection record: surviving pulses plus detector dark counts.
 *
 * <p>Dark counts form a homogeneous point process over the detection window; the number of dark
 * events in each bin is an independent Poisson draw with mean {@code darkCountRate}. The merged record
 * is sorted ascending by time bin and keeps every event, including several in the same bin.
 * Survivors arriving at or after the end of the window are not observed and leave the record.
 */
@ApplicationScoped
public class DetectionHandlerService
{
    private static final Logger LOG = Logger.getLogger(DetectionHandlerService.class);

    static final String COMPONENT = "DetectionHandler";

    /**
     * Merges surviving pulse events with freshly drawn dark counts.
     *
     * @param survivors           events produced by the channel, in any order
     * @param darkCountRate       mean dark counts per bin, at least 0
     * @param detectionWindowBins number of bins the detector observes, positive
     * @param rng                 random stream of the run
     * @return unmodifiable record sorted by time bin, of size {@code survivors in window + dark counts}
     */
    public List<DetectionEvent> recordDetections(List<DetectionEvent> survivors, double darkCountRate,
                                                 int detectionWindowBins, RandomGenerator rng)
    {
        Objects.requireNonNull(survivors, "survivors");
        Objects.requireNonNull(rng, "rng");
        if (!(darkCountRate >= 0) || Double.isInfinite(darkCountRate)) {
            throw InvalidParameterException.of(COMPONENT, "darkCountRate", darkCountRate, "finite value >= 0");
        }
        if (detectionWindowBins <= 0) {
            throw InvalidParameterException.of(COMPONENT, "detectionWindowBins", detectionWindowBins, "positive integer");
        }

        List<DetectionEvent> darkCounts = generateDarkCounts(darkCountRate, detectionWindowBins, rng);

        List<DetectionEvent> merged = new ArrayList<>(survivors.size() + darkCounts.size());
        int afterWindow = 0;
        for (DetectionEvent survivor : survivors) {
            if (survivor.timestampBin() >= detectionWindowBins) {
                afterWindow++;
            } else {
                merged.add(survivor);
            }
        }
        merged.addAll(darkCounts);
        merged.sort(DetectionEvent.BY_TIME);

        LOG.debugf("Detection record: %d survivor events (%d after window) + %d dark counts over %d bins",
                survivors.size() - afterWindow, afterWindow, darkCounts.size(), detectionWindowBins);

        return Collections.unmodifiableList(merged);
    }

    List<DetectionEvent> generateDarkCounts(double darkCountRate, int detectionWindowBins, RandomGenerator rng)
    {
        if (darkCountRate == 0.0) {
            return List.of();
        }

        PoissonDistribution perBin = new PoissonDistribution(rng, darkCountRate,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);

        List<DetectionEvent> darkCounts = new ArrayList<>();
        for (int bin = 0; bin < detectionWindowBins; bin++) {
            int events = perBin.sample();
            for (int e = 0; e < events; e++) {
                darkCounts.add(DetectionEvent.dark(bin));
            }
        }
        return darkCounts;
    }
}

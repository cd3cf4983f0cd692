package com.ammann.qkd.service;

import com.ammann.qkd.enumeration.DetectionOrigin;
import com.ammann.qkd.enumeration.StatisticsStatus;
import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.CorrelationResult;
import com.ammann.qkd.model.DetectionEvent;
import com.ammann.qkd.model.GeneratedStates;
import com.ammann.qkd.model.SimulationStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Computes count rates and the quantum bit error rate of a run once its clock offset is known.
 *
 * <p>Every detection is mapped back to the sent slot {@code timestampBin - peakOffset}. A detection
 * counts as an error when it is a dark count, when the mapped slot lies outside the sent block, or
 * when its intensity class differs from the class sent in that slot. {@code qber = errors / total}.
 *
 * <p>Rates are expressed in detections per picosecond of observation time.
 */
@ApplicationScoped
public class StatisticsCalculatorService
{
    private static final Logger LOG = Logger.getLogger(StatisticsCalculatorService.class);

    static final String COMPONENT = "StatisticsCalculator";

    /**
     * Computes statistics over a window spanning the sent block and the last detection.
     */
    public SimulationStatistics computeStatistics(List<DetectionEvent> detectedEvents, CorrelationResult correlation,
                                                  GeneratedStates referenceStates, double timeBinWidth)
    {
        Objects.requireNonNull(detectedEvents, "detectedEvents");
        Objects.requireNonNull(referenceStates, "referenceStates");
        long lastBin = detectedEvents.stream().mapToLong(DetectionEvent::timestampBin).max().orElse(-1L);
        long observedBins = Math.max(referenceStates.size(), lastBin + 1);
        return computeStatistics(detectedEvents, correlation, referenceStates, timeBinWidth, observedBins);
    }

    /**
     * Computes statistics for a run.
     *
     * @param detectedEvents  detection record of the run
     * @param correlation     correlation result providing the recovered offset
     * @param referenceStates transmitted block
     * @param timeBinWidth    bin width in picoseconds, positive
     * @param observedBins    length of the observation window in bins, positive
     * @return statistics; DEGENERATE with zero rates when nothing was detected
     */
    public SimulationStatistics computeStatistics(List<DetectionEvent> detectedEvents, CorrelationResult correlation,
                                                  GeneratedStates referenceStates, double timeBinWidth,
                                                  long observedBins)
    {
        Objects.requireNonNull(detectedEvents, "detectedEvents");
        Objects.requireNonNull(correlation, "correlation");
        Objects.requireNonNull(referenceStates, "referenceStates");
        if (!(timeBinWidth > 0) || Double.isInfinite(timeBinWidth)) {
            throw InvalidParameterException.of(COMPONENT, "timeBinWidth", timeBinWidth, "finite value > 0");
        }
        if (observedBins <= 0) {
            throw InvalidParameterException.of(COMPONENT, "observedBins", observedBins, "positive integer");
        }

        long totalCounts = detectedEvents.size();
        if (totalCounts == 0) {
            LOG.warn("No detections recorded, statistics are degenerate");
            return SimulationStatistics.degenerate(correlation.syncSuccess());
        }

        boolean[] sentSignal = referenceStates.signalFlags();
        int peakOffset = correlation.peakOffset();
        long signalCounts = 0;
        long decoyCounts = 0;
        long darkCounts = 0;
        long errors = 0;

        for (DetectionEvent event : detectedEvents) {
            DetectionOrigin origin = event.origin();
            switch (origin) {
                case SIGNAL -> signalCounts++;
                case DECOY -> decoyCounts++;
                case DARK -> darkCounts++;
            }
            if (isError(event, peakOffset, sentSignal)) {
                errors++;
            }
        }

        double duration = observedBins * timeBinWidth;
        double qber = errors / (double) totalCounts;

        LOG.debugf("Statistics: %d counts (%d signal, %d decoy, %d dark), %d errors, QBER=%.4f",
                totalCounts, signalCounts, decoyCounts, darkCounts, errors, qber);

        return new SimulationStatistics(
                totalCounts,
                totalCounts / duration,
                qber,
                correlation.syncSuccess(),
                signalCounts,
                decoyCounts,
                darkCounts,
                errors,
                signalCounts / duration,
                decoyCounts / duration,
                StatisticsStatus.VALID);
    }

    static boolean isError(DetectionEvent event, int peakOffset, boolean[] sentSignal)
    {
        if (!event.origin().isTransmitted()) {
            return true;
        }
        long slot = event.timestampBin() - peakOffset;
        if (slot < 0 || slot >= sentSignal.length) {
            return true;
        }
        boolean detectedSignal = event.origin() == DetectionOrigin.SIGNAL;
        return detectedSignal != sentSignal[(int) slot];
    }
}

package com.ammann.qkd.service;

import com.ammann.qkd.exception.EmptyInputException;
import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.DetectionEvent;
import com.ammann.qkd.model.GeneratedStates;
import com.ammann.qkd.model.Histogram;
import com.ammann.qkd.model.HistogramPair;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Bins the transmitted pattern and the detection record into two aligned histograms.
 *
 * <p>The reference histogram holds 1 for every signal slot and 0 for every decoy slot, one bin per
 * sent pulse. The detected histogram counts events per receiver time bin and spans at least the
 * requested window, so positive and negative candidate offsets can be evaluated. Pure aggregation,
 * no randomness.
 */
@ApplicationScoped
public class DataPreprocessorService
{
    private static final Logger LOG = Logger.getLogger(DataPreprocessorService.class);

    static final String COMPONENT = "DataPreprocessor";

    /**
     * Builds both histograms with a detected window of at least {@code sentPulseCount} bins.
     *
     * @param sentPulseCount number of transmitted pulses, positive
     * @param signalFlags    signal flag per transmitted pulse
     * @param detectedEvents detection record, must not be empty
     * @return reference and detected histograms
     * @throws EmptyInputException if there is no detection to bin
     */
    public HistogramPair buildHistograms(int sentPulseCount, boolean[] signalFlags, List<DetectionEvent> detectedEvents)
    {
        return buildHistograms(sentPulseCount, signalFlags, detectedEvents, sentPulseCount);
    }

    public HistogramPair buildHistograms(GeneratedStates states, List<DetectionEvent> detectedEvents,
                                         int minimumWindowBins)
    {
        Objects.requireNonNull(states, "states");
        return buildHistograms(states.size(), states.signalFlags(), detectedEvents, minimumWindowBins);
    }

    public HistogramPair buildHistograms(int sentPulseCount, boolean[] signalFlags, List<DetectionEvent> detectedEvents,
                                         int minimumWindowBins)
    {
        Histogram reference = referenceHistogram(sentPulseCount, signalFlags);

        if (detectedEvents == null || detectedEvents.isEmpty()) {
            throw new EmptyInputException(COMPONENT, "no detection events to bin");
        }
        if (minimumWindowBins < 0) {
            throw InvalidParameterException.of(COMPONENT, "minimumWindowBins", minimumWindowBins, "value >= 0");
        }

        long lastBin = -1;
        for (DetectionEvent event : detectedEvents) {
            if (event.timestampBin() < 0) {
                throw InvalidParameterException.of(COMPONENT, "timestampBin", event.timestampBin(), "value >= 0");
            }
            lastBin = Math.max(lastBin, event.timestampBin());
        }
        if (lastBin >= Integer.MAX_VALUE) {
            throw InvalidParameterException.of(COMPONENT, "timestampBin", lastBin, "value < " + Integer.MAX_VALUE);
        }

        int length = Math.max(Math.max(sentPulseCount, minimumWindowBins), (int) lastBin + 1);
        int[] counts = new int[length];
        for (DetectionEvent event : detectedEvents) {
            counts[(int) event.timestampBin()]++;
        }
        Histogram detected = Histogram.of(counts);

        LOG.debugf("Histograms built: reference %d bins (%d signal), detected %d bins (%d events)",
                reference.length(), reference.total(), detected.length(), detectedEvents.size());

        return new HistogramPair(reference, detected);
    }

    /**
     * Transmitted signal pattern alone, used as correlation template.
     */
    public Histogram referenceHistogram(int sentPulseCount, boolean[] signalFlags)
    {
        if (sentPulseCount <= 0) {
            throw InvalidParameterException.of(COMPONENT, "sentPulseCount", sentPulseCount, "positive integer");
        }
        Objects.requireNonNull(signalFlags, "signalFlags");
        if (signalFlags.length != sentPulseCount) {
            throw InvalidParameterException.of(COMPONENT, "signalFlags.length", signalFlags.length,
                    "equal to sentPulseCount " + sentPulseCount);
        }

        int[] pattern = new int[sentPulseCount];
        for (int i = 0; i < sentPulseCount; i++) {
            pattern[i] = signalFlags[i] ? 1 : 0;
        }
        return Histogram.of(pattern);
    }
}

package com.ammann.qkd.service;

import com.ammann.qkd.enumeration.DetectionOrigin;
import com.ammann.qkd.enumeration.LossModel;
import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.ChannelConfig;
import com.ammann.qkd.model.DetectionEvent;
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
 * Propagates the sender's pulses through a lossy channel with a clock offset and arrival jitter.
 *
 * <p>Survival is an independent Bernoulli trial per pulse (see {@link LossModel}). A surviving pulse
 * of slot {@code i} arrives at bin {@code i + trueOffset + round(N(0, jitterStd))}; arrivals before
 * bin 0 fall outside the detection window and are dropped. The returned events are neither sorted
 * nor merged with dark counts.
 */
@ApplicationScoped
public class ChannelEffectsService
{
    private static final Logger LOG = Logger.getLogger(ChannelEffectsService.class);

    static final String COMPONENT = "ChannelEffects";

    @ConfigProperty(name = "qkd.channel.loss-model", defaultValue = "INTENSITY_WEIGHTED")
    LossModel defaultLossModel = LossModel.INTENSITY_WEIGHTED;

    /**
     * Applies loss, offset and jitter with the configured default loss model.
     *
     * @param states          transmitted block
     * @param lossProbability loss probability, in [0, 1]
     * @param trueOffset      clock offset in bins
     * @param jitterStd       jitter standard deviation in bins, at least 0
     * @param rng             random stream of the run
     * @return detection events of the surviving pulses
     */
    public List<DetectionEvent> applyChannel(GeneratedStates states, double lossProbability, int trueOffset,
                                             double jitterStd, RandomGenerator rng)
    {
        return applyChannel(states, lossProbability, trueOffset, jitterStd, defaultLossModel, rng);
    }

    public List<DetectionEvent> applyChannel(GeneratedStates states, ChannelConfig channel, RandomGenerator rng)
    {
        return applyChannel(states, channel.lossProbability(), channel.syncOffsetTrue(), channel.syncJitterStd(),
                channel.lossModel(), rng);
    }

    public List<DetectionEvent> applyChannel(GeneratedStates states, double lossProbability, int trueOffset,
                                             double jitterStd, LossModel lossModel, RandomGenerator rng)
    {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(lossModel, "lossModel");
        Objects.requireNonNull(rng, "rng");
        if (!(lossProbability >= 0 && lossProbability <= 1)) {
            throw InvalidParameterException.of(COMPONENT, "lossProbability", lossProbability, "value in [0, 1]");
        }
        if (!(jitterStd >= 0) || Double.isInfinite(jitterStd)) {
            throw InvalidParameterException.of(COMPONENT, "jitterStd", jitterStd, "finite value >= 0");
        }

        double meanIntensity = states.meanIntensity();
        List<DetectionEvent> survivors = new ArrayList<>();
        int lost = 0;
        int beforeWindow = 0;

        for (PulseRecord pulse : states.pulses()) {
            double survival = survivalProbability(pulse.intensity(), meanIntensity, lossProbability, lossModel);
            if (rng.nextDouble() >= survival) {
                lost++;
                continue;
            }

            long arrival = (long) pulse.index() + trueOffset;
            if (jitterStd > 0) {
                arrival += Math.round(rng.nextGaussian() * jitterStd);
            }
            if (arrival < 0) {
                beforeWindow++;
                continue;
            }
            survivors.add(new DetectionEvent(arrival, DetectionOrigin.forPulse(pulse.signal())));
        }

        LOG.debugf("Channel (%s, loss=%.4f, offset=%d, jitter=%.3f): %d of %d pulses arrived, %d lost, %d before window",
                lossModel, lossProbability, trueOffset, jitterStd, survivors.size(), states.size(), lost, beforeWindow);

        return survivors;
    }

    /**
     * Probability that a pulse of the given intensity reaches the detector.
     *
     * <p>A lossless channel delivers every pulse and a fully lossy one none, whatever the model.
     * Under {@link LossModel#INTENSITY_WEIGHTED} a pulse carrying {@code w = mu / muMean} times the
     * block's mean photon number survives with {@code 1 - loss^w}; a block without light falls back
     * to the uniform model.
     */
    static double survivalProbability(double intensity, double meanIntensity, double lossProbability,
                                      LossModel lossModel)
    {
        if (lossProbability == 0.0) {
            return 1.0;
        }
        if (lossProbability == 1.0) {
            return 0.0;
        }
        if (lossModel == LossModel.UNIFORM || meanIntensity <= 0) {
            return 1.0 - lossProbability;
        }
        return 1.0 - Math.pow(lossProbability, intensity / meanIntensity);
    }
}

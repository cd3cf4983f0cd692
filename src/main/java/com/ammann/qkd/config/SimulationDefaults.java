/* (C)2026 */
package com.ammann.qkd.config;

import com.ammann.qkd.dto.AliceSettingsDTO;
import com.ammann.qkd.dto.BobSettingsDTO;
import com.ammann.qkd.dto.ChannelSettingsDTO;
import com.ammann.qkd.dto.ProcessingSettingsDTO;
import com.ammann.qkd.dto.SimulationRequestDTO;
import com.ammann.qkd.enumeration.LossModel;
import com.ammann.qkd.model.SimulationConfig;
import com.ammann.qkd.service.PhysicalUnits;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Configured default values for simulation parameters and their merge with client requests.
 *
 * <p>Every value a request leaves out is taken from {@code application.properties}
 * ({@code qkd.defaults.*}). Values are passed on unchecked; range checks belong to the pipeline.
 */
@ApplicationScoped
public class SimulationDefaults {

    @ConfigProperty(name = "qkd.defaults.signal-power", defaultValue = "0.5")
    double signalPower = 0.5;

    @ConfigProperty(name = "qkd.defaults.decoy-power", defaultValue = "0.1")
    double decoyPower = 0.1;

    @ConfigProperty(name = "qkd.defaults.signal-probability", defaultValue = "0.7")
    double signalProbability = 0.7;

    @ConfigProperty(name = "qkd.defaults.block-size", defaultValue = "1000")
    int blockSize = 1000;

    @ConfigProperty(name = "qkd.defaults.loss-probability", defaultValue = "0.9")
    double lossProbability = 0.9;

    @ConfigProperty(name = "qkd.defaults.dark-count-rate", defaultValue = "0.01")
    double darkCountRate = 0.01;

    /** Bin width in picoseconds. */
    @ConfigProperty(name = "qkd.defaults.time-bin-width", defaultValue = "100.0")
    double timeBinWidth = 100.0;

    @ConfigProperty(name = "qkd.defaults.true-offset", defaultValue = "5")
    int trueOffset = 5;

    @ConfigProperty(name = "qkd.defaults.jitter-std", defaultValue = "0.0")
    double jitterStd = 0.0;

    @ConfigProperty(name = "qkd.defaults.max-offset", defaultValue = "20")
    int maxOffset = 20;

    @ConfigProperty(name = "qkd.correlation.confidence-threshold", defaultValue = "3.0")
    double confidenceThreshold = 3.0;

    @ConfigProperty(name = "qkd.channel.loss-model", defaultValue = "INTENSITY_WEIGHTED")
    LossModel lossModel = LossModel.INTENSITY_WEIGHTED;

    /**
     * Merges a request with the defaults.
     *
     * @param request client request, may be null or partially filled
     * @return complete run configuration
     */
    public SimulationConfig resolve(SimulationRequestDTO request) {
        SimulationRequestDTO req = request != null ? request : SimulationRequestDTO.empty();
        AliceSettingsDTO alice = req.alice() != null ? req.alice() : new AliceSettingsDTO(null, null, null);
        BobSettingsDTO bob = req.bob() != null ? req.bob() : new BobSettingsDTO(null, null, null);
        ChannelSettingsDTO channel =
                req.channel() != null ? req.channel() : new ChannelSettingsDTO(null, null, null, null, null);
        ProcessingSettingsDTO processing =
                req.processing() != null ? req.processing() : new ProcessingSettingsDTO(null, null, null, null);

        double binWidth = valueOr(bob.timeBinWidthPs(), timeBinWidth);

        return new SimulationConfig(
                valueOr(alice.signalPower(), signalPower),
                valueOr(alice.decoyPower(), decoyPower),
                valueOr(alice.signalProbability(), signalProbability),
                valueOr(processing.blockSize(), blockSize),
                resolveLoss(channel),
                resolveDarkCountRate(bob, binWidth),
                binWidth,
                valueOr(channel.trueOffset(), trueOffset),
                valueOr(channel.jitterStd(), jitterStd),
                valueOr(processing.maxOffset(), maxOffset),
                valueOr(processing.confidenceThreshold(), confidenceThreshold),
                channel.lossModel() != null ? channel.lossModel() : lossModel,
                processing.seed());
    }

    /**
     * Returns the defaults in request form.
     */
    public SimulationRequestDTO asRequest() {
        return new SimulationRequestDTO(
                new AliceSettingsDTO(signalPower, decoyPower, signalProbability),
                new BobSettingsDTO(darkCountRate, null, timeBinWidth),
                new ChannelSettingsDTO(lossProbability, null, trueOffset, jitterStd, lossModel),
                new ProcessingSettingsDTO(blockSize, maxOffset, confidenceThreshold, null));
    }

    private double resolveLoss(ChannelSettingsDTO channel) {
        if (channel.lossProbability() != null) {
            return channel.lossProbability();
        }
        if (channel.lossDb() != null) {
            return PhysicalUnits.lossProbabilityFromDb(channel.lossDb());
        }
        return lossProbability;
    }

    private double resolveDarkCountRate(BobSettingsDTO bob, double binWidth) {
        if (bob.darkCountRate() != null) {
            return bob.darkCountRate();
        }
        if (bob.darkCountRateCps() != null) {
            return PhysicalUnits.darkCountsPerBin(bob.darkCountRateCps(), binWidth);
        }
        return darkCountRate;
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}

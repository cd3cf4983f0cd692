package com.ammann.qkd.model;

import com.ammann.qkd.enumeration.LossModel;

/**
 * Complete parameter set of one simulation run.
 *
 * <p>Values are taken as given; every pipeline component checks its own preconditions.
 *
 * @param signalPower         mean photon number of signal pulses
 * @param decoyPower          mean photon number of decoy pulses
 * @param signalProbability   probability of sending a signal pulse
 * @param blockSize           number of transmitted pulses
 * @param lossProbability     channel loss probability
 * @param darkCountRate       mean dark counts per bin
 * @param timeBinWidth        bin width in picoseconds
 * @param trueOffset          true receiver clock offset in bins
 * @param jitterStd           arrival jitter standard deviation in bins
 * @param maxOffset           largest offset magnitude searched by the correlation
 * @param confidenceThreshold noise-floor standard deviations the peak must exceed
 * @param lossModel           channel survival model
 * @param seed                seed of the run's random stream, null for a fresh one
 */
public record SimulationConfig(
        double signalPower,
        double decoyPower,
        double signalProbability,
        int blockSize,
        double lossProbability,
        double darkCountRate,
        double timeBinWidth,
        int trueOffset,
        double jitterStd,
        int maxOffset,
        double confidenceThreshold,
        LossModel lossModel,
        Long seed
) {
    public ChannelConfig channelConfig()
    {
        return new ChannelConfig(lossProbability, darkCountRate, timeBinWidth, trueOffset, jitterStd, lossModel);
    }

    /**
     * Receiver observation window: the sent block plus room for the largest searched offset.
     */
    public int detectionWindowBins()
    {
        return blockSize + Math.max(maxOffset, 0);
    }

    public SimulationConfig withSeed(long newSeed)
    {
        return new SimulationConfig(signalPower, decoyPower, signalProbability, blockSize, lossProbability,
                darkCountRate, timeBinWidth, trueOffset, jitterStd, maxOffset, confidenceThreshold, lossModel,
                newSeed);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Builder starting from a 1000-pulse block over a 90 % loss channel.
     */
    public static final class Builder
    {
        private double signalPower = 0.5;
        private double decoyPower = 0.1;
        private double signalProbability = 0.7;
        private int blockSize = 1000;
        private double lossProbability = 0.9;
        private double darkCountRate = 0.01;
        private double timeBinWidth = 100.0;
        private int trueOffset = 5;
        private double jitterStd = 0.0;
        private int maxOffset = 20;
        private double confidenceThreshold = 3.0;
        private LossModel lossModel = LossModel.INTENSITY_WEIGHTED;
        private Long seed;

        private Builder() {}

        public Builder signalPower(double value) { this.signalPower = value; return this; }
        public Builder decoyPower(double value) { this.decoyPower = value; return this; }
        public Builder signalProbability(double value) { this.signalProbability = value; return this; }
        public Builder blockSize(int value) { this.blockSize = value; return this; }
        public Builder lossProbability(double value) { this.lossProbability = value; return this; }
        public Builder darkCountRate(double value) { this.darkCountRate = value; return this; }
        public Builder timeBinWidth(double value) { this.timeBinWidth = value; return this; }
        public Builder trueOffset(int value) { this.trueOffset = value; return this; }
        public Builder jitterStd(double value) { this.jitterStd = value; return this; }
        public Builder maxOffset(int value) { this.maxOffset = value; return this; }
        public Builder confidenceThreshold(double value) { this.confidenceThreshold = value; return this; }
        public Builder lossModel(LossModel value) { this.lossModel = value; return this; }
        public Builder seed(Long value) { this.seed = value; return this; }

        public SimulationConfig build()
        {
            return new SimulationConfig(signalPower, decoyPower, signalProbability, blockSize, lossProbability,
                    darkCountRate, timeBinWidth, trueOffset, jitterStd, maxOffset, confidenceThreshold, lossModel,
                    seed);
        }
    }
}

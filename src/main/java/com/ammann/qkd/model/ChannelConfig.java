package com.ammann.qkd.model;

import com.ammann.qkd.enumeration.LossModel;

/**
 * Channel and detector parameters of one simulation run.
 *
 * <p>Immutable and owned by the run. Range checks happen in the components consuming the values,
 * so that a rejected value is reported by the stage it belongs to.
 *
 * @param lossProbability probability that a pulse is lost in the channel, in [0, 1]
 * @param darkCountRate   mean number of dark counts per time bin, at least 0
 * @param timeBinWidth    width of one time bin in picoseconds, positive
 * @param syncOffsetTrue  true clock offset between sender and receiver in bins
 * @param syncJitterStd   standard deviation of the arrival jitter in bins, at least 0
 * @param lossModel       per-pulse survival model
 */
public record ChannelConfig(
        double lossProbability,
        double darkCountRate,
        double timeBinWidth,
        int syncOffsetTrue,
        double syncJitterStd,
        LossModel lossModel
) {
    public ChannelConfig {
        if (lossModel == null) {
            lossModel = LossModel.INTENSITY_WEIGHTED;
        }
    }
}

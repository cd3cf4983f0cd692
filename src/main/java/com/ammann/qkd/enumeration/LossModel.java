package com.ammann.qkd.enumeration;

/**
 * Per-pulse survival model applied by the channel.
 */
public enum LossModel
{
    /** Every pulse survives with probability {@code 1 - loss}, independent of its intensity. */
    UNIFORM,

    /**
     * Poisson photon-number thinning: a pulse of mean photon number {@code mu} survives with
     * probability {@code 1 - loss^(mu / muMean)}, so brighter pulses are detected more often.
     */
    INTENSITY_WEIGHTED
}

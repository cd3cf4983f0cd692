package com.ammann.qkd.model;

/**
 * Aligned pair of histograms produced by the preprocessor.
 *
 * <p>Both share bin 0 as origin: bin {@code i} of the reference is the emission slot of pulse
 * {@code i}, bin {@code b} of the detected histogram is receiver time bin {@code b}.
 *
 * @param reference transmitted signal pattern, length = number of sent pulses
 * @param detected  receiver counts, length at least the reference length
 */
public record HistogramPair(Histogram reference, Histogram detected) {}

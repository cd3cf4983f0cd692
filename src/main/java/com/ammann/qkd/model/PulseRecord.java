package com.ammann.qkd.model;

/**
 * One transmitted pulse of the sender.
 *
 * @param index     slot index, equal to the nominal emission time bin
 * @param intensity mean photon number of the pulse (signal or decoy power)
 * @param signal    true when the pulse was drawn at signal intensity
 */
public record PulseRecord(int index, double intensity, boolean signal) {}

package com.ammann.qkd.enumeration;

/**
 * Physical origin of a detection event on the receiver side.
 *
 * <p>SIGNAL and DECOY events come from transmitted pulses that survived the channel.
 * DARK events are detector noise and carry no relation to any transmitted pulse.
 */
public enum DetectionOrigin
{
    SIGNAL,
    DECOY,
    DARK;

    /**
     * Returns the origin matching the intensity class of a transmitted pulse.
     *
     * @param signal true when the pulse was sent at signal intensity
     * @return SIGNAL or DECOY
     */
    public static DetectionOrigin forPulse(boolean signal) {
        return signal ? SIGNAL : DECOY;
    }

    public boolean isTransmitted() {
        return this != DARK;
    }
}

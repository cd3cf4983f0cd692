package com.ammann.qkd.model;

import com.ammann.qkd.enumeration.DetectionOrigin;

import java.util.Comparator;

/**
 * A single click recorded by the receiver.
 *
 * @param timestampBin detection time bin, never negative
 * @param origin       what caused the click
 */
public record DetectionEvent(long timestampBin, DetectionOrigin origin)
{
    /** Ascending time order. Same-bin events compare equal. */
    public static final Comparator<DetectionEvent> BY_TIME = Comparator.comparingLong(DetectionEvent::timestampBin);

    public static DetectionEvent dark(long timestampBin)
    {
        return new DetectionEvent(timestampBin, DetectionOrigin.DARK);
    }
}

package com.ammann.qkd.enumeration;

/**
 * Validity of a computed statistics summary.
 */
public enum StatisticsStatus
{
    /** At least one detection contributed to the rates and QBER. */
    VALID,
    /** No detections at all: rates and QBER are reported as zero. */
    DEGENERATE
}

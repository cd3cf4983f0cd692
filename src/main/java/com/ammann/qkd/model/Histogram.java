package com.ammann.qkd.model;

import java.util.Arrays;

/**
 * Fixed-length sequence of non-negative counts indexed by time bin.
 *
 * <p>Bin {@code b} covers the time interval {@code [b * binWidth, (b + 1) * binWidth)} relative to
 * the opening of the detection window. Instances are read-only; arrays are copied in and out.
 */
public final class Histogram
{
    private final int[] counts;

    private Histogram(int[] counts)
    {
        this.counts = counts;
    }

    public static Histogram of(int... counts)
    {
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] < 0) {
                throw new IllegalArgumentException("Negative count " + counts[i] + " in bin " + i);
            }
        }
        return new Histogram(counts.clone());
    }

    public static Histogram zeros(int length)
    {
        return new Histogram(new int[length]);
    }

    public int length()
    {
        return counts.length;
    }

    public int get(int bin)
    {
        return counts[bin];
    }

    public long total()
    {
        long total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }

    public int[] toArray()
    {
        return counts.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Histogram other)) return false;
        return Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString()
    {
        return "Histogram{length=" + counts.length + ", total=" + total() + "}";
    }
}

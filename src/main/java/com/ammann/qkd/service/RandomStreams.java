package com.ammann.qkd.service;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Factory for the per-run random streams of the simulator.
 *
 * <p>Every run owns one {@link Well19937c} generator. Runs executed side by side derive their seeds
 * from a common base seed with a SplitMix64 mixing step, so that no two workers share a stream and a
 * batch is reproducible from its base seed alone.
 */
public final class RandomStreams
{
    private RandomStreams() {}

    public static RandomGenerator forSeed(long seed)
    {
        return new Well19937c(seed);
    }

    /**
     * Returns a seed for runs that did not ask for a specific one.
     */
    public static long freshSeed()
    {
        return mix64(ThreadLocalRandom.current().nextLong() ^ System.nanoTime());
    }

    /**
     * Derives the seed of run {@code runIndex} of a batch.
     *
     * @param baseSeed seed of the batch
     * @param runIndex zero-based run number
     * @return independent, reproducible seed for that run
     */
    public static long deriveSeed(long baseSeed, int runIndex)
    {
        long h = mix64(baseSeed);
        return mix64(h ^ mix64(runIndex + 1L));
    }

    /**
     * SplitMix64 finalizer.
     */
    static long mix64(long z)
    {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}

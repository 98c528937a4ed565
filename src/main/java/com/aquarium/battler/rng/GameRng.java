package com.aquarium.battler.rng;

import java.security.SecureRandom;

/**
 * Seeded random number generator for reproducible battles and AI runs.
 * Mulberry32: 32 bits of state, cheap to create one per session.
 */
public class GameRng implements RandomSource {
    private long state;
    private final long seed;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.seed = seed;
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Generate next random number in [0, 1).
     */
    @Override
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}

package com.aquarium.battler.rng;

import java.util.List;

/**
 * Uniform random source used for speed tie-breaks, target selection and AI choices.
 * Swap in a seeded or scripted implementation to make combat and AI deterministic.
 */
public interface RandomSource {

    /**
     * Next uniform value in [0, 1).
     */
    double next();

    /**
     * Uniform integer in [0, bound).
     */
    default int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return Math.min(bound - 1, (int) Math.floor(next() * bound));
    }

    /**
     * True with the given probability.
     */
    default boolean chance(double probability) {
        return next() < probability;
    }

    /**
     * Uniformly pick one element of a non-empty list.
     */
    default <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }
}

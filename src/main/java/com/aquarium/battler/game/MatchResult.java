package com.aquarium.battler.game;

import com.aquarium.battler.battle.Side;

/**
 * Result of one simulated AI-vs-AI match.
 */
public record MatchResult(
    /**
     * Seed the match was played with.
     */
    long seed,

    /**
     * Rounds played.
     */
    int rounds,

    int playerWins,
    int opponentWins,
    int draws,

    /**
     * Battle turns summed over every round.
     */
    int totalTurns
) {
    /**
     * Side with more round wins, or null if level.
     */
    public Side winner() {
        if (playerWins > opponentWins) {
            return Side.PLAYER;
        }
        if (opponentWins > playerWins) {
            return Side.OPPONENT;
        }
        return null;
    }

    public double averageTurns() {
        return rounds == 0 ? 0.0 : (double) totalTurns / rounds;
    }
}

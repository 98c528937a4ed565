package com.aquarium.battler.game;

/**
 * Phases of a game round. SHOP allows tank edits, BATTLE allows turns,
 * RESULTS waits for the round to be closed.
 */
public enum GamePhase {
    SHOP,
    BATTLE,
    RESULTS
}

package com.aquarium.battler.battle;

/**
 * Battle lifecycle: INIT, then ACTIVE for every turn, then exactly one terminal status.
 */
public enum BattleStatus {
    INIT,
    ACTIVE,
    PLAYER_WIN,
    OPPONENT_WIN,
    DRAW;

    public boolean isTerminal() {
        return this == PLAYER_WIN || this == OPPONENT_WIN || this == DRAW;
    }
}

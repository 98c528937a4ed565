package com.aquarium.battler.battle;

/**
 * The two sides of a battle.
 */
public enum Side {
    PLAYER,
    OPPONENT;

    public Side enemy() {
        return this == PLAYER ? OPPONENT : PLAYER;
    }
}

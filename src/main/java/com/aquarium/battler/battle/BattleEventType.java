package com.aquarium.battler.battle;

/**
 * Kinds of battle events.
 */
public enum BattleEventType {
    TURN_START,
    POISON,
    ATTACK,
    DEATH,
    DOUBLE_LOSS
}

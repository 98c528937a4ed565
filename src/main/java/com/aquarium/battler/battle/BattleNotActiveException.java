package com.aquarium.battler.battle;

import com.aquarium.battler.GameRuleException;

/**
 * A turn was requested for a battle that was never started or has already ended.
 */
public class BattleNotActiveException extends GameRuleException {
    public BattleNotActiveException(BattleStatus status) {
        super("Battle is not active (status " + status + ")");
    }
}

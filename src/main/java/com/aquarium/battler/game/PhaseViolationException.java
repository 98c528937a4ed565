package com.aquarium.battler.game;

import com.aquarium.battler.GameRuleException;

/**
 * An action was attempted outside the phase that allows it.
 */
public class PhaseViolationException extends GameRuleException {
    private final GamePhase required;
    private final GamePhase actual;

    public PhaseViolationException(String action, GamePhase required, GamePhase actual) {
        super("Cannot " + action + " during " + actual + " phase (requires " + required + ")");
        this.required = required;
        this.actual = actual;
    }

    public GamePhase getRequired() {
        return required;
    }

    public GamePhase getActual() {
        return actual;
    }
}

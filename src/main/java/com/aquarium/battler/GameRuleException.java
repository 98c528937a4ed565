package com.aquarium.battler;

/**
 * Base for rule violations reported to the caller.
 * Thrown before any state is mutated, so the requested action simply did not happen.
 */
public class GameRuleException extends Exception {
    public GameRuleException(String message) {
        super(message);
    }
}

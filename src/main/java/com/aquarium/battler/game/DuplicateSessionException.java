package com.aquarium.battler.game;

import com.aquarium.battler.GameRuleException;

/**
 * A session is already stored under the requested id.
 */
public class DuplicateSessionException extends GameRuleException {
    public DuplicateSessionException(String sessionId) {
        super("Game session " + sessionId + " already exists");
    }
}

package com.aquarium.battler.game;

import com.aquarium.battler.GameRuleException;

/**
 * No session is stored under the requested id.
 */
public class SessionNotFoundException extends GameRuleException {
    public SessionNotFoundException(String sessionId) {
        super("No game session " + sessionId);
    }
}

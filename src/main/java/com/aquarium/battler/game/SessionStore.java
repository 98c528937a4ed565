package com.aquarium.battler.game;

import java.util.Collection;
import java.util.Optional;

/**
 * Where game sessions live between actions.
 * Implementations must keep sessions isolated from each other; callers guarantee a single
 * writer per session.
 */
public interface SessionStore {

    /**
     * Store a session only if its id is free.
     *
     * @return false if another session already holds the id
     */
    boolean insert(GameSession session);

    Optional<GameSession> find(String sessionId);

    boolean remove(String sessionId);

    Collection<GameSession> all();
}

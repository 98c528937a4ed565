package com.aquarium.battler.game;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store backed by a concurrent map. Safe to share between threads that each drive
 * their own sessions.
 */
public class InMemorySessionStore implements SessionStore {
    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    @Override
    public boolean insert(GameSession session) {
        return sessions.putIfAbsent(session.getId(), session) == null;
    }

    @Override
    public Optional<GameSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public Collection<GameSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}

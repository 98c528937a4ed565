package com.aquarium.battler.game;

import com.aquarium.battler.rng.GameRng;
import com.aquarium.battler.tank.Tank;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {

    private static GameSession session(String id) {
        return new GameSession(id, new Tank(id + "-p"), new Tank(id + "-o"), new GameRng(1));
    }

    @Test
    void testInsertFindRemove() {
        InMemorySessionStore store = new InMemorySessionStore();
        GameSession a = session("a");
        assertTrue(store.insert(a));
        assertTrue(store.insert(session("b")));

        assertSame(a, store.find("a").orElseThrow());
        assertTrue(store.find("c").isEmpty());
        assertEquals(2, store.all().size());

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        assertEquals(1, store.size());
    }

    @Test
    void testInsertRefusesTakenId() {
        InMemorySessionStore store = new InMemorySessionStore();
        GameSession original = session("a");
        store.insert(original);

        assertFalse(store.insert(session("a")));
        assertEquals(1, store.size());
        assertSame(original, store.find("a").orElseThrow());
    }

    @Test
    void testRemovedIdCanBeReused() {
        InMemorySessionStore store = new InMemorySessionStore();
        store.insert(session("a"));
        store.remove("a");

        assertTrue(store.insert(session("a")));
    }
}

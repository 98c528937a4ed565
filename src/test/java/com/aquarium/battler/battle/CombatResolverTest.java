package com.aquarium.battler.battle;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCatalog;
import com.aquarium.battler.piece.PieceFixtures;
import com.aquarium.battler.piece.Position;
import com.aquarium.battler.rng.GameRng;
import com.aquarium.battler.rng.ScriptedRandom;
import com.aquarium.battler.tank.BuffedStats;
import com.aquarium.battler.tank.InvalidPlacementException;
import com.aquarium.battler.tank.Tank;
import com.aquarium.battler.tank.TankGrid;
import com.aquarium.battler.tank.TankOperations;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombatResolver.
 */
class CombatResolverTest {

    private static Tank tank(String id, int baseWater, Piece... pieces) throws InvalidPlacementException {
        Tank tank = new Tank(id, baseWater);
        for (Piece piece : pieces) {
            TankOperations.placeNewPiece(tank, piece, TankGrid.findFirstValidPosition(tank, piece));
        }
        return tank;
    }

    private static long countEvents(BattleState state, BattleEventType type) {
        return state.getEvents().stream().filter(e -> e.type() == type).count();
    }

    // ==================== Damage ====================

    @Test
    void testComputeDamage() {
        assertEquals(4, CombatResolver.computeDamage(4, 1.0));
        assertEquals(2, CombatResolver.computeDamage(4, 0.7));
        assertEquals(7, CombatResolver.computeDamage(10, 0.7));
        assertEquals(3, CombatResolver.computeDamage(3, 1.3));
        assertEquals(13, CombatResolver.computeDamage(10, 1.3));
        assertEquals(0, CombatResolver.computeDamage(0, 1.3));
    }

    @Test
    void testComputeDamageLargeAttacks() {
        assertEquals(63, CombatResolver.computeDamage(90, 0.7));
        assertEquals(119, CombatResolver.computeDamage(170, 0.7));
        assertEquals(126, CombatResolver.computeDamage(180, 0.7));
        assertEquals(130, CombatResolver.computeDamage(100, 1.3));
        assertEquals(1300, CombatResolver.computeDamage(1000, 1.3));
        for (int attack = 0; attack <= 1000; attack++) {
            assertEquals(attack * 7 / 10, CombatResolver.computeDamage(attack, 0.7));
            assertEquals(attack * 13 / 10, CombatResolver.computeDamage(attack, 1.3));
            assertEquals(attack, CombatResolver.computeDamage(attack, 1.0));
        }
    }

    // ==================== Initialization ====================

    @Test
    void testInitializeSnapshotsBuffedStats() throws InvalidPlacementException {
        Tank player = new Tank("player");
        Piece fish = PieceFixtures.fish("Betta", 3, 5, 2);
        Piece fern = PieceFixtures.plant("Java Fern", 1, 1, 0);
        TankOperations.placeNewPiece(player, fish, new Position(0, 0));
        TankOperations.placeNewPiece(player, fern, new Position(1, 0));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Guppy", 1, 4, 3));

        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom(), 3);

        assertEquals(BattleStatus.ACTIVE, state.getStatus());
        assertEquals(1, state.getCurrentTurn());
        assertEquals(3, state.getCurrentRound());

        BattlePiece betta = state.getPlayerPieces().get(0);
        assertEquals(fish.getId(), betta.getId());
        assertEquals(4, betta.getAttack());
        assertEquals(6, betta.getMaxHealth());
        assertEquals(6, betta.getCurrentHealth());
        assertEquals(3, betta.getBaseAttack());

        assertEquals(6 + 3, state.getPlayerMaxHealth(), "Plants fight too");
        assertEquals(state.getPlayerMaxHealth(), state.getPlayerHealth());
        assertEquals(4, state.getOpponentHealth());
        assertEquals(5, state.getWaterQuality(Side.PLAYER));
        assertEquals(4, state.getWaterQuality(Side.OPPONENT));
    }

    @Test
    void testUnprocessedConsumablesLendBonusesButDoNotFight() throws InvalidPlacementException {
        Tank player = new Tank("player");
        TankOperations.placeNewPiece(player, PieceFixtures.fish("Betta", 3, 5, 2), new Position(0, 0));
        TankOperations.placeNewPiece(player, PieceFixtures.consumable("Fish Flakes", 1, 0, 0), new Position(1, 0));

        BattleState state = CombatResolver.initializeBattle(player, new Tank("opponent"), new ScriptedRandom());

        assertEquals(1, state.getPlayerPieces().size());
        assertEquals(4, state.getPlayerPieces().get(0).getAttack());
    }

    // ==================== Turns ====================

    @Test
    void testSingleTurnVictory() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.fish("Betta", 4, 4, 2));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Guppy", 1, 4, 3));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        List<BattleEvent> events = CombatResolver.advanceTurn(state);

        assertEquals(List.of(BattleEventType.TURN_START, BattleEventType.ATTACK, BattleEventType.ATTACK,
            BattleEventType.DEATH), events.stream().map(BattleEvent::type).toList());

        BattleEvent guppyAttack = events.get(1);
        assertEquals("Guppy", guppyAttack.sourceName(), "Faster fish attacks first");
        assertEquals("Betta", guppyAttack.targetName());
        assertEquals(1, guppyAttack.value());
        assertEquals(3, guppyAttack.playerHealth());

        BattleEvent bettaAttack = events.get(2);
        assertEquals(Side.PLAYER, bettaAttack.side());
        assertEquals(4, bettaAttack.value());
        assertEquals(new BattleEvent.Damage(4, 0, 0, 4, 1.0), bettaAttack.damage());
        assertEquals(0, bettaAttack.opponentHealth());

        assertEquals(BattleStatus.PLAYER_WIN, state.getStatus());
        assertEquals(Side.PLAYER, state.getWinner());
        assertEquals(1, state.getCurrentTurn());
        assertEquals(3, state.getPlayerHealth());
        assertEquals(0, state.getOpponentHealth());
        assertEquals(events, state.getEvents());
    }

    @Test
    void testHealthNeverNegative() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.fish("Oscar", 50, 10, 5));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Guppy", 0, 4, 1));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        List<BattleEvent> events = CombatResolver.advanceTurn(state);

        BattlePiece guppy = state.getOpponentPieces().get(0);
        assertEquals(0, guppy.getCurrentHealth());
        assertTrue(guppy.isDead());
        assertEquals(4, events.get(1).value(), "Value is the damage actually dealt");
        assertEquals(50, events.get(1).damage().total());
    }

    @Test
    void testDirtyWaterPoisonsAndWeakens() throws Exception {
        Tank player = tank("player", 1, PieceFixtures.fish("Betta", 4, 20, 2));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Pleco", 0, 20, 1));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        List<BattleEvent> events = CombatResolver.advanceTurn(state);

        assertEquals(BattleEventType.POISON, events.get(1).type());
        assertEquals("poison", events.get(1).sourceName());
        assertEquals(19, state.getPlayerPieces().get(0).getCurrentHealth());

        BattleEvent attack = events.stream().filter(e -> e.side() == Side.PLAYER && e.type() == BattleEventType.ATTACK)
            .findFirst().orElseThrow();
        assertEquals(2, attack.value());
        assertEquals(new BattleEvent.Damage(4, 0, -2, 2, 0.7), attack.damage());
        assertEquals(18, state.getOpponentHealth());
        assertEquals(2, state.getCurrentTurn(), "Turn counter advances while the battle continues");
    }

    @Test
    void testCleanWaterStrengthens() throws Exception {
        Tank player = tank("player", 10, PieceFixtures.fish("Betta", 4, 20, 2));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Pleco", 0, 20, 1));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        CombatResolver.advanceTurn(state);

        assertEquals(9, state.getWaterQuality(Side.PLAYER));
        assertEquals(15, state.getOpponentHealth());
        assertEquals(0, countEvents(state, BattleEventType.POISON));
    }

    @Test
    void testPoisonCanDecideBattle() throws Exception {
        Tank player = tank("player", 1, PieceFixtures.fish("Guppy", 0, 2, 1));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Pleco", 0, 5, 1));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        assertEquals(BattleStatus.OPPONENT_WIN, CombatResolver.resolve(state));
        assertEquals(2, state.getCurrentTurn());
        assertEquals(2, countEvents(state, BattleEventType.POISON));
        assertEquals(1, countEvents(state, BattleEventType.DEATH));
        assertEquals(Side.OPPONENT, state.getWinner());
    }

    @Test
    void testStalemateEndsInDrawAtTurnCap() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.fish("Guppy", 0, 4, 1));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Guppy", 0, 4, 1));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        assertEquals(BattleStatus.DRAW, CombatResolver.resolve(state));
        assertEquals(CombatResolver.MAX_TURNS, state.getCurrentTurn());
        assertEquals(CombatResolver.MAX_TURNS, countEvents(state, BattleEventType.TURN_START));
        assertEquals(4, state.getPlayerHealth());
        assertNull(state.getWinner());
        assertTrue(state.isDraw());
    }

    @Test
    void testDoubleLossWithoutFish() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.plant("Java Fern", 1, 1, 0));
        Tank opponent = tank("opponent", 5, PieceFixtures.equipment("Heater"));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        List<BattleEvent> events = CombatResolver.advanceTurn(state);

        assertEquals(BattleStatus.DRAW, state.getStatus());
        assertEquals(0, state.getPlayerHealth());
        assertEquals(0, state.getOpponentHealth());
        assertEquals(BattleEventType.DOUBLE_LOSS, events.get(events.size() - 1).type());
        assertEquals(1, state.getCurrentTurn());
    }

    @Test
    void testDoubleLossAfterPoisonKillsEveryFish() throws Exception {
        Tank player = tank("player", 1, PieceFixtures.fish("Guppy", 3, 1, 1));
        Tank opponent = tank("opponent", 1, PieceFixtures.fish("Guppy", 3, 1, 1));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        CombatResolver.advanceTurn(state);

        assertEquals(BattleStatus.DRAW, state.getStatus());
        assertEquals(2, countEvents(state, BattleEventType.DEATH));
        assertEquals(1, countEvents(state, BattleEventType.DOUBLE_LOSS));
        assertEquals(0, countEvents(state, BattleEventType.ATTACK));
    }

    @Test
    void testEmptySideLoses() throws Exception {
        Tank player = new Tank("player");
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Guppy", 1, 4, 3));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        assertEquals(BattleStatus.OPPONENT_WIN, CombatResolver.resolve(state));
        assertEquals(1, state.getCurrentTurn());
    }

    @Test
    void testNonFishAreTargets() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.fish("Betta", 5, 4, 2));
        Tank opponent = tank("opponent", 5, PieceFixtures.plant("Java Fern", 1, 1, 0));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        List<BattleEvent> events = CombatResolver.advanceTurn(state);

        assertEquals("Java Fern", events.get(1).targetName());
        assertEquals(BattleStatus.PLAYER_WIN, state.getStatus());
    }

    @Test
    void testDeadAttackersSkipTheirTurn() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.fish("Fast", 10, 5, 9));
        // Base 6 keeps the two-fish tank at quality 4, clear of poison
        Tank opponent = tank("opponent", 6, PieceFixtures.fish("Slow", 10, 5, 1),
            PieceFixtures.fish("Wall", 0, 50, 1));
        // Three tie-break keys, then Fast picks index 0 of [Slow, Wall]
        BattleState state = CombatResolver.initializeBattle(player, opponent,
            new ScriptedRandom(0.0, 0.5, 0.5, 0.0));

        List<BattleEvent> events = CombatResolver.advanceTurn(state);

        assertTrue(events.stream().noneMatch(e -> "Slow".equals(e.sourceName())));
        assertEquals(0, countEvents(state, BattleEventType.POISON));
        assertEquals(5, state.getPlayerHealth());
        assertEquals(50, state.getOpponentHealth());
    }

    @Test
    void testSpeedTiesUseRandomKeys() {
        BattlePiece first = new BattlePiece(PieceFixtures.fish("A", 1, 1, 3), Side.PLAYER, new BuffedStats(1, 1, 3));
        BattlePiece second = new BattlePiece(PieceFixtures.fish("B", 1, 1, 3), Side.OPPONENT, new BuffedStats(1, 1, 3));
        BattlePiece fastest = new BattlePiece(PieceFixtures.fish("C", 1, 1, 5), Side.OPPONENT, new BuffedStats(1, 1, 5));

        List<BattlePiece> ordered = CombatResolver.orderBySpeed(List.of(first, second, fastest),
            new ScriptedRandom(0.9, 0.1, 0.5));

        assertEquals(List.of(fastest, second, first), ordered);
    }

    @Test
    void testAdvanceFinishedBattleThrows() throws Exception {
        Tank player = tank("player", 5, PieceFixtures.fish("Betta", 4, 4, 2));
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Guppy", 1, 1, 3));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());
        CombatResolver.resolve(state);

        BattleNotActiveException e = assertThrows(BattleNotActiveException.class,
            () -> CombatResolver.advanceTurn(state));
        assertTrue(e.getMessage().contains(state.getStatus().name()));
    }

    @Test
    void testAdvanceUninitializedBattleThrows() {
        BattleState state = new BattleState(1, List.of(), List.of(), 5, 5, new ScriptedRandom());
        assertEquals(BattleStatus.INIT, state.getStatus());
        assertThrows(BattleNotActiveException.class, () -> CombatResolver.advanceTurn(state));
    }

    @Test
    void testBattleLeavesTankPiecesUntouched() throws Exception {
        Piece fish = PieceFixtures.fish("Betta", 4, 4, 2);
        Tank player = tank("player", 5, fish);
        Tank opponent = tank("opponent", 5, PieceFixtures.fish("Oscar", 7, 12, 3));
        BattleState state = CombatResolver.initializeBattle(player, opponent, new ScriptedRandom());

        CombatResolver.resolve(state);

        assertTrue(state.getPlayerPieces().get(0).isDead());
        assertEquals(4, fish.getStats().getHealth());
        assertTrue(fish.isPlaced());
        assertEquals(1, player.size());
    }

    @Test
    void testRandomBattlesAlwaysTerminate() throws Exception {
        PieceCatalog catalog = PieceCatalog.loadDefault();
        for (long seed = 1; seed <= 200; seed++) {
            GameRng rng = new GameRng(seed);
            Tank player = randomTank("p" + seed, catalog, rng);
            Tank opponent = randomTank("o" + seed, catalog, rng);
            BattleState state = CombatResolver.initializeBattle(player, opponent, rng);

            BattleStatus status = CombatResolver.resolve(state);

            assertTrue(status.isTerminal());
            assertTrue(state.getCurrentTurn() <= CombatResolver.MAX_TURNS);
            if (status == BattleStatus.PLAYER_WIN) {
                assertTrue(state.getOpponentHealth() <= 0 && state.getPlayerHealth() > 0);
            } else if (status == BattleStatus.OPPONENT_WIN) {
                assertTrue(state.getPlayerHealth() <= 0);
            }
            for (BattlePiece piece : state.getPlayerPieces()) {
                assertTrue(piece.getCurrentHealth() >= 0);
            }
            for (BattlePiece piece : state.getOpponentPieces()) {
                assertTrue(piece.getCurrentHealth() >= 0);
            }
        }
    }

    private static Tank randomTank(String id, PieceCatalog catalog, GameRng rng) throws Exception {
        Tank tank = new Tank(id, 1 + rng.nextInt(10));
        int count = rng.nextInt(8);
        for (int i = 0; i < count; i++) {
            Piece piece = PieceCatalog.instantiate(rng.pick(catalog.getAll()));
            Position position = TankGrid.findFirstValidPosition(tank, piece);
            if (position != null) {
                TankOperations.placeNewPiece(tank, piece, position);
            }
        }
        return tank;
    }
}

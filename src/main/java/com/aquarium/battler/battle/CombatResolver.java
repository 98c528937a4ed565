package com.aquarium.battler.battle;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCategory;
import com.aquarium.battler.rng.GameRng;
import com.aquarium.battler.rng.RandomSource;
import com.aquarium.battler.tank.AdjacencyEngine;
import com.aquarium.battler.tank.Tank;
import com.aquarium.battler.tank.WaterQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turn-by-turn battle resolution between two tanks.
 *
 * <p>Each call to {@link #advanceTurn} runs one complete turn and returns synchronously.
 * Pacing between turns belongs to whoever drives the battle.
 */
public final class CombatResolver {
    private static final Logger log = LoggerFactory.getLogger(CombatResolver.class);

    public static final int MAX_TURNS = 20;

    private CombatResolver() {
        // Utility class - prevent instantiation
    }

    // ==================== Initialization ====================

    public static BattleState initializeBattle(Tank playerTank, Tank opponentTank) {
        return initializeBattle(playerTank, opponentTank, new GameRng(), 1);
    }

    public static BattleState initializeBattle(Tank playerTank, Tank opponentTank, RandomSource rng) {
        return initializeBattle(playerTank, opponentTank, rng, 1);
    }

    /**
     * Snapshot both tanks into a fresh, active battle.
     *
     * @param playerTank   the player's tank
     * @param opponentTank the opponent's tank
     * @param rng          source for speed tie-breaks and targeting
     * @param round        game round, stamped on every event
     * @return the battle, ready for its first turn
     */
    public static BattleState initializeBattle(Tank playerTank, Tank opponentTank, RandomSource rng, int round) {
        BattleState state = new BattleState(
            round,
            snapshot(playerTank, Side.PLAYER),
            snapshot(opponentTank, Side.OPPONENT),
            WaterQuality.compute(playerTank),
            WaterQuality.compute(opponentTank),
            rng
        );
        state.setStatus(BattleStatus.ACTIVE);
        log.debug("Battle initialized: round {}, player {} pieces ({} hp), opponent {} pieces ({} hp)",
            round, state.getPlayerPieces().size(), state.getPlayerMaxHealth(),
            state.getOpponentPieces().size(), state.getOpponentMaxHealth());
        return state;
    }

    /**
     * Battle pieces for every placed fish, plant and equipment of a tank, with buffed stats.
     * Consumables still on the grid lend their bonuses but do not fight.
     */
    static List<BattlePiece> snapshot(Tank tank, Side side) {
        List<Piece> placed = tank.getPlacedPieces();
        List<BattlePiece> result = new ArrayList<>(placed.size());
        for (Piece piece : placed) {
            if (piece.getCategory() == PieceCategory.CONSUMABLE) {
                continue;
            }
            result.add(new BattlePiece(piece, side, AdjacencyEngine.computeBuffedStats(piece, placed)));
        }
        return result;
    }

    // ==================== Turn ====================

    /**
     * Run one turn and return the events it produced.
     *
     * @throws BattleNotActiveException if the battle has not started or is already over
     */
    public static List<BattleEvent> advanceTurn(BattleState state) throws BattleNotActiveException {
        if (!state.isActive()) {
            throw new BattleNotActiveException(state.getStatus());
        }
        List<BattleEvent> turnEvents = new ArrayList<>();

        emit(state, turnEvents, BattleEventType.TURN_START, null, null, null, 0,
            "Turn " + state.getCurrentTurn() + " begins", null);

        applyPoison(state, Side.PLAYER, turnEvents);
        applyPoison(state, Side.OPPONENT, turnEvents);

        List<BattlePiece> attackers = new ArrayList<>();
        for (BattlePiece piece : state.getPlayerPieces()) {
            if (piece.isAlive() && piece.isFish()) {
                attackers.add(piece);
            }
        }
        for (BattlePiece piece : state.getOpponentPieces()) {
            if (piece.isAlive() && piece.isFish()) {
                attackers.add(piece);
            }
        }

        if (attackers.isEmpty()) {
            state.setHealth(Side.PLAYER, 0);
            state.setHealth(Side.OPPONENT, 0);
            state.setStatus(BattleStatus.DRAW);
            emit(state, turnEvents, BattleEventType.DOUBLE_LOSS, null, null, null, 0,
                "No fish left to fight on either side: double loss", null);
            log.debug("Battle ended in a double loss on turn {}", state.getCurrentTurn());
            return turnEvents;
        }

        for (BattlePiece attacker : orderBySpeed(attackers, state.getRng())) {
            if (attacker.isDead()) {
                continue;
            }
            List<BattlePiece> enemies = state.getAlivePieces(attacker.getSide().enemy());
            if (enemies.isEmpty()) {
                break;
            }
            BattlePiece target = state.getRng().pick(enemies);
            attack(state, attacker, target, turnEvents);
        }

        state.recomputeHealth();
        checkTermination(state);
        return turnEvents;
    }

    /**
     * Advance until the battle reaches a terminal status.
     *
     * @return the terminal status
     */
    public static BattleStatus resolve(BattleState state) throws BattleNotActiveException {
        do {
            advanceTurn(state);
        } while (state.isActive());
        return state.getStatus();
    }

    // ==================== Turn steps ====================

    private static void applyPoison(BattleState state, Side side, List<BattleEvent> turnEvents) {
        if (!WaterQuality.isPoisonous(state.getWaterQuality(side))) {
            return;
        }
        for (BattlePiece piece : state.getAlivePieces(side)) {
            if (!piece.isFish()) {
                continue;
            }
            boolean killed = piece.takeDamage(WaterQuality.POISON_DAMAGE);
            state.recomputeHealth();
            emit(state, turnEvents, BattleEventType.POISON, side, null, piece, WaterQuality.POISON_DAMAGE,
                piece.getName() + " takes " + WaterQuality.POISON_DAMAGE + " poison damage from dirty water", null);
            if (killed) {
                emitDeath(state, turnEvents, piece, "poison");
            }
        }
    }

    /**
     * Attack order: speed descending, exact ties broken by a random key drawn per attacker.
     */
    static List<BattlePiece> orderBySpeed(List<BattlePiece> attackers, RandomSource rng) {
        List<RankedAttacker> ranked = new ArrayList<>(attackers.size());
        for (BattlePiece attacker : attackers) {
            ranked.add(new RankedAttacker(attacker, rng.next()));
        }
        ranked.sort(Comparator.comparingInt((RankedAttacker r) -> r.piece().getSpeed()).reversed()
            .thenComparingDouble(RankedAttacker::tieBreak));
        List<BattlePiece> ordered = new ArrayList<>(ranked.size());
        for (RankedAttacker r : ranked) {
            ordered.add(r.piece());
        }
        return ordered;
    }

    private record RankedAttacker(BattlePiece piece, double tieBreak) {
    }

    private static void attack(BattleState state, BattlePiece attacker, BattlePiece target,
                               List<BattleEvent> turnEvents) {
        double multiplier = WaterQuality.damageMultiplier(state.getWaterQuality(attacker.getSide()));
        int damage = computeDamage(attacker.getAttack(), multiplier);
        int before = target.getCurrentHealth();
        boolean killed = target.takeDamage(damage);
        int dealt = before - target.getCurrentHealth();
        state.recomputeHealth();

        BattleEvent.Damage breakdown = new BattleEvent.Damage(
            attacker.getBaseAttack(),
            attacker.getAttack() - attacker.getBaseAttack(),
            damage - attacker.getAttack(),
            damage,
            multiplier
        );
        emit(state, turnEvents, BattleEventType.ATTACK, attacker.getSide(), attacker, target, dealt,
            attacker.getName() + " attacks " + target.getName() + " for " + damage + " damage", breakdown);
        if (killed) {
            emitDeath(state, turnEvents, target, attacker.getName());
        }
    }

    /**
     * Outgoing damage for an attack value under a side's water multiplier.
     * Water multipliers are whole tenths, so the floor is taken in integer tenths
     * where {@code 90 * 0.7} cannot come out as 62.999.
     */
    public static int computeDamage(int attack, double multiplier) {
        long tenths = Math.round(multiplier * 10);
        return (int) Math.max(0, attack * tenths / 10);
    }

    private static void checkTermination(BattleState state) {
        // Player is checked first: simultaneous wipe-out goes to the opponent
        if (state.getPlayerHealth() <= 0) {
            finish(state, BattleStatus.OPPONENT_WIN);
        } else if (state.getOpponentHealth() <= 0) {
            finish(state, BattleStatus.PLAYER_WIN);
        } else if (state.getCurrentTurn() >= MAX_TURNS) {
            finish(state, BattleStatus.DRAW);
        } else {
            state.incrementTurn();
        }
    }

    private static void finish(BattleState state, BattleStatus status) {
        state.setStatus(status);
        log.debug("Battle finished on turn {}: {} (player {} hp, opponent {} hp)",
            state.getCurrentTurn(), status, state.getPlayerHealth(), state.getOpponentHealth());
    }

    // ==================== Events ====================

    private static void emitDeath(BattleState state, List<BattleEvent> turnEvents, BattlePiece victim, String cause) {
        emit(state, turnEvents, BattleEventType.DEATH, victim.getSide(), null, victim, 0,
            victim.getName() + " was defeated by " + cause, null);
    }

    private static void emit(BattleState state, List<BattleEvent> turnEvents, BattleEventType type, Side side,
                             BattlePiece source, BattlePiece target, int value, String description,
                             BattleEvent.Damage damage) {
        String sourceName;
        if (source != null) {
            sourceName = source.getName();
        } else if (type == BattleEventType.POISON) {
            sourceName = "poison";
        } else {
            sourceName = "system";
        }
        BattleEvent event = new BattleEvent(
            state.nextEventId(),
            type,
            side,
            source != null ? source.getId() : null,
            sourceName,
            target != null ? target.getId() : null,
            target != null ? target.getName() : null,
            value,
            state.getCurrentRound(),
            state.getCurrentTurn(),
            description,
            state.getPlayerHealth(),
            state.getOpponentHealth(),
            damage
        );
        state.addEvent(event);
        turnEvents.add(event);
    }
}

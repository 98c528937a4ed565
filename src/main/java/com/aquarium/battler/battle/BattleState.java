package com.aquarium.battler.battle;

import com.aquarium.battler.rng.RandomSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Complete state of one battle.
 *
 * <p>Built fresh from the two tanks by {@link CombatResolver#initializeBattle} and advanced one
 * turn at a time. It is never reused across rounds.
 */
public class BattleState {
    // Lifecycle
    private BattleStatus status;
    private final int currentRound;
    private int currentTurn;

    // Health totals
    private int playerHealth;
    private int opponentHealth;
    private final int playerMaxHealth;
    private final int opponentMaxHealth;

    // Sides
    private final List<BattlePiece> playerPieces;
    private final List<BattlePiece> opponentPieces;
    private final int playerWaterQuality;
    private final int opponentWaterQuality;

    // Log
    private final List<BattleEvent> events;
    private int eventSequence;

    // RNG
    private final RandomSource rng;

    BattleState(int currentRound, List<BattlePiece> playerPieces, List<BattlePiece> opponentPieces,
                int playerWaterQuality, int opponentWaterQuality, RandomSource rng) {
        this.status = BattleStatus.INIT;
        this.currentRound = currentRound;
        this.currentTurn = 1;
        this.playerPieces = new ArrayList<>(playerPieces);
        this.opponentPieces = new ArrayList<>(opponentPieces);
        this.playerWaterQuality = playerWaterQuality;
        this.opponentWaterQuality = opponentWaterQuality;
        this.playerMaxHealth = sumMaxHealth(playerPieces);
        this.opponentMaxHealth = sumMaxHealth(opponentPieces);
        this.playerHealth = playerMaxHealth;
        this.opponentHealth = opponentMaxHealth;
        this.events = new ArrayList<>();
        this.eventSequence = 0;
        this.rng = rng;
    }

    private static int sumMaxHealth(List<BattlePiece> pieces) {
        int total = 0;
        for (BattlePiece piece : pieces) {
            total += piece.getMaxHealth();
        }
        return total;
    }

    // ---- Lifecycle ----
    public BattleStatus getStatus() {
        return status;
    }

    void setStatus(BattleStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == BattleStatus.ACTIVE;
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    public int getCurrentRound() {
        return currentRound;
    }

    public int getCurrentTurn() {
        return currentTurn;
    }

    void incrementTurn() {
        currentTurn++;
    }

    // ---- Health ----
    public int getPlayerHealth() {
        return playerHealth;
    }

    public int getOpponentHealth() {
        return opponentHealth;
    }

    public int getPlayerMaxHealth() {
        return playerMaxHealth;
    }

    public int getOpponentMaxHealth() {
        return opponentMaxHealth;
    }

    public int getHealth(Side side) {
        return side == Side.PLAYER ? playerHealth : opponentHealth;
    }

    void setHealth(Side side, int health) {
        if (side == Side.PLAYER) {
            playerHealth = health;
        } else {
            opponentHealth = health;
        }
    }

    /**
     * Recompute both totals from the surviving pieces.
     */
    void recomputeHealth() {
        playerHealth = aliveHealth(playerPieces);
        opponentHealth = aliveHealth(opponentPieces);
    }

    private static int aliveHealth(List<BattlePiece> pieces) {
        int total = 0;
        for (BattlePiece piece : pieces) {
            if (piece.isAlive()) {
                total += piece.getCurrentHealth();
            }
        }
        return total;
    }

    // ---- Pieces ----
    public List<BattlePiece> getPlayerPieces() {
        return Collections.unmodifiableList(playerPieces);
    }

    public List<BattlePiece> getOpponentPieces() {
        return Collections.unmodifiableList(opponentPieces);
    }

    public List<BattlePiece> getPieces(Side side) {
        return side == Side.PLAYER ? getPlayerPieces() : getOpponentPieces();
    }

    /**
     * Pieces of a side that are still alive, in snapshot order.
     */
    public List<BattlePiece> getAlivePieces(Side side) {
        List<BattlePiece> alive = new ArrayList<>();
        for (BattlePiece piece : getPieces(side)) {
            if (piece.isAlive()) {
                alive.add(piece);
            }
        }
        return alive;
    }

    public int getWaterQuality(Side side) {
        return side == Side.PLAYER ? playerWaterQuality : opponentWaterQuality;
    }

    // ---- Events ----
    public List<BattleEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    String nextEventId() {
        eventSequence++;
        return "evt-" + currentRound + "-" + eventSequence;
    }

    void addEvent(BattleEvent event) {
        events.add(event);
    }

    // ---- Outcome ----
    /**
     * The winning side, or null for a draw or an unfinished battle.
     */
    public Side getWinner() {
        switch (status) {
            case PLAYER_WIN:
                return Side.PLAYER;
            case OPPONENT_WIN:
                return Side.OPPONENT;
            default:
                return null;
        }
    }

    public boolean isDraw() {
        return status == BattleStatus.DRAW;
    }

    public RandomSource getRng() {
        return rng;
    }
}

package com.aquarium.battler.game;

import com.aquarium.battler.battle.BattleState;
import com.aquarium.battler.battle.Side;
import com.aquarium.battler.rng.RandomSource;
import com.aquarium.battler.tank.Tank;

/**
 * One player's game against the computer opponent: both tanks, the round counter,
 * win/loss records and the battle in progress.
 *
 * <p>Gold for the player is tracked by the caller. The opponent's gold lives here because the
 * opponent shops inside {@link GameSessionService#startBattle}.
 */
public class GameSession {
    private final String id;
    private final Tank playerTank;
    private final Tank opponentTank;
    private final RandomSource rng;

    private GamePhase phase;
    private int round;
    private BattleState battle;

    // Player record
    private int wins;
    private int losses;
    private int draws;
    private int winStreak;
    private int lossStreak;

    // Opponent record
    private int opponentGold;
    private int opponentWinStreak;
    private int opponentLossStreak;

    public GameSession(String id, Tank playerTank, Tank opponentTank, RandomSource rng) {
        this.id = id;
        this.playerTank = playerTank;
        this.opponentTank = opponentTank;
        this.rng = rng;
        this.phase = GamePhase.SHOP;
        this.round = 1;
    }

    /**
     * Update both records after a battle. A draw breaks nobody's streak.
     */
    void recordOutcome(Side winner) {
        if (winner == Side.PLAYER) {
            wins++;
            winStreak++;
            lossStreak = 0;
            opponentLossStreak++;
            opponentWinStreak = 0;
        } else if (winner == Side.OPPONENT) {
            losses++;
            lossStreak++;
            winStreak = 0;
            opponentWinStreak++;
            opponentLossStreak = 0;
        } else {
            draws++;
        }
    }

    public String getId() {
        return id;
    }

    public Tank getPlayerTank() {
        return playerTank;
    }

    public Tank getOpponentTank() {
        return opponentTank;
    }

    public RandomSource getRng() {
        return rng;
    }

    public GamePhase getPhase() {
        return phase;
    }

    void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public int getRound() {
        return round;
    }

    void advanceRound() {
        round++;
    }

    /**
     * The current battle, or null outside BATTLE and RESULTS.
     */
    public BattleState getBattle() {
        return battle;
    }

    void setBattle(BattleState battle) {
        this.battle = battle;
    }

    public int getWins() {
        return wins;
    }

    public int getLosses() {
        return losses;
    }

    public int getDraws() {
        return draws;
    }

    public int getWinStreak() {
        return winStreak;
    }

    public int getLossStreak() {
        return lossStreak;
    }

    public int getOpponentGold() {
        return opponentGold;
    }

    void setOpponentGold(int opponentGold) {
        this.opponentGold = opponentGold;
    }

    public int getOpponentWinStreak() {
        return opponentWinStreak;
    }

    public int getOpponentLossStreak() {
        return opponentLossStreak;
    }
}

package com.aquarium.battler.game;

import com.aquarium.battler.GameRuleException;
import com.aquarium.battler.ai.AcquisitionResult;
import com.aquarium.battler.battle.BattleEvent;
import com.aquarium.battler.battle.BattleState;
import com.aquarium.battler.battle.Side;
import com.aquarium.battler.piece.PieceCatalog;
import com.aquarium.battler.rng.GameRng;

import java.util.List;

/**
 * Plays whole matches where the opponent AI builds both tanks.
 */
public final class MatchSimulator {

    public static final int DEFAULT_ROUNDS = 10;
    public static final int DEFAULT_STARTING_GOLD = 10;
    public static final int DEFAULT_ROUND_INCOME = 5;

    private MatchSimulator() {
        // Utility class - prevent instantiation
    }

    /**
     * Settings for a batch of matches.
     */
    public record Settings(int rounds, int startingGold, int roundIncome, int baseWaterQuality) {

        public static Settings defaults() {
            return new Settings(DEFAULT_ROUNDS, DEFAULT_STARTING_GOLD, DEFAULT_ROUND_INCOME, 5);
        }
    }

    /**
     * Run a complete match.
     *
     * @param catalog  piece catalog both sides shop from
     * @param seed     seed for the match's random source
     * @param settings rounds, gold and water settings
     * @param verbose  print every round and battle event to stdout
     * @return the match result
     */
    public static MatchResult runMatch(PieceCatalog catalog, long seed, Settings settings, boolean verbose) {
        // Each match gets its own store, so parallel matches share nothing
        GameSessionService service = new GameSessionService(new InMemorySessionStore(), catalog,
            settings.baseWaterQuality());
        String sessionId = "match-" + seed;

        int playerGold = settings.startingGold();
        int playerWins = 0;
        int opponentWins = 0;
        int draws = 0;
        int totalTurns = 0;

        if (verbose) {
            System.out.println("=== Match Start (seed: " + seed + ") ===");
        }

        try {
            service.createSession(sessionId, new GameRng(seed));
            service.grantOpponentGold(sessionId, settings.startingGold());
            for (int round = 1; round <= settings.rounds(); round++) {
                if (round > 1) {
                    playerGold += settings.roundIncome();
                    service.grantOpponentGold(sessionId, settings.roundIncome());
                }

                AcquisitionResult playerShopping = service.autoBuildPlayerTank(sessionId, playerGold);
                playerGold = playerShopping.remainingGold();
                service.confirmPlacement(sessionId);

                BattleState battle = service.startBattle(sessionId);
                if (verbose) {
                    GameSession session = service.getSession(sessionId);
                    System.out.println("\n--- Round " + round + " ---");
                    System.out.println("Player bought: " + playerShopping.bought()
                        + " (water " + session.getPlayerTank().getWaterQuality() + ")");
                    System.out.println("Opponent tank: " + session.getOpponentTank().size() + " pieces"
                        + " (water " + session.getOpponentTank().getWaterQuality() + ")");
                }

                while (battle.isActive()) {
                    List<BattleEvent> events = service.advanceBattle(sessionId);
                    if (verbose) {
                        printEvents(events);
                    }
                }
                totalTurns += battle.getCurrentTurn();

                Side winner = service.finishBattle(sessionId);
                if (winner == Side.PLAYER) {
                    playerWins++;
                } else if (winner == Side.OPPONENT) {
                    opponentWins++;
                } else {
                    draws++;
                }
                if (verbose) {
                    System.out.println("Result: " + (winner == null ? "draw" : winner.name().toLowerCase() + " wins"));
                }
            }
        } catch (GameRuleException e) {
            // The simulator only issues actions its own phase tracking allows
            throw new IllegalStateException("Simulation broke a game rule: " + e.getMessage(), e);
        } finally {
            service.endSession(sessionId);
        }

        return new MatchResult(seed, settings.rounds(), playerWins, opponentWins, draws, totalTurns);
    }

    private static void printEvents(List<BattleEvent> events) {
        for (BattleEvent event : events) {
            switch (event.type()) {
                case TURN_START:
                    System.out.printf("  [T%d] player %d hp | opponent %d hp%n",
                        event.turn(), event.playerHealth(), event.opponentHealth());
                    break;
                default:
                    System.out.println("    " + event.description());
                    break;
            }
        }
    }
}

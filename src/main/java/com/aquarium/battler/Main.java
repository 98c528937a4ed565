package com.aquarium.battler;

import com.aquarium.battler.battle.Side;
import com.aquarium.battler.game.MatchResult;
import com.aquarium.battler.game.MatchSimulator;
import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCatalog;
import com.aquarium.battler.piece.PieceCatalogException;
import com.aquarium.battler.piece.PieceCategory;
import com.aquarium.battler.tank.WaterQuality;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

/**
 * Aquarium autobattler CLI - Main entry point.
 */
@Command(name = "tank-autobattler",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Aquarium autobattler simulator",
        subcommands = {
                Main.CatalogCommand.class,
                Main.BattleCommand.class,
                Main.SimulateCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by every command that plays matches.
     */
    static class MatchOptions {
        @Option(names = {"-r", "--rounds"}, defaultValue = "10",
                description = "Rounds per match (default: ${DEFAULT-VALUE})")
        int rounds;

        @Option(names = {"-g", "--gold"}, defaultValue = "10",
                description = "Starting gold for each side (default: ${DEFAULT-VALUE})")
        int startingGold;

        @Option(names = {"--income"}, defaultValue = "5",
                description = "Gold each side receives per later round (default: ${DEFAULT-VALUE})")
        int income;

        @Option(names = {"-w", "--water"}, defaultValue = "5",
                description = "Base water quality of both tanks, 1-10 (default: ${DEFAULT-VALUE})")
        int baseWaterQuality;

        /**
         * Prints the first bad option to stderr.
         *
         * @return true if every option is usable
         */
        boolean validate() {
            if (rounds <= 0) {
                System.err.println("✗ Rounds per match must be positive");
                return false;
            }
            if (baseWaterQuality < WaterQuality.MIN || baseWaterQuality > WaterQuality.MAX) {
                System.err.println("✗ Water quality must be between " + WaterQuality.MIN + " and " + WaterQuality.MAX);
                return false;
            }
            return true;
        }

        MatchSimulator.Settings toSettings() {
            return new MatchSimulator.Settings(rounds, startingGold, income, baseWaterQuality);
        }
    }

    // ========== CATALOG COMMAND ==========
    @Command(name = "catalog", description = "List the piece catalog")
    static class CatalogCommand implements Callable<Integer> {
        @Option(names = {"-c", "--catalog"},
                description = "Path to a pieces JSON file (default: bundled catalog)")
        String catalogPath;

        @Option(names = {"--max-cost"},
                description = "Only list pieces costing at most this much")
        Integer maxCost;

        @Override
        public Integer call() {
            PieceCatalog catalog = loadCatalog(catalogPath);
            if (catalog == null) {
                return 1;
            }

            List<Piece> pieces = maxCost == null ? catalog.getAll() : catalog.affordable(maxCost);
            System.out.println("\n=== Piece Catalog ===\n");
            for (PieceCategory category : PieceCategory.values()) {
                List<Piece> inCategory = pieces.stream()
                        .filter(p -> p.getCategory() == category)
                        .toList();
                if (inCategory.isEmpty()) {
                    continue;
                }
                System.out.println(category.getJsonValue().toUpperCase() + ":");
                for (Piece piece : inCategory) {
                    System.out.printf("  %-18s %2dg  ATK %2d  HP %2d  SPD %2d  cells %d%s%n",
                            piece.getName(), piece.getCost(),
                            piece.getStats().getAttack(), piece.getStats().getHealth(), piece.getStats().getSpeed(),
                            piece.getShape().size(),
                            piece.getTags().isEmpty() ? "" : "  " + piece.getTags());
                }
                System.out.println();
            }
            return 0;
        }
    }

    // ========== BATTLE COMMAND ==========
    @Command(name = "battle", description = "Play one AI-vs-AI match with a full battle trace")
    static class BattleCommand implements Callable<Integer> {
        @Option(names = {"-c", "--catalog"},
                description = "Path to a pieces JSON file (default: bundled catalog)")
        String catalogPath;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Mixin
        MatchOptions matchOptions;

        @Override
        public Integer call() {
            if (!matchOptions.validate()) {
                return 1;
            }
            PieceCatalog catalog = loadCatalog(catalogPath);
            if (catalog == null) {
                return 1;
            }
            long matchSeed = seed != null ? seed : System.nanoTime();

            MatchResult result = MatchSimulator.runMatch(catalog, matchSeed, matchOptions.toSettings(), true);

            System.out.println("\n=== Match Result ===\n");
            System.out.printf("Player %d - %d Opponent (%d draws)%n",
                    result.playerWins(), result.opponentWins(), result.draws());
            System.out.printf("Average battle length: %.2f turns%n", result.averageTurns());
            System.out.println("Seed: " + matchSeed);
            return 0;
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Run many AI-vs-AI matches and report outcome rates")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-matches"}, defaultValue = "1000",
                description = "Number of matches to simulate (default: ${DEFAULT-VALUE})")
        int numMatches;

        @Option(names = {"-s", "--seed"},
                description = "Base random seed (optional; makes the run reproducible)")
        Long seed;

        @Option(names = {"-c", "--catalog"},
                description = "Path to a pieces JSON file (default: bundled catalog)")
        String catalogPath;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (trace of the first match)")
        boolean verbose;

        @Mixin
        MatchOptions matchOptions;

        @Override
        public Integer call() {
            if (numMatches <= 0) {
                System.err.println("✗ Number of matches must be positive");
                return 1;
            }
            if (!matchOptions.validate()) {
                return 1;
            }
            PieceCatalog catalog = loadCatalog(catalogPath);
            if (catalog == null) {
                return 1;
            }

            System.out.println("\n=== Aquarium Autobattler Simulator ===\n");
            System.out.println("Matches: " + numMatches);
            System.out.println("Rounds per match: " + matchOptions.rounds);
            if (seed != null) {
                System.out.println("Seed: " + seed);
            }
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<MatchResult> results = runMatches(catalog, matchOptions.toSettings(), numMatches, seed, verbose);
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, numMatches, elapsed);
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Load the catalog from a file, or the bundled one when no path is given.
     * Prints the failure and returns null if it cannot be loaded.
     */
    private static PieceCatalog loadCatalog(String path) {
        try {
            PieceCatalog catalog = path == null ? PieceCatalog.loadDefault() : PieceCatalog.fromFile(path);
            System.err.println("✓ Loaded " + catalog.pieceCount() + " pieces from "
                    + (path == null ? "bundled catalog" : path));
            return catalog;
        } catch (PieceCatalogException e) {
            System.err.println("✗ Failed to load pieces: " + e.getMessage());
            return null;
        }
    }

    private static List<MatchResult> runMatches(PieceCatalog catalog, MatchSimulator.Settings settings,
                                                int count, Long seed, boolean verbose) {
        if (seed != null || verbose) {
            // Sequential so seeds map to matches in order
            long baseSeed = seed != null ? seed : System.nanoTime();
            if (seed == null) {
                System.out.println("Seed: " + baseSeed);
            }
            List<MatchResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                boolean verboseThisMatch = verbose && i == 0;
                results.add(MatchSimulator.runMatch(catalog, baseSeed + i, settings, verboseThisMatch));
            }
            return results;
        }
        // Parallel with random seeds
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(i -> MatchSimulator.runMatch(catalog, System.nanoTime() + i, settings, false))
                .toList();
    }

    private static void printResults(List<MatchResult> results, int numMatches, long elapsedMs) {
        long playerWins = results.stream().filter(r -> r.winner() == Side.PLAYER).count();
        long opponentWins = results.stream().filter(r -> r.winner() == Side.OPPONENT).count();
        long level = numMatches - playerWins - opponentWins;

        int rounds = results.stream().mapToInt(MatchResult::rounds).sum();
        int drawnRounds = results.stream().mapToInt(MatchResult::draws).sum();
        double avgTurns = results.stream().mapToDouble(MatchResult::averageTurns).average().orElse(0.0);

        // Battle length distribution (rounded average per match)
        Map<Long, Long> turnDist = new TreeMap<>();
        for (MatchResult r : results) {
            turnDist.merge(Math.round(r.averageTurns()), 1L, Long::sum);
        }

        System.out.println("=== Results ===\n");
        System.out.printf("Player side won:   %5.1f%% (%d/%d)%n", playerWins * 100.0 / numMatches, playerWins, numMatches);
        System.out.printf("Opponent side won: %5.1f%% (%d/%d)%n", opponentWins * 100.0 / numMatches, opponentWins, numMatches);
        System.out.printf("Level matches:     %5.1f%% (%d/%d)%n", level * 100.0 / numMatches, level, numMatches);
        System.out.printf("Drawn rounds:      %5.1f%% (%d/%d)%n",
                rounds == 0 ? 0.0 : drawnRounds * 100.0 / rounds, drawnRounds, rounds);
        System.out.printf("Average battle length: %.2f turns%n", avgTurns);
        System.out.println();

        System.out.println("Battle length distribution:");
        for (Map.Entry<Long, Long> entry : turnDist.entrySet()) {
            double pct = (double) entry.getValue() / numMatches * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  %2d turns: %5.1f%% %s (%d)%n",
                    entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println();
        System.out.printf("Completed in %.2fs (%.0f matches/sec)%n",
                elapsedMs / 1000.0, numMatches * 1000.0 / Math.max(1, elapsedMs));
    }
}

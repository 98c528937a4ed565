package com.aquarium.battler.ai;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCatalog;
import com.aquarium.battler.piece.PieceCategory;
import com.aquarium.battler.piece.Position;
import com.aquarium.battler.rng.RandomSource;
import com.aquarium.battler.tank.InvalidPlacementException;
import com.aquarium.battler.tank.Tank;
import com.aquarium.battler.tank.TankGrid;
import com.aquarium.battler.tank.TankOperations;
import com.aquarium.battler.tank.WaterQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Shopping and placement decisions for the computer opponent.
 *
 * <p>Every random choice goes through the supplied {@link RandomSource}, so a seeded source
 * replays the same tank.
 */
public final class OpponentAI {
    private static final Logger log = LoggerFactory.getLogger(OpponentAI.class);

    private OpponentAI() {
        // Utility class - prevent instantiation
    }

    // ---- Selection weights ----
    static final double WATER_HELP_CHANCE = 0.8;
    static final double CLEAN_WATER_FISH_CHANCE = 0.6;
    static final double MID_ROUND_COST_CHANCE = 0.7;
    static final double LATE_ROUND_COST_CHANCE = 0.85;
    static final int MID_ROUND_MIN_COST = 3;
    static final int LATE_ROUND_MIN_COST = 4;

    // ---- Replacement ----
    static final int MIN_PIECES_FOR_REPLACEMENT = 5;
    static final int EQUIPMENT_PROTECTION_LIMIT = 8;
    static final double LATE_REPLACEMENT_THRESHOLD = 1.2;
    static final double REPLACEMENT_THRESHOLD = 1.5;

    public static final int MAX_CONSECUTIVE_FAILURES = 25;

    // ==================== Piece selection ====================

    /**
     * Pick the next catalog entry to buy.
     *
     * <p>Dirty water (or a losing streak with mediocre water) leans towards plants and filters,
     * clean water leans towards fish, and otherwise later rounds lean towards pricier pieces.
     * Every bias falls back to a uniform pick among everything affordable.
     *
     * @return the chosen template, or empty if nothing costs {@code budget} or less
     */
    public static Optional<Piece> selectPiece(PieceCatalog catalog, int round, int budget,
                                              int waterQuality, int lossStreak, RandomSource rng) {
        List<Piece> affordable = catalog.affordable(budget);
        if (affordable.isEmpty()) {
            return Optional.empty();
        }

        boolean toxic = waterQuality <= WaterQuality.POISON_THRESHOLD;
        boolean clean = waterQuality >= WaterQuality.CLEAN_THRESHOLD;
        boolean needsWaterHelp = toxic || (lossStreak >= 2 && waterQuality < 7);

        if (needsWaterHelp) {
            List<Piece> improvers = filter(affordable, OpponentAI::improvesWater);
            if (!improvers.isEmpty() && rng.chance(WATER_HELP_CHANCE)) {
                log.debug("Water quality {} is bad, buying plants or filters", waterQuality);
                return Optional.of(rng.pick(improvers));
            }
        }

        if (clean) {
            List<Piece> fish = filter(affordable, Piece::isFish);
            if (!fish.isEmpty() && rng.chance(CLEAN_WATER_FISH_CHANCE)) {
                log.debug("Water quality {} is clean, buying fish", waterQuality);
                return Optional.of(rng.pick(fish));
            }
        }

        if (round <= 3) {
            return Optional.of(rng.pick(affordable));
        }

        if (round <= 7) {
            List<Piece> good = filter(affordable, p -> p.getCost() >= MID_ROUND_MIN_COST);
            if (!good.isEmpty()) {
                return Optional.of(rng.chance(MID_ROUND_COST_CHANCE) ? rng.pick(good) : rng.pick(affordable));
            }
        }

        List<Piece> expensive = filter(affordable, p -> p.getCost() >= LATE_ROUND_MIN_COST);
        if (!expensive.isEmpty()) {
            return Optional.of(rng.chance(LATE_ROUND_COST_CHANCE) ? rng.pick(expensive) : rng.pick(affordable));
        }
        return Optional.of(rng.pick(affordable));
    }

    static boolean improvesWater(Piece piece) {
        return piece.getCategory() == PieceCategory.PLANT
            || (piece.getCategory() == PieceCategory.EQUIPMENT && WaterQuality.isFilter(piece));
    }

    private static List<Piece> filter(List<Piece> pieces, Predicate<Piece> predicate) {
        List<Piece> result = new ArrayList<>();
        for (Piece piece : pieces) {
            if (predicate.test(piece)) {
                result.add(piece);
            }
        }
        return result;
    }

    // ==================== Spending budget ====================

    /**
     * How much of the current gold to spend this round.
     * Gold held back keeps the opponent near the next 10-gold interest breakpoint;
     * a long enough losing streak spends everything.
     */
    public static int spendingBudget(int gold, int round, int lossStreak, int winStreak) {
        int budget;
        if (round <= 5) {
            if (round <= 3) {
                budget = Math.max(0, gold - 1);
            } else if (lossStreak >= 2) {
                budget = gold;
            } else if (gold >= 20 && winStreak >= 2) {
                budget = gold - 10;
            } else {
                budget = Math.max(0, gold - 2);
            }
        } else if (round <= 10) {
            if (lossStreak >= 3) {
                budget = gold;
            } else if (winStreak >= 3) {
                budget = Math.max(0, gold - 20);
            } else {
                budget = Math.max(0, gold - 10);
            }
        } else {
            if (lossStreak >= 2) {
                budget = gold;
            } else {
                budget = Math.max(0, gold - 5);
            }
        }
        log.debug("Round {}: budget {}g of {}g (L{} W{})", round, budget, gold, lossStreak, winStreak);
        return budget;
    }

    // ==================== Placement ====================

    /**
     * Where a newly bought fish, plant or equipment should go, or null if it does not fit.
     * Plants and equipment go next to as many fish as possible; fish take the first free spot.
     */
    public static Position choosePosition(Tank tank, Piece piece) {
        switch (piece.getCategory()) {
            case PLANT:
            case EQUIPMENT:
                return TankGrid.findBestSupportPosition(tank, piece);
            default:
                return TankGrid.findFirstValidPosition(tank, piece);
        }
    }

    // ==================== Replacement ====================

    /**
     * Rough strength rating used to decide what to sell off.
     */
    public static double piecePower(Piece piece) {
        boolean fish = piece.isFish();
        double attackWeight = fish ? 1.2 : 0.5;
        double speedWeight = fish ? 0.3 : 0.1;
        double abilityWeight = piece.getAbilities().size() * 2;
        double utility;
        if (piece.getCategory() == PieceCategory.PLANT) {
            utility = 5;
        } else if (piece.getCategory() == PieceCategory.EQUIPMENT) {
            utility = 3;
        } else {
            utility = 0;
        }
        return piece.getStats().getAttack() * attackWeight
            + piece.getStats().getHealth()
            + piece.getStats().getSpeed() * speedWeight
            + abilityWeight
            + utility;
    }

    /**
     * Swap the weakest piece for a clearly stronger candidate when the tank is full.
     *
     * <p>Only engages once the tank holds enough pieces. Equipment stays protected until the tank
     * is nearly maxed out. If the candidate fits nowhere after the removal, the removed piece goes
     * back where it was and nothing changes.
     *
     * @param candidate a fresh instance, not yet in the tank
     * @return the piece that was removed, or empty if no replacement happened
     */
    public static Optional<Piece> tryReplaceWeakest(Tank tank, Piece candidate, int round) {
        if (tank.size() < MIN_PIECES_FOR_REPLACEMENT) {
            return Optional.empty();
        }
        double candidatePower = piecePower(candidate);
        double threshold = round > 10 ? LATE_REPLACEMENT_THRESHOLD : REPLACEMENT_THRESHOLD;
        boolean protectEquipment = tank.size() < EQUIPMENT_PROTECTION_LIMIT;

        Optional<Piece> weakest = tank.getPlacedPieces().stream()
            .filter(p -> !(protectEquipment && p.getCategory() == PieceCategory.EQUIPMENT))
            .filter(p -> piecePower(p) * threshold < candidatePower)
            .min(Comparator.comparingDouble(OpponentAI::piecePower));
        if (weakest.isEmpty()) {
            return Optional.empty();
        }

        Piece removed = weakest.get();
        Position originalPosition = removed.getPosition();
        TankGrid.remove(tank, removed);
        tank.getPieces().remove(removed);
        removed.setPosition(null);

        Position position = choosePosition(tank, candidate);
        try {
            if (position != null) {
                TankOperations.placeNewPiece(tank, candidate, position);
                log.debug("Replaced {} with {} at {}", removed.getName(), candidate.getName(), position);
                return Optional.of(removed);
            }
            TankOperations.placeNewPiece(tank, removed, originalPosition);
            return Optional.empty();
        } catch (InvalidPlacementException e) {
            throw new IllegalStateException("Freed cells rejected a placement in tank " + tank.getId(), e);
        }
    }

    // ==================== Shopping loop ====================

    /**
     * Spend gold on the opponent's tank for one round.
     *
     * <p>Keeps buying until the budget runs out or {@value #MAX_CONSECUTIVE_FAILURES} attempts
     * in a row fail to buy anything. Water quality is refreshed at the end.
     */
    public static AcquisitionResult generateAcquisitions(Tank tank, PieceCatalog catalog, int gold, int round,
                                                         int lossStreak, int winStreak, RandomSource rng) {
        int remainingGold = gold;
        int budget = spendingBudget(gold, round, lossStreak, winStreak);
        int failures = 0;
        List<String> bought = new ArrayList<>();
        List<String> replaced = new ArrayList<>();

        log.debug("Opponent shopping: round {}, {}g, {} pieces in tank", round, gold, tank.size());

        while (budget > 0 && failures < MAX_CONSECUTIVE_FAILURES) {
            Optional<Piece> choice = selectPiece(catalog, round, budget, tank.getWaterQuality(), lossStreak, rng);
            if (choice.isEmpty() || choice.get().getCost() > budget) {
                failures++;
                continue;
            }
            Piece piece = PieceCatalog.instantiate(choice.get());

            boolean success;
            if (piece.getCategory() == PieceCategory.CONSUMABLE && feedFirstFish(tank, piece)) {
                success = true;
            } else {
                Position position = piece.getCategory() == PieceCategory.CONSUMABLE
                    ? TankGrid.findFirstValidPosition(tank, piece)
                    : choosePosition(tank, piece);
                if (position != null) {
                    placeBought(tank, piece, position);
                    success = true;
                } else {
                    Optional<Piece> removed = tryReplaceWeakest(tank, piece, round);
                    removed.ifPresent(r -> replaced.add(r.getName()));
                    success = removed.isPresent();
                }
            }

            if (success) {
                remainingGold -= piece.getCost();
                budget -= piece.getCost();
                bought.add(piece.getName());
                failures = 0;
                log.debug("Bought {} for {}g ({}g budget left)", piece.getName(), piece.getCost(), budget);
            } else {
                failures++;
            }
        }

        WaterQuality.refresh(tank);
        log.debug("Opponent tank now holds {} pieces, {}g left, water {}",
            tank.size(), remainingGold, tank.getWaterQuality());
        return new AcquisitionResult(remainingGold, gold - remainingGold, bought, replaced);
    }

    private static boolean feedFirstFish(Tank tank, Piece consumable) {
        for (Piece piece : tank.getPlacedPieces()) {
            if (piece.isFish()) {
                TankOperations.feed(piece, consumable);
                return true;
            }
        }
        return false;
    }

    private static void placeBought(Tank tank, Piece piece, Position position) {
        try {
            TankOperations.placeNewPiece(tank, piece, position);
        } catch (InvalidPlacementException e) {
            throw new IllegalStateException("Search returned an occupied position " + position, e);
        }
    }
}

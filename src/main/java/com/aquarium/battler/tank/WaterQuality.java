package com.aquarium.battler.tank;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCategory;

import java.util.Set;

/**
 * Water quality: a 1-10 tank resource derived from what is placed in it.
 *
 * <p>Fish dirty the water (-1 each), plants and filters clean it (+1 each).
 * In combat, dirty water (3 or less) poisons fish and weakens attacks,
 * clean water (8 or more) strengthens them.
 */
public final class WaterQuality {

    public static final int MIN = 1;
    public static final int MAX = 10;
    public static final int POISON_THRESHOLD = 3;
    public static final int CLEAN_THRESHOLD = 8;
    public static final int POISON_DAMAGE = 1;

    public static final double DIRTY_MULTIPLIER = 0.7;
    public static final double CLEAN_MULTIPLIER = 1.3;

    // Equipment that filters without carrying the tag
    private static final Set<String> FILTER_NAMES = Set.of(
        "Sponge Filter"
    );

    private WaterQuality() {
        // Utility class - prevent instantiation
    }

    /**
     * Contribution of a single piece, ignoring whether it is placed.
     */
    public static int effectOf(Piece piece) {
        return switch (piece.getCategory()) {
            case FISH -> -1;
            case PLANT -> 1;
            case EQUIPMENT -> isFilter(piece) ? 1 : 0;
            case CONSUMABLE -> 0;
        };
    }

    /**
     * Filters improve water; either tagged {@code filter} or a known filter by name.
     */
    public static boolean isFilter(Piece piece) {
        return piece.getCategory() == PieceCategory.EQUIPMENT
            && (piece.hasTag("filter") || FILTER_NAMES.contains(piece.getName()));
    }

    /**
     * Quality of the tank as it stands: base quality plus the effect of every placed piece.
     */
    public static int compute(Tank tank) {
        int total = 0;
        for (Piece piece : tank.getPieces()) {
            if (piece.isPlaced()) {
                total += effectOf(piece);
            }
        }
        return clamp(tank.getBaseWaterQuality() + total);
    }

    /**
     * Recompute and store the tank's quality. Called after every grid mutation.
     */
    public static int refresh(Tank tank) {
        int quality = compute(tank);
        tank.setWaterQuality(quality);
        return quality;
    }

    public static int clamp(int quality) {
        return Math.max(MIN, Math.min(MAX, quality));
    }

    /**
     * Fish on this side take poison damage at the start of every turn.
     */
    public static boolean isPoisonous(int quality) {
        return quality <= POISON_THRESHOLD;
    }

    /**
     * Multiplier applied to every outgoing attack from a side with this quality.
     */
    public static double damageMultiplier(int quality) {
        if (quality >= CLEAN_THRESHOLD) {
            return CLEAN_MULTIPLIER;
        }
        if (quality <= POISON_THRESHOLD) {
            return DIRTY_MULTIPLIER;
        }
        return 1.0;
    }
}

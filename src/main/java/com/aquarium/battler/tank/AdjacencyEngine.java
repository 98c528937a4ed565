package com.aquarium.battler.tank;

import com.aquarium.battler.piece.PermanentBonuses;
import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCategory;
import com.aquarium.battler.piece.PieceStats;
import com.aquarium.battler.piece.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shape-aware 8-directional adjacency and the stat bonuses it produces.
 *
 * <p>Pure functions of (piece, placed pieces): nothing is cached, so the same call serves
 * battle snapshots and shop-phase stat previews. Bonus rules:
 * <ul>
 *   <li>Plants and consumables add their attack/health/speed bonus to adjacent fish.</li>
 *   <li>A filter touching the plant (or the fish it feeds) boosts the plant's positive
 *       bonuses by 20% of its largest bonus, rounded up.</li>
 *   <li>Schooling fish gain attack per adjacent schooling piece (by name), and double their
 *       base speed once 3 or more schooling pieces are adjacent.</li>
 *   <li>Permanent bonuses from eaten consumables are always included.</li>
 * </ul>
 */
public final class AdjacencyEngine {

    public static final String SCHOOLING_TAG = "schooling";
    public static final String FILTER_TAG = "filter";
    public static final int FRENZY_THRESHOLD = 3;

    // Attack gained per adjacent schooling piece
    private static final Map<String, Integer> SCHOOLING_ATTACK_PER_NEIGHBOR = Map.of(
        "Neon Tetra", 1,
        "Cardinal Tetra", 2
    );

    private AdjacencyEngine() {
        // Utility class - prevent instantiation
    }

    // ==================== ADJACENCY ====================

    /**
     * Two placed, distinct pieces are adjacent if any covered cell of one is within
     * Chebyshev distance 1 of a covered cell of the other.
     */
    public static boolean areAdjacent(Piece a, Piece b) {
        if (!a.isPlaced() || !b.isPlaced() || a == b || sameId(a, b)) {
            return false;
        }
        return cellsTouch(a.getOccupiedCells(), b.getOccupiedCells());
    }

    static boolean cellsTouch(List<Position> first, List<Position> second) {
        for (Position cell : first) {
            for (Position other : second) {
                if (cell.isAdjacentTo(other)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean sameId(Piece a, Piece b) {
        return a.getId() != null && a.getId().equals(b.getId());
    }

    /**
     * Every piece adjacent to {@code target}, each listed once however many cells touch.
     */
    public static List<Piece> adjacentPieces(Piece target, List<Piece> allPlaced) {
        List<Piece> adjacent = new ArrayList<>();
        for (Piece piece : allPlaced) {
            if (areAdjacent(target, piece) && !adjacent.contains(piece)) {
                adjacent.add(piece);
            }
        }
        return adjacent;
    }

    // ==================== BONUSES ====================

    /**
     * Bonuses {@code target} currently receives from its neighbours and from eaten consumables.
     * Pieces in inventory receive nothing.
     */
    public static BonusBreakdown computeBonuses(Piece target, List<Piece> allPlaced) {
        if (!target.isPlaced()) {
            return BonusBreakdown.NONE;
        }

        int attack = 0;
        int health = 0;
        int speed = 0;
        List<String> sources = new ArrayList<>();

        List<Piece> adjacent = adjacentPieces(target, allPlaced);
        boolean filterNearTarget = adjacent.stream().anyMatch(AdjacencyEngine::isFilterEquipment);

        if (target.isFish()) {
            for (Piece neighbor : adjacent) {
                if (!neighbor.getCategory().givesBonuses()) {
                    continue;
                }
                int bonusAttack = neighbor.getAttackBonus();
                int bonusHealth = neighbor.getHealthBonus();
                int bonusSpeed = neighbor.getSpeedBonus();

                boolean filtered = neighbor.getCategory() == PieceCategory.PLANT
                    && (filterNearTarget || hasAdjacentFilter(neighbor, allPlaced));
                if (filtered) {
                    int boost = filterBoost(bonusAttack, bonusHealth, bonusSpeed);
                    bonusAttack = bonusAttack > 0 ? bonusAttack + boost : bonusAttack;
                    bonusHealth = bonusHealth > 0 ? bonusHealth + boost : bonusHealth;
                    bonusSpeed = bonusSpeed > 0 ? bonusSpeed + boost : bonusSpeed;
                }

                if (bonusAttack == 0 && bonusHealth == 0 && bonusSpeed == 0) {
                    continue;
                }
                attack += bonusAttack;
                health += bonusHealth;
                speed += bonusSpeed;
                sources.add(neighbor.getName() + (filtered ? " (filtered)" : "")
                    + describe(bonusAttack, bonusHealth, bonusSpeed));
            }
        }

        if (target.hasTag(SCHOOLING_TAG)) {
            int schoolmates = (int) adjacent.stream().filter(p -> p.hasTag(SCHOOLING_TAG)).count();

            int perNeighbor = SCHOOLING_ATTACK_PER_NEIGHBOR.getOrDefault(target.getName(), 0);
            if (perNeighbor > 0 && schoolmates > 0) {
                attack += schoolmates * perNeighbor;
                sources.add("Schooling x" + schoolmates + describe(schoolmates * perNeighbor, 0, 0));
            }

            // Frenzy: double base speed, once, however large the school
            if (schoolmates >= FRENZY_THRESHOLD) {
                speed += target.getStats().getSpeed();
                sources.add("School Frenzy (Double Speed)");
            }
        }

        PermanentBonuses permanent = target.getPermanentBonuses();
        if (permanent != null) {
            attack += permanent.getAttack();
            health += permanent.getHealth();
            speed += permanent.getSpeed();
            for (PermanentBonuses.Source source : permanent.getSources()) {
                sources.add(source.getName() + " x" + source.getCount() + " eaten"
                    + describe(source.getAttackBonus() * source.getCount(),
                               source.getHealthBonus() * source.getCount(),
                               source.getSpeedBonus() * source.getCount()));
            }
        }

        return new BonusBreakdown(attack, health, speed, sources);
    }

    /**
     * Base stats plus {@link #computeBonuses}.
     */
    public static BuffedStats computeBuffedStats(Piece piece, List<Piece> allPlaced) {
        PieceStats base = piece.getStats();
        BonusBreakdown bonuses = computeBonuses(piece, allPlaced);
        return new BuffedStats(
            base.getAttack() + bonuses.attackBonus(),
            base.getHealth() + bonuses.healthBonus(),
            base.getSpeed() + bonuses.speedBonus()
        );
    }

    /**
     * 20% of the largest bonus, rounded up.
     */
    static int filterBoost(int attack, int health, int speed) {
        int largest = Math.max(attack, Math.max(health, speed));
        if (largest <= 0) {
            return 0;
        }
        return (largest + 4) / 5;
    }

    private static boolean hasAdjacentFilter(Piece plant, List<Piece> allPlaced) {
        for (Piece piece : allPlaced) {
            if (isFilterEquipment(piece) && areAdjacent(plant, piece)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isFilterEquipment(Piece piece) {
        return piece.getCategory() == PieceCategory.EQUIPMENT && piece.hasTag(FILTER_TAG);
    }

    private static String describe(int attack, int health, int speed) {
        List<String> parts = new ArrayList<>(3);
        if (attack != 0) parts.add(signed(attack) + " ATK");
        if (health != 0) parts.add(signed(health) + " HP");
        if (speed != 0) parts.add(signed(speed) + " SPD");
        return parts.isEmpty() ? "" : " (" + String.join(", ", parts) + ")";
    }

    private static String signed(int value) {
        return value > 0 ? "+" + value : String.valueOf(value);
    }
}

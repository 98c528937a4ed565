package com.aquarium.battler.piece;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A purchasable unit: fish, plant, equipment or consumable.
 *
 * <p>Catalog entries are templates with no id. Every acquisition goes through
 * {@link PieceCatalog#instantiate(Piece)}, which deep-copies the template and assigns a fresh id.
 * A piece without a position is in inventory and takes no part in adjacency or combat.
 */
public class Piece {
    @JsonIgnore
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("category")
    private PieceCategory category;

    @JsonProperty("rarity")
    private String rarity = "common";

    @JsonProperty("shape")
    private List<Position> shape = new ArrayList<>(List.of(Position.ORIGIN));

    @JsonProperty("stats")
    private PieceStats stats = new PieceStats();

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("cost")
    private int cost;

    @JsonProperty("abilities")
    private List<String> abilities = new ArrayList<>();

    // Adjacency bonuses handed out by plants and consumables
    @JsonProperty("attack_bonus")
    private int attackBonus;

    @JsonProperty("health_bonus")
    private int healthBonus;

    @JsonProperty("speed_bonus")
    private int speedBonus;

    @JsonIgnore
    private Position position;

    @JsonIgnore
    private PermanentBonuses permanentBonuses;

    public Piece() {
    }

    public Piece(String name, PieceCategory category, List<Position> shape, PieceStats stats,
                 List<String> tags, int cost) {
        this.name = name;
        this.category = category;
        this.shape = new ArrayList<>(shape);
        this.stats = stats;
        this.tags = new ArrayList<>(tags);
        this.cost = cost;
    }

    /**
     * Deep copy under a new id. Position and permanent bonuses are copied too.
     */
    public Piece copyWithId(String newId) {
        Piece copy = new Piece(name, category, shape, stats.copy(), tags, cost);
        copy.id = newId;
        copy.rarity = rarity;
        copy.abilities = new ArrayList<>(abilities);
        copy.attackBonus = attackBonus;
        copy.healthBonus = healthBonus;
        copy.speedBonus = speedBonus;
        copy.position = position;
        copy.permanentBonuses = permanentBonuses != null ? permanentBonuses.copy() : null;
        return copy;
    }

    /**
     * Cells this piece would cover with its anchor at the given position.
     */
    public List<Position> cellsAt(Position anchor) {
        List<Position> cells = new ArrayList<>(shape.size());
        for (Position offset : shape) {
            cells.add(anchor.plus(offset));
        }
        return cells;
    }

    /**
     * Cells currently covered, or an empty list while in inventory.
     */
    @JsonIgnore
    public List<Position> getOccupiedCells() {
        return position == null ? List.of() : cellsAt(position);
    }

    @JsonIgnore
    public boolean isPlaced() {
        return position != null;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    @JsonIgnore
    public boolean isFish() {
        return category == PieceCategory.FISH;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PieceCategory getCategory() {
        return category;
    }

    public String getRarity() {
        return rarity;
    }

    public List<Position> getShape() {
        return shape;
    }

    public PieceStats getStats() {
        return stats;
    }

    public List<String> getTags() {
        return tags;
    }

    public int getCost() {
        return cost;
    }

    public List<String> getAbilities() {
        return abilities;
    }

    public int getAttackBonus() {
        return attackBonus;
    }

    public int getHealthBonus() {
        return healthBonus;
    }

    public int getSpeedBonus() {
        return speedBonus;
    }

    public Position getPosition() {
        return position;
    }

    public PermanentBonuses getPermanentBonuses() {
        return permanentBonuses;
    }

    /**
     * Permanent bonuses, created on first use.
     */
    public PermanentBonuses permanentBonuses() {
        if (permanentBonuses == null) {
            permanentBonuses = new PermanentBonuses();
        }
        return permanentBonuses;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    // Setters for Jackson and fixtures
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setCategory(PieceCategory category) { this.category = category; }
    public void setRarity(String rarity) { this.rarity = rarity; }
    public void setShape(List<Position> shape) { this.shape = shape; }
    public void setStats(PieceStats stats) { this.stats = stats; }
    public void setTags(List<String> tags) { this.tags = tags; }
    public void setCost(int cost) { this.cost = cost; }
    public void setAbilities(List<String> abilities) { this.abilities = abilities; }
    public void setAttackBonus(int attackBonus) { this.attackBonus = attackBonus; }
    public void setHealthBonus(int healthBonus) { this.healthBonus = healthBonus; }
    public void setSpeedBonus(int speedBonus) { this.speedBonus = speedBonus; }

    @Override
    public String toString() {
        return name + (id != null ? "#" + id : "") + (position != null ? "@" + position : "");
    }
}

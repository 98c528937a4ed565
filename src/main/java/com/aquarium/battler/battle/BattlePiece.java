package com.aquarium.battler.battle;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCategory;
import com.aquarium.battler.tank.BuffedStats;

import java.util.ArrayList;
import java.util.List;

/**
 * A piece as it fights: a snapshot of its buffed stats taken at battle start.
 *
 * <p>Health and death live here only; the tank's {@link Piece} is never touched by combat,
 * so a tank can be rebuilt or shown while a battle is in progress.
 */
public class BattlePiece {
    private final String id;
    private final String name;
    private final PieceCategory category;
    private final Side side;
    private final int baseAttack;
    private final int attack;
    private final int speed;
    private final int maxHealth;
    private final List<String> statusEffects;

    private int currentHealth;
    private boolean dead;
    // Reserved for timed status effects
    private int nextActionTime;

    public BattlePiece(Piece piece, Side side, BuffedStats buffed) {
        this.id = piece.getId();
        this.name = piece.getName();
        this.category = piece.getCategory();
        this.side = side;
        this.baseAttack = piece.getStats().getAttack();
        this.attack = buffed.attack();
        this.speed = buffed.speed();
        this.maxHealth = buffed.health();
        this.currentHealth = Math.max(0, buffed.health());
        this.dead = false;
        this.statusEffects = new ArrayList<>();
        this.nextActionTime = 0;
    }

    /**
     * Subtract damage, flooring health at zero.
     *
     * @return true if this hit killed the piece
     */
    public boolean takeDamage(int damage) {
        if (dead) {
            return false;
        }
        currentHealth = Math.max(0, currentHealth - damage);
        if (currentHealth == 0) {
            dead = true;
            return true;
        }
        return false;
    }

    public boolean isAlive() {
        return !dead;
    }

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

    public Side getSide() {
        return side;
    }

    public int getBaseAttack() {
        return baseAttack;
    }

    public int getAttack() {
        return attack;
    }

    public int getSpeed() {
        return speed;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    public int getCurrentHealth() {
        return currentHealth;
    }

    public boolean isDead() {
        return dead;
    }

    public List<String> getStatusEffects() {
        return statusEffects;
    }

    public int getNextActionTime() {
        return nextActionTime;
    }

    @Override
    public String toString() {
        return name + "[" + side + " " + currentHealth + "/" + maxHealth + (dead ? " dead" : "") + "]";
    }
}

package com.aquarium.battler.piece;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Base combat stats of a piece.
 */
public class PieceStats {
    @JsonProperty("attack")
    private int attack;

    @JsonProperty("health")
    private int health;

    @JsonProperty("speed")
    private int speed;

    @JsonProperty("max_health")
    private int maxHealth;

    public PieceStats() {
    }

    public PieceStats(int attack, int health, int speed, int maxHealth) {
        this.attack = attack;
        this.health = health;
        this.speed = speed;
        this.maxHealth = maxHealth;
    }

    public PieceStats(int attack, int health, int speed) {
        this(attack, health, speed, health);
    }

    public PieceStats copy() {
        return new PieceStats(attack, health, speed, maxHealth);
    }

    public int getAttack() {
        return attack;
    }

    public int getHealth() {
        return health;
    }

    public int getSpeed() {
        return speed;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    // Setters for Jackson
    public void setAttack(int attack) { this.attack = attack; }
    public void setHealth(int health) { this.health = health; }
    public void setSpeed(int speed) { this.speed = speed; }
    public void setMaxHealth(int maxHealth) { this.maxHealth = maxHealth; }
}

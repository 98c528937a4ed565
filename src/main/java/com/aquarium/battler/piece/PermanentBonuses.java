package com.aquarium.battler.piece;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bonuses a fish keeps for the rest of the game after eating consumables.
 */
public class PermanentBonuses {
    private int attack;
    private int health;
    private int speed;
    private final List<Source> sources;

    public PermanentBonuses() {
        this.sources = new ArrayList<>();
    }

    /**
     * One consumable kind that was eaten, and how many times.
     */
    public static class Source {
        private final String name;
        private int count;
        private final int attackBonus;
        private final int healthBonus;
        private final int speedBonus;

        public Source(String name, int attackBonus, int healthBonus, int speedBonus) {
            this.name = name;
            this.count = 1;
            this.attackBonus = attackBonus;
            this.healthBonus = healthBonus;
            this.speedBonus = speedBonus;
        }

        public String getName() {
            return name;
        }

        public int getCount() {
            return count;
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

        Source copy() {
            Source copy = new Source(name, attackBonus, healthBonus, speedBonus);
            copy.count = count;
            return copy;
        }
    }

    /**
     * Fold one consumable into the totals. Repeat sources are counted, not duplicated.
     */
    public void absorb(String name, int attackBonus, int healthBonus, int speedBonus) {
        attack += attackBonus;
        health += healthBonus;
        speed += speedBonus;

        Optional<Source> existing = sources.stream()
                .filter(s -> s.getName().equals(name))
                .findFirst();
        if (existing.isPresent()) {
            existing.get().count++;
        } else {
            sources.add(new Source(name, attackBonus, healthBonus, speedBonus));
        }
    }

    public PermanentBonuses copy() {
        PermanentBonuses copy = new PermanentBonuses();
        copy.attack = attack;
        copy.health = health;
        copy.speed = speed;
        for (Source source : sources) {
            copy.sources.add(source.copy());
        }
        return copy;
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

    public List<Source> getSources() {
        return List.copyOf(sources);
    }
}

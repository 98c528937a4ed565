package com.aquarium.battler.tank;

import java.util.List;

/**
 * Everything a piece gains on top of its base stats, with human-readable sources
 * for stat previews. Combat only reads the totals.
 */
public record BonusBreakdown(int attackBonus, int healthBonus, int speedBonus, List<String> sources) {

    public static final BonusBreakdown NONE = new BonusBreakdown(0, 0, 0, List.of());

    public BonusBreakdown {
        sources = List.copyOf(sources);
    }
}

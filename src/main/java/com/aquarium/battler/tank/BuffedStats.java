package com.aquarium.battler.tank;

/**
 * Effective stats of a placed piece: base stats plus every active bonus.
 */
public record BuffedStats(int attack, int health, int speed) {
}

package com.aquarium.battler.battle;

/**
 * One entry in the battle log.
 *
 * @param id            sequential id, unique within the battle
 * @param type          event kind
 * @param side          side the source belongs to, or null for system events
 * @param sourceId      acting piece id, or null
 * @param sourceName    acting piece name, "poison" or "system"
 * @param targetId      affected piece id, or null
 * @param targetName    affected piece name, or null
 * @param value         damage dealt, or 0
 * @param round         game round the battle belongs to
 * @param turn          battle turn
 * @param description   log line for presentation layers
 * @param playerHealth  player side health after the event
 * @param opponentHealth opponent side health after the event
 * @param damage        damage breakdown for attacks, otherwise null
 */
public record BattleEvent(
    String id,
    BattleEventType type,
    Side side,
    String sourceId,
    String sourceName,
    String targetId,
    String targetName,
    int value,
    int round,
    int turn,
    String description,
    int playerHealth,
    int opponentHealth,
    Damage damage
) {

    /**
     * How an attack's damage was put together.
     * {@code baseAttack + attackBonus} is the attacker's buffed attack;
     * {@code waterModifier} is what the side's water quality added or took away.
     */
    public record Damage(int baseAttack, int attackBonus, int waterModifier, int total, double multiplier) {
    }
}

package com.aquarium.battler.piece;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Piece categories.
 * Serialized as the lower-case names used by the catalog JSON.
 */
public enum PieceCategory {
    FISH("fish"),
    PLANT("plant"),
    EQUIPMENT("equipment"),
    CONSUMABLE("consumable");

    private final String jsonValue;

    PieceCategory(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static PieceCategory fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Piece category cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "fish" -> FISH;
            case "plant" -> PLANT;
            case "equipment" -> EQUIPMENT;
            case "consumable" -> CONSUMABLE;
            default -> throw new IllegalArgumentException("Unknown piece category: " + value);
        };
    }

    /**
     * Plants and consumables hand out adjacency bonuses, and only to fish.
     */
    public boolean givesBonuses() {
        return this == PLANT || this == CONSUMABLE;
    }
}

package com.aquarium.battler.piece;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A grid cell, or a relative offset inside a piece shape.
 */
public record Position(@JsonProperty("x") int x, @JsonProperty("y") int y) {

    public static final Position ORIGIN = new Position(0, 0);

    /**
     * Translate this position by an offset.
     */
    public Position plus(Position offset) {
        return new Position(x + offset.x, y + offset.y);
    }

    /**
     * True if the two cells touch in any of the 8 directions.
     * A cell is never adjacent to itself.
     */
    public boolean isAdjacentTo(Position other) {
        int dx = Math.abs(x - other.x);
        int dy = Math.abs(y - other.y);
        return dx <= 1 && dy <= 1 && !(dx == 0 && dy == 0);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}

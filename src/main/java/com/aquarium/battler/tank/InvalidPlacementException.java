package com.aquarium.battler.tank;

import com.aquarium.battler.GameRuleException;
import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.Position;

/**
 * Target cells are out of bounds or overlap another piece.
 */
public class InvalidPlacementException extends GameRuleException {
    private final transient Piece piece;
    private final transient Position position;

    public InvalidPlacementException(Piece piece, Position position) {
        super("Invalid position " + position + " for " + piece.getName());
        this.piece = piece;
        this.position = position;
    }

    public Piece getPiece() {
        return piece;
    }

    public Position getPosition() {
        return position;
    }
}

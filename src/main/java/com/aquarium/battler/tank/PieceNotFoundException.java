package com.aquarium.battler.tank;

import com.aquarium.battler.GameRuleException;

/**
 * The referenced piece id is not in the tank.
 */
public class PieceNotFoundException extends GameRuleException {
    public PieceNotFoundException(String tankId, String pieceId) {
        super("Piece not found in tank " + tankId + ": " + pieceId);
    }
}

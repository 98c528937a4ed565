package com.aquarium.battler.tank;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCategory;
import com.aquarium.battler.piece.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tank mutations. Each one validates first, then updates grid, piece list and water quality
 * together; a failed call leaves the tank untouched.
 */
public final class TankOperations {
    private static final Logger log = LoggerFactory.getLogger(TankOperations.class);

    private TankOperations() {
        // Utility class - prevent instantiation
    }

    /**
     * Check whether an owned piece may be placed (or moved) with its anchor at {@code position}.
     */
    public static boolean validatePlacement(Tank tank, Piece piece, Position position) {
        return TankGrid.isValidPosition(tank, piece, position);
    }

    /**
     * Put a newly acquired piece into the tank's inventory.
     */
    public static void addToInventory(Tank tank, Piece piece) {
        piece.setPosition(null);
        tank.getPieces().add(piece);
    }

    /**
     * Place (or move) an owned piece. Its old cells are released first, so a move may
     * overlap the piece's own current cells.
     *
     * @throws PieceNotFoundException if the tank does not own {@code pieceId}
     * @throws InvalidPlacementException if the cells are out of bounds or taken
     */
    public static Piece placePiece(Tank tank, String pieceId, Position position)
            throws PieceNotFoundException, InvalidPlacementException {
        Piece piece = requirePiece(tank, pieceId);
        if (!TankGrid.isValidPosition(tank, piece, position)) {
            throw new InvalidPlacementException(piece, position);
        }

        if (piece.isPlaced()) {
            TankGrid.remove(tank, piece);
        }
        piece.setPosition(position);
        TankGrid.place(tank, piece);
        WaterQuality.refresh(tank);
        return piece;
    }

    /**
     * Move an owned piece. Same rules as {@link #placePiece}.
     */
    public static Piece movePiece(Tank tank, String pieceId, Position position)
            throws PieceNotFoundException, InvalidPlacementException {
        return placePiece(tank, pieceId, position);
    }

    /**
     * Take a piece off the grid and back into inventory.
     */
    public static Piece removePiece(Tank tank, String pieceId) throws PieceNotFoundException {
        Piece piece = requirePiece(tank, pieceId);
        if (piece.isPlaced()) {
            TankGrid.remove(tank, piece);
            piece.setPosition(null);
            WaterQuality.refresh(tank);
        }
        return piece;
    }

    /**
     * Remove a piece from the tank altogether (sold, replaced or eaten).
     */
    public static Piece deletePiece(Tank tank, String pieceId) throws PieceNotFoundException {
        Piece piece = requirePiece(tank, pieceId);
        TankGrid.remove(tank, piece);
        tank.getPieces().remove(piece);
        WaterQuality.refresh(tank);
        return piece;
    }

    /**
     * Add a piece that is not yet owned and put it straight onto empty cells.
     *
     * @throws InvalidPlacementException if any cell is out of bounds or occupied
     */
    public static void placeNewPiece(Tank tank, Piece piece, Position position)
            throws InvalidPlacementException {
        if (!TankGrid.isValidPositionForNewPiece(tank, piece, position)) {
            throw new InvalidPlacementException(piece, position);
        }
        piece.setPosition(position);
        tank.getPieces().add(piece);
        TankGrid.place(tank, piece);
        WaterQuality.refresh(tank);
    }

    /**
     * Feed every placed consumable to the fish around it.
     * Each adjacent placed fish keeps the consumable's bonuses permanently; the consumable is
     * then removed from grid and piece list whether or not any fish was reached.
     *
     * @return the consumables that were processed
     */
    public static List<Piece> processConsumables(Tank tank) {
        List<Piece> consumables = new ArrayList<>();
        for (Piece piece : tank.getPieces()) {
            if (piece.getCategory() == PieceCategory.CONSUMABLE && piece.isPlaced()) {
                consumables.add(piece);
            }
        }
        if (consumables.isEmpty()) {
            return consumables;
        }

        for (Piece consumable : consumables) {
            for (Piece fish : tank.getPieces()) {
                if (fish.isFish() && AdjacencyEngine.areAdjacent(consumable, fish)) {
                    feed(fish, consumable);
                }
            }
            TankGrid.remove(tank, consumable);
        }
        tank.getPieces().removeAll(consumables);
        WaterQuality.refresh(tank);
        log.debug("Processed {} consumables in tank {}", consumables.size(), tank.getId());
        return consumables;
    }

    /**
     * Fold a consumable's bonuses into a fish's permanent bonuses.
     */
    public static void feed(Piece fish, Piece consumable) {
        fish.permanentBonuses().absorb(consumable.getName(),
            consumable.getAttackBonus(), consumable.getHealthBonus(), consumable.getSpeedBonus());
        log.debug("{} ate {}: +{} ATK, +{} HP, +{} SPD", fish.getName(), consumable.getName(),
            consumable.getAttackBonus(), consumable.getHealthBonus(), consumable.getSpeedBonus());
    }

    private static Piece requirePiece(Tank tank, String pieceId) throws PieceNotFoundException {
        return tank.findPiece(pieceId)
            .orElseThrow(() -> new PieceNotFoundException(tank.getId(), pieceId));
    }
}

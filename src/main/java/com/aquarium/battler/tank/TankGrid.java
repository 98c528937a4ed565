package com.aquarium.battler.tank;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.Position;

/**
 * Occupancy rules for the fixed 8x6 tank grid.
 */
public final class TankGrid {

    public static final int WIDTH = 8;
    public static final int HEIGHT = 6;

    private TankGrid() {
        // Utility class - prevent instantiation
    }

    public static boolean inBounds(Position cell) {
        return cell.x() >= 0 && cell.x() < WIDTH && cell.y() >= 0 && cell.y() < HEIGHT;
    }

    /**
     * Check whether a piece may sit with its anchor at {@code position}.
     * Every covered cell must be in bounds and either empty or already owned by this piece,
     * so a piece can be validated against a move that overlaps its current cells.
     */
    public static boolean isValidPosition(Tank tank, Piece piece, Position position) {
        for (Position cell : piece.cellsAt(position)) {
            if (!inBounds(cell)) {
                return false;
            }
            String owner = tank.cellAt(cell);
            if (owner != null && !owner.equals(piece.getId())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Stricter check for a piece that is not on the grid yet: every cell must be empty.
     */
    public static boolean isValidPositionForNewPiece(Tank tank, Piece piece, Position position) {
        for (Position cell : piece.cellsAt(position)) {
            if (!inBounds(cell) || tank.cellAt(cell) != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Write the piece id into every cell it covers at its current position.
     */
    public static void place(Tank tank, Piece piece) {
        for (Position cell : piece.getOccupiedCells()) {
            if (inBounds(cell)) {
                tank.setCell(cell, piece.getId());
            }
        }
    }

    /**
     * Clear the cells this piece covers at its current position.
     * Cells owned by another piece are left alone.
     */
    public static void remove(Tank tank, Piece piece) {
        for (Position cell : piece.getOccupiedCells()) {
            if (inBounds(cell) && piece.getId().equals(tank.cellAt(cell))) {
                tank.setCell(cell, null);
            }
        }
    }

    /**
     * First anchor in row-major order where a new piece fits, or null if the tank is full.
     */
    public static Position findFirstValidPosition(Tank tank, Piece piece) {
        for (int y = 0; y < HEIGHT; y++) {
            for (int x = 0; x < WIDTH; x++) {
                Position position = new Position(x, y);
                if (isValidPositionForNewPiece(tank, piece, position)) {
                    return position;
                }
            }
        }
        return null;
    }

    /**
     * Free anchor that would put the piece next to the most placed fish.
     * Full scan in row-major order; the first position with the best count wins,
     * so with no fish around this is the first free position.
     */
    public static Position findBestSupportPosition(Tank tank, Piece piece) {
        Position best = null;
        int bestCount = -1;
        for (int y = 0; y < HEIGHT; y++) {
            for (int x = 0; x < WIDTH; x++) {
                Position position = new Position(x, y);
                if (!isValidPositionForNewPiece(tank, piece, position)) {
                    continue;
                }
                int count = countAdjacentFish(tank, piece, position);
                if (count > bestCount) {
                    bestCount = count;
                    best = position;
                }
            }
        }
        return best;
    }

    /**
     * Number of placed fish that would touch the piece if anchored at {@code position}.
     */
    public static int countAdjacentFish(Tank tank, Piece piece, Position position) {
        var cells = piece.cellsAt(position);
        int count = 0;
        for (Piece other : tank.getPieces()) {
            if (!other.isFish() || !other.isPlaced() || other.getId().equals(piece.getId())) {
                continue;
            }
            if (AdjacencyEngine.cellsTouch(cells, other.getOccupiedCells())) {
                count++;
            }
        }
        return count;
    }
}

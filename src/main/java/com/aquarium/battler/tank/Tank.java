package com.aquarium.battler.tank;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A player's (or the opponent's) grid plus every piece it owns.
 *
 * <p>{@code grid[y][x]} holds the id of the piece covering that cell, or null.
 * Pieces without a position are in inventory. Mutations go through {@link TankGrid}
 * and {@link TankOperations}, which keep the grid, the piece list and the water quality in step.
 */
public class Tank {
    public static final int DEFAULT_BASE_WATER_QUALITY = 5;

    private final String id;
    private final String[][] grid;
    private final List<Piece> pieces;
    private final int baseWaterQuality;
    private int waterQuality;

    /**
     * @throws IllegalArgumentException if {@code baseWaterQuality} is outside
     *         [{@value WaterQuality#MIN}, {@value WaterQuality#MAX}]
     */
    public Tank(String id, int baseWaterQuality) {
        if (baseWaterQuality < WaterQuality.MIN || baseWaterQuality > WaterQuality.MAX) {
            throw new IllegalArgumentException("Base water quality must be between " + WaterQuality.MIN
                + " and " + WaterQuality.MAX + ": " + baseWaterQuality);
        }
        this.id = id;
        this.grid = new String[TankGrid.HEIGHT][TankGrid.WIDTH];
        this.pieces = new ArrayList<>();
        this.baseWaterQuality = baseWaterQuality;
        this.waterQuality = this.baseWaterQuality;
    }

    public Tank(String id) {
        this(id, DEFAULT_BASE_WATER_QUALITY);
    }

    public String getId() {
        return id;
    }

    /**
     * Id of the piece at the given cell, or null if empty.
     */
    public String cellAt(int x, int y) {
        return grid[y][x];
    }

    public String cellAt(Position cell) {
        return cellAt(cell.x(), cell.y());
    }

    void setCell(Position cell, String pieceId) {
        grid[cell.y()][cell.x()] = pieceId;
    }

    /**
     * Copy of the grid rows, for snapshots and equality checks.
     */
    public String[][] gridSnapshot() {
        String[][] copy = new String[TankGrid.HEIGHT][];
        for (int y = 0; y < TankGrid.HEIGHT; y++) {
            copy[y] = grid[y].clone();
        }
        return copy;
    }

    /**
     * Direct access to the owned pieces (for mutation).
     */
    public List<Piece> getPieces() {
        return pieces;
    }

    /**
     * Pieces currently on the grid.
     */
    public List<Piece> getPlacedPieces() {
        List<Piece> placed = new ArrayList<>(pieces.size());
        for (Piece piece : pieces) {
            if (piece.isPlaced()) {
                placed.add(piece);
            }
        }
        return placed;
    }

    public Optional<Piece> findPiece(String pieceId) {
        for (Piece piece : pieces) {
            if (piece.getId().equals(pieceId)) {
                return Optional.of(piece);
            }
        }
        return Optional.empty();
    }

    public int getWaterQuality() {
        return waterQuality;
    }

    void setWaterQuality(int waterQuality) {
        this.waterQuality = WaterQuality.clamp(waterQuality);
    }

    public int getBaseWaterQuality() {
        return baseWaterQuality;
    }

    public int size() {
        return pieces.size();
    }
}

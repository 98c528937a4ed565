package com.aquarium.battler.tank;

import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceFixtures;
import com.aquarium.battler.piece.Position;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TankGrid occupancy rules.
 */
class TankGridTest {

    private static final List<List<Position>> SHAPES = List.of(
        List.of(Position.ORIGIN),
        List.of(Position.ORIGIN, new Position(1, 0)),
        List.of(Position.ORIGIN, new Position(0, 1)),
        List.of(Position.ORIGIN, new Position(1, 0), new Position(0, 1), new Position(1, 1)),
        List.of(Position.ORIGIN, new Position(2, 0))
    );

    private static Piece shaped(List<Position> shape) {
        return PieceFixtures.fish("Shape", 1, 1, 1, shape);
    }

    @Test
    void testValidityMatchesBoundsAndCollisions() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        Piece blocker = shaped(SHAPES.get(3));
        TankOperations.placeNewPiece(tank, blocker, new Position(3, 2));

        for (List<Position> shape : SHAPES) {
            Piece piece = shaped(shape);
            for (int y = -2; y < TankGrid.HEIGHT + 2; y++) {
                for (int x = -2; x < TankGrid.WIDTH + 2; x++) {
                    Position anchor = new Position(x, y);
                    boolean expected = true;
                    for (Position cell : piece.cellsAt(anchor)) {
                        boolean outside = cell.x() < 0 || cell.x() >= 8 || cell.y() < 0 || cell.y() >= 6;
                        boolean collides = !outside && blocker.getOccupiedCells().contains(cell);
                        if (outside || collides) {
                            expected = false;
                        }
                    }
                    assertEquals(expected, TankGrid.isValidPosition(tank, piece, anchor),
                        "Shape " + shape + " at " + anchor);
                }
            }
        }
    }

    @Test
    void testOwnCellsDoNotBlockMove() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        Piece pleco = shaped(SHAPES.get(1));
        TankOperations.placeNewPiece(tank, pleco, new Position(0, 0));

        assertTrue(TankGrid.isValidPosition(tank, pleco, new Position(1, 0)));
        assertFalse(TankGrid.isValidPositionForNewPiece(tank, pleco, new Position(1, 0)));
    }

    @Test
    void testPlaceThenRemoveRestoresGrid() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        TankOperations.placeNewPiece(tank, shaped(SHAPES.get(0)), new Position(0, 0));
        TankOperations.placeNewPiece(tank, shaped(SHAPES.get(2)), new Position(6, 4));
        String[][] before = tank.gridSnapshot();

        for (List<Position> shape : SHAPES) {
            Piece piece = shaped(shape);
            piece.setPosition(new Position(2, 1));
            TankGrid.place(tank, piece);
            assertFalse(Arrays.deepEquals(before, tank.gridSnapshot()));
            TankGrid.remove(tank, piece);
            assertTrue(Arrays.deepEquals(before, tank.gridSnapshot()), "Grid restored after " + shape);
        }
    }

    @Test
    void testRemoveLeavesOtherPiecesAlone() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        Piece a = shaped(SHAPES.get(0));
        TankOperations.placeNewPiece(tank, a, new Position(0, 0));

        Piece ghost = shaped(SHAPES.get(0));
        ghost.setPosition(new Position(0, 0));
        TankGrid.remove(tank, ghost);

        assertEquals(a.getId(), tank.cellAt(0, 0));
    }

    @Test
    void testFindFirstValidPositionIsRowMajor() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        Piece small = shaped(SHAPES.get(0));
        assertEquals(new Position(0, 0), TankGrid.findFirstValidPosition(tank, small));

        TankOperations.placeNewPiece(tank, shaped(SHAPES.get(3)), new Position(0, 0));
        assertEquals(new Position(2, 0), TankGrid.findFirstValidPosition(tank, small));

        Piece wide = shaped(SHAPES.get(4));
        assertEquals(new Position(2, 0), TankGrid.findFirstValidPosition(tank, wide));
    }

    @Test
    void testFindFirstValidPositionOnFullTank() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        for (int y = 0; y < TankGrid.HEIGHT; y++) {
            for (int x = 0; x < TankGrid.WIDTH; x++) {
                TankOperations.placeNewPiece(tank, shaped(SHAPES.get(0)), new Position(x, y));
            }
        }
        assertNull(TankGrid.findFirstValidPosition(tank, shaped(SHAPES.get(0))));
        assertNull(TankGrid.findBestSupportPosition(tank, shaped(SHAPES.get(0))));
    }

    @Test
    void testBestSupportPositionTouchesMostFish() throws InvalidPlacementException {
        Tank tank = new Tank("t");
        TankOperations.placeNewPiece(tank, PieceFixtures.fish("A", 1, 1, 1), new Position(3, 3));
        TankOperations.placeNewPiece(tank, PieceFixtures.fish("B", 1, 1, 1), new Position(5, 3));

        Piece plant = PieceFixtures.plant("Fern", 1, 1, 0);
        Position best = TankGrid.findBestSupportPosition(tank, plant);

        assertEquals(new Position(4, 2), best, "First cell touching both fish in row-major order");
        assertEquals(2, TankGrid.countAdjacentFish(tank, plant, best));
    }

    @Test
    void testBestSupportPositionWithoutFish() {
        Tank tank = new Tank("t");
        assertEquals(new Position(0, 0), TankGrid.findBestSupportPosition(tank, PieceFixtures.filter()));
    }
}

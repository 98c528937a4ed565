package com.aquarium.battler.piece;

/**
 * Exception thrown by PieceCatalog operations.
 */
public class PieceCatalogException extends Exception {
    public PieceCatalogException(String message) {
        super(message);
    }

    public PieceCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}

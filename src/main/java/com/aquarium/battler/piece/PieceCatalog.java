package com.aquarium.battler.piece;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only piece catalog loaded from JSON.
 *
 * <p>Entries are kept in file order so that index-based random draws are stable for a given seed.
 * Templates never leave the catalog: every lookup hands out a deep copy.
 */
public class PieceCatalog {
    private static final Logger log = LoggerFactory.getLogger(PieceCatalog.class);

    public static final String DEFAULT_RESOURCE = "pieces.json";

    private final Map<String, Piece> pieces;

    private PieceCatalog(Map<String, Piece> pieces) {
        this.pieces = pieces;
    }

    /**
     * Load the catalog bundled with the application.
     */
    public static PieceCatalog loadDefault() throws PieceCatalogException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load pieces from a JSON file.
     */
    public static PieceCatalog fromFile(String path) throws PieceCatalogException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new PieceCatalogException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load pieces from a classpath resource.
     */
    public static PieceCatalog fromResource(String resourcePath) throws PieceCatalogException {
        try (InputStream is = PieceCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new PieceCatalogException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = new ObjectMapper();
            List<Piece> pieceList = mapper.readValue(is, new TypeReference<List<Piece>>() {});
            return fromPieceList(pieceList);
        } catch (IOException e) {
            throw new PieceCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load pieces from a JSON string.
     */
    public static PieceCatalog fromJson(String json) throws PieceCatalogException {
        try {
            ObjectMapper mapper = new ObjectMapper();
            List<Piece> pieceList = mapper.readValue(json, new TypeReference<List<Piece>>() {});
            return fromPieceList(pieceList);
        } catch (IOException e) {
            throw new PieceCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Build a catalog from templates already in memory.
     */
    public static PieceCatalog of(List<Piece> templates) throws PieceCatalogException {
        return fromPieceList(templates);
    }

    private static PieceCatalog fromPieceList(List<Piece> pieceList) throws PieceCatalogException {
        Map<String, Piece> pieces = new LinkedHashMap<>();
        for (Piece piece : pieceList) {
            validate(piece);
            if (pieces.put(piece.getName(), copyOf(piece)) != null) {
                throw new PieceCatalogException("Duplicate piece: " + piece.getName());
            }
        }
        log.debug("Loaded {} catalog pieces", pieces.size());
        return new PieceCatalog(pieces);
    }

    private static void validate(Piece piece) throws PieceCatalogException {
        if (piece.getName() == null || piece.getName().isBlank()) {
            throw new PieceCatalogException("Piece without a name");
        }
        if (piece.getCategory() == null) {
            throw new PieceCatalogException("Piece without a category: " + piece.getName());
        }
        if (piece.getShape() == null || !piece.getShape().contains(Position.ORIGIN)) {
            throw new PieceCatalogException("Shape must contain the (0,0) anchor: " + piece.getName());
        }
        if (piece.getStats() == null) {
            throw new PieceCatalogException("Piece without stats: " + piece.getName());
        }
    }

    /**
     * Get a copy of a template by name.
     * @throws PieceCatalogException if the piece is not found
     */
    public Piece getPiece(String name) throws PieceCatalogException {
        return copyOf(template(name));
    }

    /**
     * Create a new owned piece from a catalog entry.
     */
    public Piece acquire(String name) throws PieceCatalogException {
        return instantiate(template(name));
    }

    private Piece template(String name) throws PieceCatalogException {
        Piece piece = pieces.get(name);
        if (piece == null) {
            throw new PieceCatalogException("Piece not found: " + name);
        }
        return piece;
    }

    private static Piece copyOf(Piece template) {
        return template.copyWithId(template.getId());
    }

    /**
     * Deep copy of a template with a freshly generated id, not yet placed.
     */
    public static Piece instantiate(Piece template) {
        Piece piece = template.copyWithId(UUID.randomUUID().toString());
        piece.setPosition(null);
        return piece;
    }

    /**
     * Copies of all templates costing at most {@code maxCost}, in catalog order.
     */
    public List<Piece> affordable(int maxCost) {
        List<Piece> result = new ArrayList<>();
        for (Piece piece : pieces.values()) {
            if (piece.getCost() <= maxCost) {
                result.add(copyOf(piece));
            }
        }
        return result;
    }

    public List<Piece> getAll() {
        List<Piece> result = new ArrayList<>(pieces.size());
        for (Piece piece : pieces.values()) {
            result.add(copyOf(piece));
        }
        return Collections.unmodifiableList(result);
    }

    public int pieceCount() {
        return pieces.size();
    }

    public boolean hasPiece(String name) {
        return pieces.containsKey(name);
    }
}

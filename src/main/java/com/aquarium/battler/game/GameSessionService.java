package com.aquarium.battler.game;

import com.aquarium.battler.ai.AcquisitionResult;
import com.aquarium.battler.ai.OpponentAI;
import com.aquarium.battler.battle.BattleEvent;
import com.aquarium.battler.battle.BattleNotActiveException;
import com.aquarium.battler.battle.BattleState;
import com.aquarium.battler.battle.CombatResolver;
import com.aquarium.battler.battle.Side;
import com.aquarium.battler.piece.Piece;
import com.aquarium.battler.piece.PieceCatalog;
import com.aquarium.battler.piece.PieceCatalogException;
import com.aquarium.battler.piece.Position;
import com.aquarium.battler.rng.GameRng;
import com.aquarium.battler.rng.RandomSource;
import com.aquarium.battler.tank.AdjacencyEngine;
import com.aquarium.battler.tank.BuffedStats;
import com.aquarium.battler.tank.InvalidPlacementException;
import com.aquarium.battler.tank.PieceNotFoundException;
import com.aquarium.battler.tank.Tank;
import com.aquarium.battler.tank.TankOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives game sessions through shop, battle and results.
 *
 * <p>Every action checks the session's phase before touching any state. The service holds no
 * per-session state of its own; everything lives in the {@link SessionStore}. Callers must not
 * run two actions on the same session at once.
 */
public class GameSessionService {
    private static final Logger log = LoggerFactory.getLogger(GameSessionService.class);

    private final SessionStore store;
    private final PieceCatalog catalog;
    private final int baseWaterQuality;

    public GameSessionService(SessionStore store, PieceCatalog catalog) {
        this(store, catalog, Tank.DEFAULT_BASE_WATER_QUALITY);
    }

    public GameSessionService(SessionStore store, PieceCatalog catalog, int baseWaterQuality) {
        this.store = store;
        this.catalog = catalog;
        this.baseWaterQuality = baseWaterQuality;
    }

    // ==================== Sessions ====================

    public GameSession createSession(String sessionId) throws DuplicateSessionException {
        return createSession(sessionId, new GameRng());
    }

    /**
     * Open a new session in the shop phase of round 1.
     *
     * @throws DuplicateSessionException if the id belongs to a live session, which is left untouched
     */
    public GameSession createSession(String sessionId, RandomSource rng) throws DuplicateSessionException {
        GameSession session = new GameSession(
            sessionId,
            new Tank(sessionId + "-player", baseWaterQuality),
            new Tank(sessionId + "-opponent", baseWaterQuality),
            rng
        );
        if (!store.insert(session)) {
            throw new DuplicateSessionException(sessionId);
        }
        log.debug("Session {} created", sessionId);
        return session;
    }

    public GameSession getSession(String sessionId) throws SessionNotFoundException {
        return store.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public boolean endSession(String sessionId) {
        boolean removed = store.remove(sessionId);
        if (removed) {
            log.debug("Session {} ended", sessionId);
        }
        return removed;
    }

    // ==================== Shop phase ====================

    /**
     * Add a fresh copy of a catalog piece to the player's inventory.
     */
    public Piece acquirePiece(String sessionId, String pieceName)
            throws SessionNotFoundException, PhaseViolationException, PieceCatalogException {
        GameSession session = requirePhase(sessionId, "acquire pieces", GamePhase.SHOP);
        Piece piece = catalog.acquire(pieceName);
        TankOperations.addToInventory(session.getPlayerTank(), piece);
        return piece;
    }

    public Piece placePiece(String sessionId, String pieceId, Position position)
            throws SessionNotFoundException, PhaseViolationException, PieceNotFoundException, InvalidPlacementException {
        GameSession session = requirePhase(sessionId, "place pieces", GamePhase.SHOP);
        return TankOperations.placePiece(session.getPlayerTank(), pieceId, position);
    }

    public Piece movePiece(String sessionId, String pieceId, Position position)
            throws SessionNotFoundException, PhaseViolationException, PieceNotFoundException, InvalidPlacementException {
        GameSession session = requirePhase(sessionId, "move pieces", GamePhase.SHOP);
        return TankOperations.movePiece(session.getPlayerTank(), pieceId, position);
    }

    /**
     * Take a piece off the grid and back into inventory.
     */
    public Piece removePiece(String sessionId, String pieceId)
            throws SessionNotFoundException, PhaseViolationException, PieceNotFoundException {
        GameSession session = requirePhase(sessionId, "remove pieces", GamePhase.SHOP);
        return TankOperations.removePiece(session.getPlayerTank(), pieceId);
    }

    /**
     * Delete a piece from the player's tank. Any refund is the caller's business.
     *
     * @return the deleted piece, so the caller can price it
     */
    public Piece sellPiece(String sessionId, String pieceId)
            throws SessionNotFoundException, PhaseViolationException, PieceNotFoundException {
        GameSession session = requirePhase(sessionId, "sell pieces", GamePhase.SHOP);
        Piece sold = TankOperations.deletePiece(session.getPlayerTank(), pieceId);
        log.debug("Session {} sold {}", sessionId, sold.getName());
        return sold;
    }

    /**
     * Lock in the current layout: placed consumables are eaten by the fish next to them.
     *
     * @return the consumables that were used up
     */
    public List<Piece> confirmPlacement(String sessionId)
            throws SessionNotFoundException, PhaseViolationException {
        GameSession session = requirePhase(sessionId, "confirm placement", GamePhase.SHOP);
        return TankOperations.processConsumables(session.getPlayerTank());
    }

    /**
     * Buffed stats of every placed player piece, keyed by piece id.
     * Uses the same adjacency rules as battle, so previews match what will fight.
     */
    public Map<String, BuffedStats> previewStats(String sessionId) throws SessionNotFoundException {
        GameSession session = getSession(sessionId);
        List<Piece> placed = session.getPlayerTank().getPlacedPieces();
        Map<String, BuffedStats> stats = new LinkedHashMap<>();
        for (Piece piece : placed) {
            stats.put(piece.getId(), AdjacencyEngine.computeBuffedStats(piece, placed));
        }
        return stats;
    }

    /**
     * Give the opponent gold for its next shopping pass.
     */
    public void grantOpponentGold(String sessionId, int amount) throws SessionNotFoundException {
        if (amount < 0) {
            throw new IllegalArgumentException("Gold grant must not be negative: " + amount);
        }
        GameSession session = getSession(sessionId);
        session.setOpponentGold(session.getOpponentGold() + amount);
    }

    /**
     * Let the opponent AI shop for the player's tank. Used for autoplay and simulations.
     */
    public AcquisitionResult autoBuildPlayerTank(String sessionId, int gold)
            throws SessionNotFoundException, PhaseViolationException {
        GameSession session = requirePhase(sessionId, "build the tank", GamePhase.SHOP);
        return OpponentAI.generateAcquisitions(session.getPlayerTank(), catalog, gold, session.getRound(),
            session.getLossStreak(), session.getWinStreak(), session.getRng());
    }

    // ==================== Battle phase ====================

    /**
     * Let the opponent shop, settle consumables on both sides and start the battle.
     */
    public BattleState startBattle(String sessionId)
            throws SessionNotFoundException, PhaseViolationException {
        GameSession session = requirePhase(sessionId, "start a battle", GamePhase.SHOP);

        AcquisitionResult opponentShopping = OpponentAI.generateAcquisitions(
            session.getOpponentTank(), catalog, session.getOpponentGold(), session.getRound(),
            session.getOpponentLossStreak(), session.getOpponentWinStreak(), session.getRng());
        session.setOpponentGold(opponentShopping.remainingGold());

        TankOperations.processConsumables(session.getPlayerTank());
        TankOperations.processConsumables(session.getOpponentTank());

        BattleState battle = CombatResolver.initializeBattle(
            session.getPlayerTank(), session.getOpponentTank(), session.getRng(), session.getRound());
        session.setBattle(battle);
        session.setPhase(GamePhase.BATTLE);
        log.debug("Session {} round {}: battle started (opponent bought {})",
            sessionId, session.getRound(), opponentShopping.bought());
        return battle;
    }

    /**
     * Run the next battle turn. Moves the session to RESULTS once the battle is decided.
     */
    public List<BattleEvent> advanceBattle(String sessionId)
            throws SessionNotFoundException, PhaseViolationException, BattleNotActiveException {
        GameSession session = requirePhase(sessionId, "advance the battle", GamePhase.BATTLE);
        BattleState battle = session.getBattle();
        List<BattleEvent> events = CombatResolver.advanceTurn(battle);
        if (battle.isFinished()) {
            session.setPhase(GamePhase.RESULTS);
            log.debug("Session {} round {}: battle over after {} turns, {}",
                sessionId, session.getRound(), battle.getCurrentTurn(), battle.getStatus());
        }
        return events;
    }

    /**
     * Record the battle result, update streaks and open the next round's shop.
     *
     * @return the winning side, or null for a draw
     */
    public Side finishBattle(String sessionId)
            throws SessionNotFoundException, PhaseViolationException {
        GameSession session = requirePhase(sessionId, "finish the battle", GamePhase.RESULTS);
        Side winner = session.getBattle().getWinner();
        session.recordOutcome(winner);
        session.setBattle(null);
        session.advanceRound();
        session.setPhase(GamePhase.SHOP);
        log.debug("Session {} now in round {} ({}W/{}L/{}D)", sessionId, session.getRound(),
            session.getWins(), session.getLosses(), session.getDraws());
        return winner;
    }

    private GameSession requirePhase(String sessionId, String action, GamePhase required)
            throws SessionNotFoundException, PhaseViolationException {
        GameSession session = getSession(sessionId);
        if (session.getPhase() != required) {
            throw new PhaseViolationException(action, required, session.getPhase());
        }
        return session;
    }

    public PieceCatalog getCatalog() {
        return catalog;
    }
}

package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.config.SessionConfig;
import io.github.manjago.snakeescape.core.Board;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.Snake;
import io.github.manjago.snakeescape.core.SnakeEnd;
import io.github.manjago.snakeescape.level.LevelData;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One play session of a level.
 *
 * Owns the live state and the resolver/refresher pair, takes move requests
 * one at a time, and republishes the buffered events to listeners after each
 * request completes. Listeners run synchronously; requesting a move or reload
 * from inside a listener is a programming error.
 */
public class GameSession {

    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    private final LevelData level;
    private final SessionConfig config;
    private final EventBuffer events = new EventBuffer();
    private final List<SessionListener> listeners = new ArrayList<>();

    private LevelState state;
    private MoveResolver resolver;
    private boolean dispatching;

    // Statistics
    private int movesAccepted = 0;
    private int movesRejected = 0;
    private final Map<MoveResult, Integer> rejectionsByReason = new EnumMap<>(MoveResult.class);
    private int fruitsEaten = 0;
    private int snakesExited = 0;
    private int snakesRemoved = 0;
    private int holesFilled = 0;
    private int objectsDestroyed = 0;

    public GameSession(LevelData level, SessionConfig config) {
        this.level = level;
        this.config = config;
    }

    public GameSession(LevelData level) {
        this(level, SessionConfig.defaults());
    }

    // ========== Lifecycle ==========

    /**
     * Build the board from the level data and publish the initial state.
     *
     * @throws IllegalArgumentException if the level data is inconsistent
     */
    public void start() {
        checkNotDispatching("start");
        load();
    }

    /**
     * Throw the current board away and rebuild it from the same level data.
     */
    public void reloadLevel() {
        checkNotDispatching("reloadLevel");
        log.info("Reloading level '{}'", level.name());
        load();
    }

    private void load() {
        events.drain();
        resetStats();

        state = LevelState.fromLevel(level);
        HazardResolver hazards = new HazardResolver(state, events);
        StateRefresher refresher = new StateRefresher(state, hazards, events, config.refreshPassLimit());
        resolver = new MoveResolver(state, config, hazards, refresher, events);

        events.add(new GameEvent.LevelLoaded(level.name(), level.width(), level.height()));
        refresher.refresh();

        log.info("Level '{}' loaded: {}x{}, {} snakes", level.name(), level.width(), level.height(),
                state.getSnakes().size());
        dispatch();
    }

    public boolean isStarted() {
        return state != null;
    }

    // ========== Moves ==========

    /**
     * Validate and execute a move.
     *
     * @return ACCEPTED, or why the move was refused
     * @throws IllegalStateException if the session is not started, or if called from a listener
     */
    public MoveResult requestMove(MoveRequest request) {
        checkNotDispatching("requestMove");
        if (state == null) {
            throw new IllegalStateException("Session not started");
        }

        MoveResult result = resolver.resolve(request);
        if (result.isRejection()) {
            movesRejected++;
            rejectionsByReason.merge(result, 1, Integer::sum);
            notifyRejected(request, result);
        } else {
            movesAccepted++;
        }
        dispatch();
        return result;
    }

    public MoveResult requestMove(int snakeId, SnakeEnd end, Cell target) {
        return requestMove(new MoveRequest(snakeId, end, target));
    }

    /**
     * Presentation busy flag: while set, moves of that snake are refused.
     */
    public void setAnimating(int snakeId, boolean busy) {
        requireState().setAnimating(snakeId, busy);
    }

    /**
     * Which snake end, if any, sits on a cell. Heads win over tails.
     */
    @Nullable
    public SnakePick snakeAt(Cell cell) {
        for (Snake snake : requireState().getSnakes()) {
            if (snake.getHead().equals(cell)) {
                return new SnakePick(snake.getId(), SnakeEnd.HEAD);
            }
        }
        for (Snake snake : requireState().getSnakes()) {
            if (snake.getTail().equals(cell)) {
                return new SnakePick(snake.getId(), SnakeEnd.TAIL);
            }
        }
        return null;
    }

    // ========== Listeners ==========

    public void addListener(SessionListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    private void dispatch() {
        List<GameEvent> batch = events.drain();
        dispatching = true;
        try {
            for (GameEvent event : batch) {
                count(event);
                for (SessionListener listener : List.copyOf(listeners)) {
                    listener.onEvent(event);
                }
            }
        } finally {
            dispatching = false;
        }
    }

    private void notifyRejected(MoveRequest request, MoveResult reason) {
        dispatching = true;
        try {
            for (SessionListener listener : List.copyOf(listeners)) {
                listener.onMoveRejected(request, reason);
            }
        } finally {
            dispatching = false;
        }
    }

    private void checkNotDispatching(String operation) {
        if (dispatching) {
            throw new IllegalStateException(operation + " called while events are being dispatched");
        }
    }

    // ========== Statistics ==========

    private void count(GameEvent event) {
        if (event instanceof GameEvent.FruitConsumed) {
            fruitsEaten++;
        } else if (event instanceof GameEvent.ExitConsumed) {
            snakesExited++;
        } else if (event instanceof GameEvent.SnakeRemoved) {
            snakesRemoved++;
        } else if (event instanceof GameEvent.HoleFilled) {
            holesFilled++;
        } else if (event instanceof GameEvent.EntityDestroyed) {
            objectsDestroyed++;
        }
    }

    private void resetStats() {
        movesAccepted = 0;
        movesRejected = 0;
        rejectionsByReason.clear();
        fruitsEaten = 0;
        snakesExited = 0;
        snakesRemoved = 0;
        holesFilled = 0;
        objectsDestroyed = 0;
    }

    public SessionStats getStats() {
        return new SessionStats(
            movesAccepted,
            movesRejected,
            rejectionsByReason,
            fruitsEaten,
            snakesExited,
            snakesRemoved - snakesExited,
            holesFilled,
            objectsDestroyed,
            state != null ? state.getSnakes().size() : 0,
            isWon()
        );
    }

    // ========== Getters ==========

    private LevelState requireState() {
        if (state == null) {
            throw new IllegalStateException("Session not started");
        }
        return state;
    }

    public LevelState getState() {
        return requireState();
    }

    public Board getBoard() {
        return requireState().getBoard();
    }

    public List<Snake> getSnakes() {
        return requireState().getSnakes();
    }

    public MoveResolver getResolver() {
        requireState();
        return resolver;
    }

    public boolean isWon() {
        return state != null && state.isWon();
    }

    public LevelData getLevel() {
        return level;
    }

    public SessionConfig getConfig() {
        return config;
    }
}

package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.config.SessionConfig;
import io.github.manjago.snakeescape.core.Board;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.Entity;
import io.github.manjago.snakeescape.core.EntityKind;
import io.github.manjago.snakeescape.core.EntryHandler;
import io.github.manjago.snakeescape.core.Exit;
import io.github.manjago.snakeescape.core.Fruit;
import io.github.manjago.snakeescape.core.LaserGate;
import io.github.manjago.snakeescape.core.Portal;
import io.github.manjago.snakeescape.core.Pushable;
import io.github.manjago.snakeescape.core.Snake;
import io.github.manjago.snakeescape.core.SnakeColor;
import io.github.manjago.snakeescape.core.SnakeEnd;
import io.github.manjago.snakeescape.sim.PushProtocol.PushPlan;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a move is legal and, if so, executes it with every cascade:
 * push or slide, teleport, fruit, exit, laser contact, then a state refresh.
 *
 * <p>States: {@code IDLE -> VALIDATING -> (rejected | EXECUTING) -> IDLE}.
 * Validation is computed completely before the first mutation, so a rejected
 * move never leaves a trace on the board.
 *
 * <p>Validation order, first failure wins:
 * <ol>
 *   <li>snake lookup, busy flag</li>
 *   <li>end eligibility (only the reversible color moves its tail)</li>
 *   <li>wrapping, adjacency</li>
 *   <li>snake collision (a tail may step onto its own head)</li>
 *   <li>walls and closed lift gates</li>
 *   <li>boxes and ice cubes (push or slide, heads only)</li>
 *   <li>holes</li>
 *   <li>portals (the linked cell must accept the mover)</li>
 *   <li>the target entities' own entry rules</li>
 * </ol>
 */
public class MoveResolver {

    private static final Logger log = LoggerFactory.getLogger(MoveResolver.class);

    enum Phase { IDLE, VALIDATING, EXECUTING }

    /**
     * A validated move, ready to execute.
     *
     * @param finalCell where the moving end ends up (the partner cell after a teleport)
     * @param push displacement of the object in front of the head, or null
     */
    record MovePlan(Snake snake, SnakeEnd end, Cell target, Cell finalCell, @Nullable PushPlan push) {}

    private record Validation(MoveResult result, @Nullable MovePlan plan) {
        static Validation reject(MoveResult result) {
            return new Validation(result, null);
        }
    }

    private final LevelState state;
    private final SessionConfig config;
    private final PushProtocol pushProtocol;
    private final HazardResolver hazards;
    private final StateRefresher refresher;
    private final EventBuffer events;
    private final EntryHandler entryHandler;

    private Phase phase = Phase.IDLE;

    public MoveResolver(LevelState state, SessionConfig config, HazardResolver hazards,
                        StateRefresher refresher, EventBuffer events) {
        this.state = state;
        this.config = config;
        this.pushProtocol = new PushProtocol(state, config.slideStepLimit());
        this.hazards = hazards;
        this.refresher = refresher;
        this.events = events;
        this.entryHandler = createEntryHandler();
    }

    /**
     * Validate a move and execute it if legal.
     *
     * @return ACCEPTED, or the first rejection reason
     * @throws IllegalStateException if called while another move is being resolved
     */
    public MoveResult resolve(MoveRequest request) {
        if (phase != Phase.IDLE) {
            throw new IllegalStateException("Move requested while resolver is " + phase + ": " + request);
        }
        try {
            phase = Phase.VALIDATING;
            Validation validation = validate(request);
            if (validation.plan() == null) {
                log.debug("{} rejected: {}", request, validation.result());
                return validation.result();
            }

            phase = Phase.EXECUTING;
            execute(validation.plan());
            log.debug("{} accepted, end now at {}", request, validation.plan().finalCell());
            return MoveResult.ACCEPTED;
        } finally {
            phase = Phase.IDLE;
        }
    }

    /**
     * Dry run: what {@link #resolve} would answer, without executing anything.
     */
    public MoveResult check(MoveRequest request) {
        return validate(request).result();
    }

    public PushProtocol getPushProtocol() {
        return pushProtocol;
    }

    Phase getPhase() {
        return phase;
    }

    // ========== Validation ==========

    private Validation validate(MoveRequest request) {
        Snake snake = state.findSnake(request.snakeId());
        if (snake == null) {
            return Validation.reject(MoveResult.UNKNOWN_SNAKE);
        }
        if (state.isAnimating(snake.getId())) {
            return Validation.reject(MoveResult.ANIMATION_IN_PROGRESS);
        }

        SnakeEnd end = request.end();
        if (end == SnakeEnd.TAIL && snake.getColor() != config.reversibleColor()) {
            return Validation.reject(MoveResult.ILLEGAL_END);
        }

        Board board = state.getBoard();
        Cell from = snake.getEnd(end);
        boolean wraps = snake.getColor() == config.wrappingColor();
        Cell target = wraps ? board.wrap(request.target()) : request.target();

        if (!isAdjacent(from, target, wraps)) {
            return Validation.reject(MoveResult.NOT_ADJACENT);
        }

        Snake occupant = state.snakeOccupying(target);
        if (occupant != null) {
            boolean tailOntoOwnHead = end == SnakeEnd.TAIL && occupant == snake && target.equals(snake.getHead());
            if (!tailOntoOwnHead) {
                return Validation.reject(MoveResult.OBSTRUCTED);
            }
        }

        List<Entity> entities = board.get(target);
        for (Entity entity : entities) {
            if (LevelState.blocksSnakes(entity)) {
                return Validation.reject(MoveResult.OBSTRUCTED);
            }
        }

        PushPlan push = null;
        Pushable pushable = firstPushable(target);
        if (pushable != null) {
            if (end == SnakeEnd.TAIL) {
                return Validation.reject(MoveResult.OBSTRUCTED);
            }
            push = pushProtocol.plan(pushable, pushDirection(from, target, wraps));
            if (push == null) {
                return Validation.reject(MoveResult.OBSTRUCTED);
            }
        }

        if (board.hasKind(target, EntityKind.HOLE)) {
            return Validation.reject(MoveResult.OBSTRUCTED);
        }

        Cell finalCell = target;
        Portal portal = board.firstOfKind(target, Portal.class);
        if (portal != null && portal.isLinked() && pushable == null) {
            if (!portal.isActive()) {
                return Validation.reject(MoveResult.OBSTRUCTED);
            }
            Cell destination = portal.getDestination();
            MoveResult arrival = checkArrival(snake, end, destination);
            if (arrival.isRejection()) {
                return Validation.reject(arrival);
            }
            finalCell = destination;
        } else {
            for (Entity entity : entities) {
                if (!(entity instanceof Pushable) && !entity.canEnter(snake, end)) {
                    return Validation.reject(MoveResult.INTERACTION_DENIED);
                }
            }
        }

        return new Validation(MoveResult.ACCEPTED, new MovePlan(snake, end, target, finalCell, push));
    }

    /**
     * Full validity of the cell a portal delivers to: the same obstruction rules
     * as an ordinary step, then the entry rules of whatever sits there.
     */
    private MoveResult checkArrival(Snake snake, SnakeEnd end, Cell destination) {
        Board board = state.getBoard();
        if (state.snakeOccupying(destination) != null) {
            return MoveResult.OBSTRUCTED;
        }
        List<Entity> entities = board.get(destination);
        for (Entity entity : entities) {
            if (LevelState.blocksSnakes(entity) || entity instanceof Pushable
                    || entity.getKind() == EntityKind.HOLE) {
                return MoveResult.OBSTRUCTED;
            }
        }
        for (Entity entity : entities) {
            if (!entity.canEnter(snake, end)) {
                return MoveResult.INTERACTION_DENIED;
            }
        }
        return MoveResult.ACCEPTED;
    }

    private boolean isAdjacent(Cell from, Cell target, boolean wraps) {
        if (!wraps) {
            return from.manhattan(target) == 1;
        }
        Board board = state.getBoard();
        int dx = Math.abs(target.x() - from.x());
        int dy = Math.abs(target.y() - from.y());
        dx = Math.min(dx, board.getWidth() - dx);
        dy = Math.min(dy, board.getHeight() - dy);
        return dx + dy == 1;
    }

    /**
     * Unit vector from the moving end toward the target. For the wrapping color the
     * target is already wrapped, so a jump across the board edge means one step the
     * other way.
     */
    static Cell pushDirection(Cell from, Cell target, boolean wraps) {
        int dx = target.x() - from.x();
        int dy = target.y() - from.y();
        if (wraps) {
            if (Math.abs(dx) > 1) {
                dx = dx > 0 ? -1 : 1;
            }
            if (Math.abs(dy) > 1) {
                dy = dy > 0 ? -1 : 1;
            }
        }
        return Cell.of(Integer.signum(dx), Integer.signum(dy));
    }

    @Nullable
    private Pushable firstPushable(Cell cell) {
        return state.getBoard().firstOfKind(cell, Pushable.class);
    }

    // ========== Execution ==========

    private void execute(MovePlan plan) {
        Snake snake = plan.snake();
        SnakeEnd end = plan.end();
        Cell target = plan.target();
        Cell finalCell = plan.finalCell();

        if (plan.push() != null) {
            hazards.relocate(plan.push());
            finalCell = teleportAfterPush(snake, end, target);
        }

        boolean grow = false;
        if (end == SnakeEnd.HEAD) {
            Fruit fruit = state.getBoard().firstOfKind(finalCell, Fruit.class);
            grow = fruit != null && fruit.canEnter(snake, end);
            snake.advanceHead(target, grow);
        } else {
            snake.advanceTail(target);
        }
        if (!finalCell.equals(target)) {
            snake.relocateEnd(end, finalCell);
            log.debug("{} {} teleported {} -> {}", snake, end, target, finalCell);
        }
        events.add(grow ? new GameEvent.SnakeGrew(snake.getId()) : new GameEvent.SnakeMoved(snake.getId()));

        for (Entity entity : new ArrayList<>(state.getBoard().get(finalCell))) {
            if (!snake.isInPlay()) {
                break;
            }
            if (state.getBoard().getStore().isLive(entity.getId())) {
                entity.onEntered(snake, end, entryHandler);
            }
        }

        refresher.refresh();
    }

    /**
     * The pushed object has moved out of the target cell, so a portal under it is
     * now reachable. Teleport only if the far side accepts the snake right now.
     */
    private Cell teleportAfterPush(Snake snake, SnakeEnd end, Cell target) {
        Portal portal = state.getBoard().firstOfKind(target, Portal.class);
        if (portal == null || !portal.isLinked()) {
            return target;
        }
        Cell destination = portal.getDestination();
        if (!state.isFreeForObject(destination, null)
                || checkArrival(snake, end, destination).isRejection()) {
            return target;
        }
        return destination;
    }

    /**
     * Consequences of entering a cell, applied to the live collections.
     */
    private EntryHandler createEntryHandler() {
        return new EntryHandler() {
            @Override
            public void fruitEaten(Fruit fruit, Snake snake) {
                state.getBoard().destroy(fruit, List.of(fruit.getPosition()));
                events.add(new GameEvent.FruitConsumed(fruit.getPosition()));
                log.debug("{} ate {}", snake, fruit);
            }

            @Override
            public void snakeExited(Snake snake, Exit exit) {
                Board board = state.getBoard();
                board.destroy(exit, List.of(exit.getPosition()));
                events.add(new GameEvent.ExitConsumed(exit.getPosition()));
                hazards.removeSnake(snake);
                log.info("{} left through {}", snake, exit);

                if (state.getSnakes().isEmpty()) {
                    if (!state.isWon()) {
                        state.markWon();
                        events.add(new GameEvent.LevelWon());
                        log.info("Level won");
                    }
                    return;
                }

                if (config.fruitSpawnOnExit()) {
                    Set<SnakeColor> colors = EnumSet.noneOf(SnakeColor.class);
                    for (Snake remaining : state.getSnakes()) {
                        colors.add(remaining.getColor());
                    }
                    Cell cell = exit.getPosition();
                    Fruit fruit = board.getStore().create(id -> new Fruit(id, cell, colors));
                    board.add(cell, fruit);
                    events.add(new GameEvent.FruitSpawned(fruit.getId(), cell, colors));
                    log.debug("Spawned {} on the used exit", fruit);
                }
            }

            @Override
            public void laserContact(Snake snake, LaserGate gate) {
                hazards.slice(snake, gate.getPosition());
            }
        };
    }
}

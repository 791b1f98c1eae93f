package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.Board;
import io.github.manjago.snakeescape.core.Box;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.Entity;
import io.github.manjago.snakeescape.core.EntityKind;
import io.github.manjago.snakeescape.core.EntityStore;
import io.github.manjago.snakeescape.core.Exit;
import io.github.manjago.snakeescape.core.Fruit;
import io.github.manjago.snakeescape.core.Hole;
import io.github.manjago.snakeescape.core.IceCube;
import io.github.manjago.snakeescape.core.LaserGate;
import io.github.manjago.snakeescape.core.LiftGate;
import io.github.manjago.snakeescape.core.LinkRegistry;
import io.github.manjago.snakeescape.core.Portal;
import io.github.manjago.snakeescape.core.PressurePlate;
import io.github.manjago.snakeescape.core.Pushable;
import io.github.manjago.snakeescape.core.Snake;
import io.github.manjago.snakeescape.core.Wall;
import io.github.manjago.snakeescape.level.LevelData;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Live collections of one loaded level: board, snakes in play, link registry,
 * and the presentation busy flags.
 * 
 * Single writer: only the move resolver and state refresher mutate it, one move at a time.
 */
public class LevelState {
    
    private final Board board;
    private final LinkRegistry registry;
    private final List<Snake> snakes;
    private final Set<Integer> animating = new HashSet<>();
    private boolean won;
    
    LevelState(Board board, LinkRegistry registry, List<Snake> snakes) {
        this.board = board;
        this.registry = registry;
        this.snakes = new ArrayList<>(snakes);
    }
    
    /**
     * Build the live state of a level.
     * 
     * @throws IllegalArgumentException if the level data is inconsistent
     *         (entity outside the board, overlapping snakes, snake on a wall)
     */
    public static LevelState fromLevel(LevelData level) {
        EntityStore store = new EntityStore();
        Board board = new Board(level.width(), level.height(), store);
        
        for (Cell cell : level.walls()) {
            board.add(cell, store.create(Wall::new));
        }
        for (LevelData.ExitSpec spec : level.exits()) {
            board.add(spec.position(), store.create(id -> new Exit(id, spec.position(), spec.color(), spec.minLength())));
        }
        for (LevelData.FruitSpec spec : level.fruits()) {
            board.add(spec.position(), store.create(id -> new Fruit(id, spec.position(), spec.colors())));
        }
        for (List<Cell> footprint : level.boxes()) {
            board.place(store.create(id -> new Box(id, footprint)));
        }
        for (List<Cell> footprint : level.iceCubes()) {
            board.place(store.create(id -> new IceCube(id, footprint)));
        }
        for (Cell cell : level.holes()) {
            board.add(cell, store.create(id -> new Hole(id, cell)));
        }
        for (LevelData.GroupSpec spec : level.plates()) {
            board.add(spec.position(), store.create(id -> new PressurePlate(id, spec.position(), spec.color())));
        }
        for (LevelData.GroupSpec spec : level.liftGates()) {
            board.add(spec.position(), store.create(id -> new LiftGate(id, spec.position(), spec.color())));
        }
        for (LevelData.GroupSpec spec : level.laserGates()) {
            board.add(spec.position(), store.create(id -> new LaserGate(id, spec.position(), spec.color())));
        }
        for (LevelData.PortalSpec spec : level.portals()) {
            board.add(spec.position(), store.create(id -> new Portal(id, spec.position(), spec.color())));
        }
        
        List<Snake> snakes = new ArrayList<>();
        Set<Cell> taken = new HashSet<>();
        for (LevelData.SnakeSpec spec : level.snakes()) {
            Snake snake = new Snake(snakes.size(), spec.color(), spec.body());
            for (Cell cell : snake.getBody()) {
                if (!board.inBounds(cell)) {
                    throw new IllegalArgumentException(snake + " has a segment outside the board at " + cell);
                }
                if (!taken.add(cell)) {
                    throw new IllegalArgumentException(snake + " overlaps another snake at " + cell);
                }
                if (board.hasKind(cell, EntityKind.WALL)) {
                    throw new IllegalArgumentException(snake + " starts inside a wall at " + cell);
                }
            }
            snakes.add(snake);
        }
        
        return new LevelState(board, LinkRegistry.build(store), snakes);
    }
    
    // ========== Collections ==========
    
    public Board getBoard() {
        return board;
    }
    
    public LinkRegistry getRegistry() {
        return registry;
    }
    
    /**
     * Snakes still in play, in level order.
     */
    public List<Snake> getSnakes() {
        return Collections.unmodifiableList(snakes);
    }
    
    @Nullable
    public Snake findSnake(int id) {
        for (Snake snake : snakes) {
            if (snake.getId() == id) {
                return snake;
            }
        }
        return null;
    }
    
    void removeSnake(Snake snake) {
        snakes.remove(snake);
        animating.remove(snake.getId());
    }
    
    public boolean isWon() {
        return won;
    }
    
    void markWon() {
        won = true;
    }
    
    // ========== Presentation busy flags ==========
    
    public boolean isAnimating(int snakeId) {
        return animating.contains(snakeId);
    }
    
    public void setAnimating(int snakeId, boolean busy) {
        if (busy) {
            animating.add(snakeId);
        } else {
            animating.remove(snakeId);
        }
    }
    
    // ========== Occupancy ==========
    
    /**
     * Snake with a segment on the cell, or null.
     */
    @Nullable
    public Snake snakeOccupying(Cell cell) {
        for (Snake snake : snakes) {
            if (snake.occupies(cell)) {
                return snake;
            }
        }
        return null;
    }
    
    /**
     * True while a snake segment, box or ice cube sits on the cell.
     * This is what presses plates and holds lift gates open.
     */
    public boolean isOccupied(Cell cell) {
        return snakeOccupying(cell) != null
                || board.hasKind(cell, EntityKind.BOX)
                || board.hasKind(cell, EntityKind.ICE_CUBE);
    }
    
    /**
     * Whether a pushed object (or a portal traveller) may land on the cell:
     * in bounds, no snake, nothing that stops objects.
     * 
     * @param self the moving object, whose own cells do not count as obstacles; may be null
     */
    public boolean isFreeForObject(Cell cell, @Nullable Pushable self) {
        if (!board.inBounds(cell) || snakeOccupying(cell) != null) {
            return false;
        }
        for (Entity entity : board.get(cell)) {
            if (entity != self && blocksObjects(entity)) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Entities that stop snakes outright, whatever the mover: walls and closed lift gates.
     */
    static boolean blocksSnakes(Entity entity) {
        return switch (entity.getKind()) {
            case WALL -> true;
            case LIFT_GATE -> !((LiftGate) entity).isOpen();
            case FRUIT, EXIT, BOX, ICE_CUBE, HOLE, PRESSURE_PLATE, LASER_GATE, PORTAL -> false;
        };
    }
    
    /**
     * Entities that stop pushed objects and block portal exits.
     * Holes and laser gates never block: they destroy on arrival instead.
     */
    static boolean blocksObjects(Entity entity) {
        return switch (entity.getKind()) {
            case WALL, BOX, ICE_CUBE -> true;
            case LIFT_GATE -> !((LiftGate) entity).isOpen();
            case FRUIT, EXIT, HOLE, PRESSURE_PLATE, LASER_GATE, PORTAL -> false;
        };
    }
}

package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.EntityKind;
import io.github.manjago.snakeescape.core.SnakeColor;

import java.util.List;
import java.util.Set;

/**
 * State delta published to presentation collaborators, in the order it happened.
 * Collaborators may replay these as animation; the core never waits for them.
 */
public sealed interface GameEvent {
    
    /** Board (re)built from level data. */
    record LevelLoaded(String levelName, int width, int height) implements GameEvent {}
    
    /** A box or ice cube moved; anchors (first footprint cell) before and after. */
    record EntityRelocated(int entityId, EntityKind kind, Cell from, Cell to) implements GameEvent {}
    
    /** A box or ice cube left the board. */
    record EntityDestroyed(int entityId, EntityKind kind, List<Cell> cells, DestroyCause cause) implements GameEvent {
        public EntityDestroyed {
            cells = List.copyOf(cells);
        }
    }
    
    record SnakeMoved(int snakeId) implements GameEvent {}
    
    record SnakeGrew(int snakeId) implements GameEvent {}
    
    /** Lost segments to a laser but is still in play. */
    record SnakeSliced(int snakeId) implements GameEvent {}
    
    /** Left play, through an exit or by losing every segment. */
    record SnakeRemoved(int snakeId) implements GameEvent {}
    
    record FruitConsumed(Cell position) implements GameEvent {}
    
    record FruitSpawned(int fruitId, Cell position, Set<SnakeColor> colors) implements GameEvent {
        public FruitSpawned {
            colors = Set.copyOf(colors);
        }
    }
    
    record ExitConsumed(Cell position) implements GameEvent {}
    
    /** One hole cell filled by the object that came from the filler cell. */
    record HoleFilled(Cell hole, Cell filler) implements GameEvent {}
    
    record PlateStateChanged(int plateId, boolean active) implements GameEvent {}
    
    record LiftGateStateChanged(int gateId, boolean open) implements GameEvent {}
    
    record LaserGateStateChanged(int gateId, boolean active) implements GameEvent {}
    
    record PortalStateChanged(int portalId, boolean active) implements GameEvent {}
    
    /** Last snake left through an exit. Fires at most once per load. */
    record LevelWon() implements GameEvent {}
    
    /**
     * Why a pushable object was destroyed.
     */
    enum DestroyCause {
        /** Whole footprint dropped into holes. */
        HOLE,
        /** Whole footprint on armed laser gates. */
        LASER
    }
}

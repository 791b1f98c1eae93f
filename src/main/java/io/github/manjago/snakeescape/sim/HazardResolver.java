package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.Board;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.Hole;
import io.github.manjago.snakeescape.core.LaserGate;
import io.github.manjago.snakeescape.core.Pushable;
import io.github.manjago.snakeescape.core.Snake;
import io.github.manjago.snakeescape.sim.GameEvent.DestroyCause;
import io.github.manjago.snakeescape.sim.PushProtocol.PushPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies relocations and their lethal consequences: holes, laser gates, slicing.
 * 
 * An object is consumed only when its whole footprint is affected; partial
 * overlap with holes or lasers leaves it standing.
 */
public class HazardResolver {
    
    private static final Logger log = LoggerFactory.getLogger(HazardResolver.class);
    
    private final LevelState state;
    private final EventBuffer events;
    
    public HazardResolver(LevelState state, EventBuffer events) {
        this.state = state;
        this.events = events;
    }
    
    /**
     * Move an object to its planned footprint, then settle it.
     */
    public void relocate(PushPlan plan) {
        Pushable object = plan.object();
        List<Cell> previous = object.getFootprint();
        Cell from = object.getAnchor();
        
        state.getBoard().relocate(object, plan.footprint());
        events.add(new GameEvent.EntityRelocated(object.getId(), object.getKind(), from, object.getAnchor()));
        log.debug("{} moved {} -> {}", object, from, object.getAnchor());
        
        settle(object, previous);
    }
    
    /**
     * Gravity and hazard check after a relocation.
     * 
     * @param object the object that just moved
     * @param previous its footprint before the move, cell for cell
     * @return true if the object was destroyed
     */
    public boolean settle(Pushable object, List<Cell> previous) {
        Board board = state.getBoard();
        List<Cell> footprint = object.getFootprint();
        
        if (allHoles(footprint)) {
            for (int i = 0; i < footprint.size(); i++) {
                Cell cell = footprint.get(i);
                Hole hole = board.firstOfKind(cell, Hole.class);
                if (hole != null) {
                    board.destroy(hole, List.of(cell));
                }
                events.add(new GameEvent.HoleFilled(cell, previous.get(i)));
            }
            board.destroy(object, footprint);
            events.add(new GameEvent.EntityDestroyed(object.getId(), object.getKind(), footprint, DestroyCause.HOLE));
            log.debug("{} fell into {} hole(s)", object, footprint.size());
            return true;
        }
        
        if (isOnArmedLasers(footprint)) {
            destroyByLaser(object);
            return true;
        }
        return false;
    }
    
    /**
     * True if every cell holds an armed laser gate.
     */
    public boolean isOnArmedLasers(List<Cell> cells) {
        for (Cell cell : cells) {
            LaserGate laser = state.getBoard().firstOfKind(cell, LaserGate.class);
            if (laser == null || !laser.isActive()) {
                return false;
            }
        }
        return true;
    }
    
    public void destroyByLaser(Pushable object) {
        List<Cell> footprint = object.getFootprint();
        state.getBoard().destroy(object, footprint);
        events.add(new GameEvent.EntityDestroyed(object.getId(), object.getKind(), footprint, DestroyCause.LASER));
        log.debug("{} destroyed by laser", object);
    }
    
    /**
     * Cut a snake at a hazard cell; a snake left without segments leaves play.
     * 
     * @return true if the snake had a segment on the cell
     */
    public boolean slice(Snake snake, Cell hazard) {
        if (!snake.sliceAt(hazard)) {
            return false;
        }
        if (snake.isEmpty()) {
            log.debug("{} sliced away completely at {}", snake, hazard);
            removeSnake(snake);
        } else {
            log.debug("{} sliced at {}", snake, hazard);
            events.add(new GameEvent.SnakeSliced(snake.getId()));
        }
        return true;
    }
    
    /**
     * Take a snake out of play.
     */
    public void removeSnake(Snake snake) {
        snake.removeFromPlay();
        state.removeSnake(snake);
        events.add(new GameEvent.SnakeRemoved(snake.getId()));
    }
    
    private boolean allHoles(List<Cell> cells) {
        for (Cell cell : cells) {
            if (state.getBoard().firstOfKind(cell, Hole.class) == null) {
                return false;
            }
        }
        return true;
    }
}

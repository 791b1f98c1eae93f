package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.Board;
import io.github.manjago.snakeescape.core.Box;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.EntityKind;
import io.github.manjago.snakeescape.core.IceCube;
import io.github.manjago.snakeescape.core.Portal;
import io.github.manjago.snakeescape.core.Pushable;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes where a displaced object ends up, without touching the board.
 * 
 * <ul>
 *   <li>Box: one hop in the push direction; if the hop lands on an active portal
 *       the whole footprint shifts to the partner side (one teleport, not chained).</li>
 *   <li>Ice cube: keeps stepping until the next step is blocked, the footprint lands
 *       fully on holes, or the step limit is hit. Portals relocate it and the slide
 *       continues from the far side in the same direction.</li>
 * </ul>
 * A landing cell must be in bounds, free of snakes, walls, boxes, ice cubes and
 * closed lift gates. Holes and laser gates are legal landings; the object dies there.
 */
public class PushProtocol {
    
    /**
     * Final placement of a displaced object.
     * 
     * @param object the object being displaced
     * @param footprint its footprint after the move
     * @param intoHoles true if every footprint cell is a hole (the object falls in)
     */
    public record PushPlan(Pushable object, List<Cell> footprint, boolean intoHoles) {
        public PushPlan {
            footprint = List.copyOf(footprint);
        }
    }
    
    private final LevelState state;
    private final int slideStepLimit;
    
    public PushProtocol(LevelState state, int slideStepLimit) {
        this.state = state;
        this.slideStepLimit = slideStepLimit;
    }
    
    /**
     * Plan the displacement of a box or ice cube.
     * 
     * @param object the object in front of the mover
     * @param direction unit push direction
     * @return the plan, or null if the object cannot move
     */
    @Nullable
    public PushPlan plan(Pushable object, Cell direction) {
        return switch (object.getKind()) {
            case BOX -> planPush((Box) object, direction);
            case ICE_CUBE -> planSlide((IceCube) object, direction);
            case WALL, FRUIT, EXIT, HOLE, PRESSURE_PLATE, LIFT_GATE, LASER_GATE, PORTAL ->
                    throw new IllegalArgumentException("Not a pushable kind: " + object.getKind());
        };
    }
    
    public boolean canPushBox(Box box, Cell direction) {
        return planPush(box, direction) != null;
    }
    
    public boolean canSlideIceCube(IceCube cube, Cell direction) {
        return planSlide(cube, direction) != null;
    }
    
    @Nullable
    PushPlan planPush(Box box, Cell direction) {
        List<Cell> landing = throughPortal(box.getFootprint(), box.shifted(direction));
        if (!allFree(landing, box)) {
            return null;
        }
        return new PushPlan(box, landing, allHoles(landing));
    }
    
    @Nullable
    PushPlan planSlide(IceCube cube, Cell direction) {
        List<Cell> shape = cube.getFootprint();
        boolean intoHoles = false;
        int steps = 0;
        
        while (steps < slideStepLimit) {
            List<Cell> next = throughPortal(shape, shift(shape, direction));
            if (!allFree(next, cube)) {
                break;
            }
            shape = next;
            steps++;
            if (allHoles(shape)) {
                intoHoles = true;
                break;
            }
        }
        
        if (steps == 0) {
            return null;
        }
        return new PushPlan(cube, shape, intoHoles);
    }
    
    // ========== Helpers ==========
    
    /**
     * If a cell the shape has just stepped onto holds an active portal, move the
     * whole shape by that portal's entry-to-exit delta. Cells the shape already
     * covered do not teleport it.
     */
    private List<Cell> throughPortal(List<Cell> before, List<Cell> shape) {
        Board board = state.getBoard();
        for (Cell cell : shape) {
            if (before.contains(cell)) {
                continue;
            }
            Portal portal = board.firstOfKind(cell, Portal.class);
            if (portal != null && portal.isActive()) {
                Cell destination = portal.getDestination();
                if (destination != null) {
                    return shift(shape, destination.minus(cell));
                }
            }
        }
        return shape;
    }
    
    private boolean allFree(List<Cell> shape, Pushable self) {
        for (Cell cell : shape) {
            if (!state.isFreeForObject(cell, self)) {
                return false;
            }
        }
        return true;
    }
    
    private boolean allHoles(List<Cell> shape) {
        for (Cell cell : shape) {
            if (!state.getBoard().hasKind(cell, EntityKind.HOLE)) {
                return false;
            }
        }
        return true;
    }
    
    private static List<Cell> shift(List<Cell> shape, Cell delta) {
        List<Cell> moved = new ArrayList<>(shape.size());
        for (Cell cell : shape) {
            moved.add(cell.plus(delta));
        }
        return moved;
    }
}

package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.GroupColor;
import io.github.manjago.snakeescape.core.LaserGate;
import io.github.manjago.snakeescape.core.LiftGate;
import io.github.manjago.snakeescape.core.LinkRegistry;
import io.github.manjago.snakeescape.core.Portal;
import io.github.manjago.snakeescape.core.PressurePlate;
import io.github.manjago.snakeescape.core.Pushable;
import io.github.manjago.snakeescape.core.Snake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Recomputes every derived switch state after a mutation: plates, then gates,
 * then portals. Events are emitted on transitions only.
 * 
 * Gate state never feeds back into plate occupancy, but arming a laser can slice
 * a snake or destroy an object standing on it, which does. A pass that killed
 * something is therefore followed by another, up to the configured pass limit.
 */
public class StateRefresher {
    
    private static final Logger log = LoggerFactory.getLogger(StateRefresher.class);
    
    private final LevelState state;
    private final HazardResolver hazards;
    private final EventBuffer events;
    private final int passLimit;
    
    public StateRefresher(LevelState state, HazardResolver hazards, EventBuffer events, int passLimit) {
        this.state = state;
        this.hazards = hazards;
        this.events = events;
        this.passLimit = passLimit;
    }
    
    /**
     * Refresh until no pass mutates the board.
     * 
     * @return number of passes run
     */
    public int refresh() {
        int passes = 0;
        boolean mutated = true;
        while (mutated && passes < passLimit) {
            mutated = runPass();
            passes++;
        }
        if (mutated) {
            log.warn("State refresh did not settle after {} passes", passLimit);
        }
        return passes;
    }
    
    /**
     * One plate, gate and portal pass.
     * 
     * @return true if laser arming removed segments or objects
     */
    boolean runPass() {
        refreshPlates();
        boolean mutated = refreshGates();
        refreshPortals();
        return mutated;
    }
    
    // ========== Passes ==========
    
    private void refreshPlates() {
        for (PressurePlate plate : state.getRegistry().getAllPlates()) {
            if (plate.setActive(state.isOccupied(plate.getPosition()))) {
                events.add(new GameEvent.PlateStateChanged(plate.getId(), plate.isActive()));
            }
        }
    }
    
    private boolean refreshGates() {
        LinkRegistry registry = state.getRegistry();
        boolean mutated = false;
        
        for (GroupColor color : registry.getGroupColors()) {
            boolean allActive = registry.isGroupActive(color);
            
            for (LiftGate gate : registry.getLiftGates(color)) {
                boolean changed;
                if (allActive) {
                    changed = gate.setOpen(true);
                } else {
                    // safety lock: stays open while anything stands in it
                    changed = gate.isOpen() && !state.isOccupied(gate.getPosition()) && gate.setOpen(false);
                }
                if (changed) {
                    events.add(new GameEvent.LiftGateStateChanged(gate.getId(), gate.isOpen()));
                }
            }
            
            for (LaserGate laser : registry.getLaserGates(color)) {
                if (laser.setActive(!allActive)) {
                    events.add(new GameEvent.LaserGateStateChanged(laser.getId(), laser.isActive()));
                    if (laser.isActive()) {
                        mutated |= killOnArm(laser);
                    }
                }
            }
        }
        return mutated;
    }
    
    /**
     * A laser that just armed cuts whatever already stands on it.
     */
    private boolean killOnArm(LaserGate laser) {
        Cell cell = laser.getPosition();
        boolean killed = false;
        
        for (Snake snake : new ArrayList<>(state.getSnakes())) {
            killed |= hazards.slice(snake, cell);
        }
        
        Pushable object = state.getBoard().firstOfKind(cell, Pushable.class);
        if (object != null && hazards.isOnArmedLasers(object.getFootprint())) {
            hazards.destroyByLaser(object);
            killed = true;
        }
        
        if (killed) {
            log.debug("Laser {} armed on an occupied cell", laser);
        }
        return killed;
    }
    
    private void refreshPortals() {
        for (Portal portal : state.getRegistry().getPortals()) {
            boolean open = portal.isLinked() && state.isFreeForObject(portal.getDestination(), null);
            if (portal.setActive(open)) {
                events.add(new GameEvent.PortalStateChanged(portal.getId(), portal.isActive()));
            }
        }
    }
}

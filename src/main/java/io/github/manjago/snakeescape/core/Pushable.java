package io.github.manjago.snakeescape.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Multi-cell object displaced by a snake head: a {@link Box} moves one hop,
 * an {@link IceCube} slides until stopped.
 * 
 * The object is mutated in place when it moves, so its id stays the same for
 * the collaborators correlating events. The footprint is rigid: a move shifts
 * every cell by the same delta. The first footprint cell is the anchor.
 */
public abstract sealed class Pushable implements Entity permits Box, IceCube {
    
    private final int id;
    private List<Cell> footprint;
    
    protected Pushable(int id, List<Cell> footprint) {
        if (footprint == null || footprint.isEmpty()) {
            throw new IllegalArgumentException("Object #" + id + " has an empty footprint");
        }
        if (new HashSet<>(footprint).size() != footprint.size()) {
            throw new IllegalArgumentException("Object #" + id + " repeats a footprint cell");
        }
        this.id = id;
        this.footprint = List.copyOf(footprint);
    }
    
    @Override
    public final int getId() {
        return id;
    }
    
    public List<Cell> getFootprint() {
        return footprint;
    }
    
    public Cell getAnchor() {
        return footprint.get(0);
    }
    
    public boolean occupies(Cell cell) {
        return footprint.contains(cell);
    }
    
    /**
     * Footprint shifted by a delta.
     */
    public List<Cell> shifted(Cell delta) {
        List<Cell> moved = new ArrayList<>(footprint.size());
        for (Cell cell : footprint) {
            moved.add(cell.plus(delta));
        }
        return Collections.unmodifiableList(moved);
    }
    
    /**
     * Only the board changes the footprint, together with its cell index.
     */
    void setFootprint(List<Cell> cells) {
        this.footprint = List.copyOf(cells);
    }
    
    /**
     * Direct entry is never allowed; entry happens only through the push/slide protocol.
     */
    @Override
    public final boolean canEnter(Snake mover, SnakeEnd end) {
        return false;
    }
    
    @Override
    public final void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
        throw new IllegalStateException("Snake #" + mover.getId() + " entered " + this
                + " without displacing it");
    }
    
    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + id + footprint;
    }
}

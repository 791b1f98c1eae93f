package io.github.manjago.snakeescape.core;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Width x height grid of entity stacks.
 * 
 * Every cell holds a (possibly empty) set of entity ids resolved through the
 * {@link EntityStore}; an empty cell is open floor. A cell may stack several
 * entities (a plate under a box, a laser gate, a portal...).
 * 
 * Lookups outside the board fail closed: they report a {@link Wall}
 * and never throw into resolver logic.
 */
public class Board {
    
    private final int width;
    private final int height;
    private final EntityStore store;
    private final List<Set<Integer>> cells;
    
    public Board(int width, int height, EntityStore store) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Board size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.store = store;
        this.cells = new ArrayList<>(width * height);
        for (int i = 0; i < width * height; i++) {
            cells.add(new LinkedHashSet<>());
        }
    }
    
    // ========== Geometry ==========
    
    public int getWidth() {
        return width;
    }
    
    public int getHeight() {
        return height;
    }
    
    public EntityStore getStore() {
        return store;
    }
    
    public boolean inBounds(Cell cell) {
        return cell.x() >= 0 && cell.y() >= 0 && cell.x() < width && cell.y() < height;
    }
    
    /**
     * Map a cell onto the board torus.
     */
    public Cell wrap(Cell cell) {
        return new Cell(Math.floorMod(cell.x(), width), Math.floorMod(cell.y(), height));
    }
    
    private int index(Cell cell) {
        return cell.y() * width + cell.x();
    }
    
    // ========== Lookup ==========
    
    /**
     * Entities stacked on a cell, in insertion order.
     * Outside the board this is a single out-of-bounds wall.
     */
    public List<Entity> get(Cell cell) {
        if (!inBounds(cell)) {
            return List.of(Wall.OUT_OF_BOUNDS);
        }
        Set<Integer> ids = cells.get(index(cell));
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<Entity> result = new ArrayList<>(ids.size());
        for (int id : ids) {
            Entity entity = store.get(id);
            if (entity != null) {
                result.add(entity);
            }
        }
        return result;
    }
    
    public boolean isEmpty(Cell cell) {
        return inBounds(cell) && cells.get(index(cell)).isEmpty();
    }
    
    public boolean hasKind(Cell cell, EntityKind kind) {
        if (!inBounds(cell)) {
            return kind == EntityKind.WALL;
        }
        for (int id : cells.get(index(cell))) {
            Entity entity = store.get(id);
            if (entity != null && entity.getKind() == kind) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * First entity of a type on a cell.
     * 
     * @return the entity, or null if there is none
     */
    @Nullable
    public <T extends Entity> T firstOfKind(Cell cell, Class<T> type) {
        for (Entity entity : get(cell)) {
            if (type.isInstance(entity)) {
                return type.cast(entity);
            }
        }
        return null;
    }
    
    // ========== Mutation ==========
    
    /**
     * Put an entity on a cell. The entity must already live in the store.
     * 
     * @throws IllegalArgumentException if the cell is outside the board
     */
    public void add(Cell cell, Entity entity) {
        if (!inBounds(cell)) {
            throw new IllegalArgumentException(entity + " placed outside the board at " + cell);
        }
        if (store.get(entity.getId()) != entity) {
            throw new IllegalArgumentException(entity + " is not stored in this level");
        }
        cells.get(index(cell)).add(entity.getId());
    }
    
    /**
     * @return true if the entity was on that cell
     */
    public boolean remove(Cell cell, Entity entity) {
        if (!inBounds(cell)) {
            return false;
        }
        return cells.get(index(cell)).remove(entity.getId());
    }
    
    /**
     * Put a multi-cell object on every cell of its footprint.
     */
    public void place(Pushable object) {
        for (Cell cell : object.getFootprint()) {
            add(cell, object);
        }
    }
    
    /**
     * Move a multi-cell object: update its footprint and the cell index together.
     */
    public void relocate(Pushable object, List<Cell> footprint) {
        for (Cell cell : footprint) {
            if (!inBounds(cell)) {
                throw new IllegalArgumentException(object + " relocated outside the board at " + cell);
            }
        }
        for (Cell cell : object.getFootprint()) {
            remove(cell, object);
        }
        object.setFootprint(footprint);
        place(object);
    }
    
    /**
     * Take an entity off the board and tombstone it in the store.
     */
    public void destroy(Entity entity, List<Cell> occupied) {
        for (Cell cell : occupied) {
            remove(cell, entity);
        }
        store.remove(entity.getId());
    }
    
    @Override
    public String toString() {
        return String.format("Board[%dx%d, %d entities]", width, height, store.size());
    }
}

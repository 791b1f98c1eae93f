package io.github.manjago.snakeescape.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A snake in play.
 * 
 * Snakes are not stored on the board: their occupancy spans many cells and is
 * queried for collision separately from grid stacking. The body is an ordered,
 * non-empty list of distinct cells; index 0 is the head, the last index is the tail.
 * 
 * Consecutive body cells are usually adjacent, but not always: a segment that went
 * through a portal leaves a gap in the body.
 */
public class Snake {
    
    private final int id;
    private final SnakeColor color;
    private final List<Cell> body;
    
    private boolean inPlay = true;
    
    /**
     * Create a snake.
     * 
     * @param id unique snake identifier
     * @param color snake color
     * @param body body cells, head first
     * @throws IllegalArgumentException if the body is empty or repeats a cell
     */
    public Snake(int id, SnakeColor color, List<Cell> body) {
        if (body == null || body.isEmpty()) {
            throw new IllegalArgumentException("Snake #" + id + " has an empty body");
        }
        Set<Cell> seen = new HashSet<>();
        for (Cell cell : body) {
            if (!seen.add(cell)) {
                throw new IllegalArgumentException("Snake #" + id + " repeats body cell " + cell);
            }
        }
        this.id = id;
        this.color = color;
        this.body = new ArrayList<>(body);
    }
    
    /**
     * Create a snake from its two ends, the way level assets declare them.
     * Equal ends give a one-cell snake.
     */
    public static Snake fromEnds(int id, SnakeColor color, Cell head, Cell tail) {
        return head.equals(tail)
                ? new Snake(id, color, List.of(head))
                : new Snake(id, color, List.of(head, tail));
    }
    
    // ========== Getters ==========
    
    public int getId() {
        return id;
    }
    
    public SnakeColor getColor() {
        return color;
    }
    
    public List<Cell> getBody() {
        return Collections.unmodifiableList(body);
    }
    
    public int length() {
        return body.size();
    }
    
    public Cell getHead() {
        return body.get(0);
    }
    
    public Cell getTail() {
        return body.get(body.size() - 1);
    }
    
    public Cell getEnd(SnakeEnd end) {
        return end == SnakeEnd.HEAD ? getHead() : getTail();
    }
    
    public boolean occupies(Cell cell) {
        return body.contains(cell);
    }
    
    public boolean isInPlay() {
        return inPlay;
    }
    
    // ========== Movement ==========
    
    /**
     * Push a new head cell. The tail cell is dropped unless the snake grows.
     */
    public void advanceHead(Cell newHead, boolean grow) {
        body.add(0, newHead);
        if (!grow) {
            body.remove(body.size() - 1);
        }
    }
    
    /**
     * Reverse step: append a new tail cell and drop the head cell.
     */
    public void advanceTail(Cell newTail) {
        body.add(newTail);
        body.remove(0);
    }
    
    /**
     * Move one end to another cell without touching the rest of the body
     * (portal teleport).
     */
    public void relocateEnd(SnakeEnd end, Cell cell) {
        body.set(end == SnakeEnd.HEAD ? 0 : body.size() - 1, cell);
    }
    
    /**
     * Cut the snake at a hazard cell.
     * A hit on the head removes only the head segment; any other hit removes
     * everything from the hit segment to the tail.
     * 
     * @return true if the cell was part of the body
     */
    public boolean sliceAt(Cell hazard) {
        int index = body.indexOf(hazard);
        if (index == -1) {
            return false;
        }
        if (index == 0) {
            body.remove(0);
        } else {
            body.subList(index, body.size()).clear();
        }
        return true;
    }
    
    /**
     * True when slicing consumed every segment.
     */
    public boolean isEmpty() {
        return body.isEmpty();
    }
    
    /**
     * Take the snake out of play (exited or destroyed).
     */
    public void removeFromPlay() {
        inPlay = false;
        body.clear();
    }
    
    // ========== Object methods ==========
    
    @Override
    public String toString() {
        return String.format("Snake#%d[%s, len=%d, head=%s%s]",
                id, color, body.size(), body.isEmpty() ? "-" : getHead(), inPlay ? "" : ", out");
    }
}

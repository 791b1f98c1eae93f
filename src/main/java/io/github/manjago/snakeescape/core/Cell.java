package io.github.manjago.snakeescape.core;

/**
 * Integer grid coordinate, origin at the bottom-left corner.
 * <p>
 * Also used as a displacement vector (push direction, portal delta).
 */
public record Cell(int x, int y) {
    
    public static final Cell ZERO = new Cell(0, 0);
    
    public static Cell of(int x, int y) {
        return new Cell(x, y);
    }
    
    public Cell plus(Cell delta) {
        return new Cell(x + delta.x, y + delta.y);
    }
    
    public Cell minus(Cell other) {
        return new Cell(x - other.x, y - other.y);
    }
    
    public Cell offset(int dx, int dy) {
        return new Cell(x + dx, y + dy);
    }
    
    /**
     * Manhattan distance to another cell (no wraparound).
     */
    public int manhattan(Cell other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }
    
    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}

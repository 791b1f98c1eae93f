package io.github.manjago.snakeescape.core;

/**
 * Static obstacle. Blocks all entry.
 */
public final class Wall implements Entity {
    
    /** Reported for every lookup outside the board. */
    public static final Wall OUT_OF_BOUNDS = new Wall(-1);
    
    private final int id;
    
    public Wall(int id) {
        this.id = id;
    }
    
    @Override
    public int getId() {
        return id;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.WALL;
    }
    
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        return false;
    }
    
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
        throw new IllegalStateException("Snake #" + mover.getId() + " entered a wall");
    }
    
    @Override
    public String toString() {
        return id < 0 ? "Wall[out-of-bounds]" : "Wall#" + id;
    }
}

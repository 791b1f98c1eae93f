package io.github.manjago.snakeescape.core;

/**
 * Floor hazard. Snakes cannot step into it; a pushed object whose whole
 * footprint lands on holes falls in and fills them.
 */
public final class Hole implements Entity {
    
    private final int id;
    private final Cell position;
    
    public Hole(int id, Cell position) {
        this.id = id;
        this.position = position;
    }
    
    @Override
    public int getId() {
        return id;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.HOLE;
    }
    
    public Cell getPosition() {
        return position;
    }
    
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        return false;
    }
    
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
        throw new IllegalStateException("Snake #" + mover.getId() + " entered a hole at " + position);
    }
    
    @Override
    public String toString() {
        return "Hole#" + id + position;
    }
}

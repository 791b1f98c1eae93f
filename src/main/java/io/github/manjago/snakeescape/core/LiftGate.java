package io.github.manjago.snakeescape.core;

/**
 * Physical barrier driven by a plate group. Closed it is a wall, open it is floor.
 * Starts closed.
 */
public final class LiftGate implements Entity {
    
    private final int id;
    private final Cell position;
    private final GroupColor color;
    private boolean open;
    
    public LiftGate(int id, Cell position, GroupColor color) {
        this.id = id;
        this.position = position;
        this.color = color;
    }
    
    @Override
    public int getId() {
        return id;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.LIFT_GATE;
    }
    
    public Cell getPosition() {
        return position;
    }
    
    public GroupColor getColor() {
        return color;
    }
    
    public boolean isOpen() {
        return open;
    }
    
    /**
     * @return true if the state changed
     */
    public boolean setOpen(boolean open) {
        if (this.open == open) {
            return false;
        }
        this.open = open;
        return true;
    }
    
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        return open;
    }
    
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
    }
    
    @Override
    public String toString() {
        return String.format("LiftGate#%d%s[%s, %s]", id, position, color, open ? "open" : "closed");
    }
}

package io.github.manjago.snakeescape.core;

/**
 * Energy hazard driven by a plate group: armed while the group is not fully pressed.
 * Never blocks entry; slices whatever enters it while armed.
 * Starts armed.
 */
public final class LaserGate implements Entity {
    
    private final int id;
    private final Cell position;
    private final GroupColor color;
    private boolean active = true;
    
    public LaserGate(int id, Cell position, GroupColor color) {
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
        return EntityKind.LASER_GATE;
    }
    
    public Cell getPosition() {
        return position;
    }
    
    public GroupColor getColor() {
        return color;
    }
    
    public boolean isActive() {
        return active;
    }
    
    /**
     * @return true if the state changed
     */
    public boolean setActive(boolean active) {
        if (this.active == active) {
            return false;
        }
        this.active = active;
        return true;
    }
    
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        return true;
    }
    
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
        if (active) {
            handler.laserContact(mover, this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("LaserGate#%d%s[%s, %s]", id, position, color, active ? "armed" : "off");
    }
}

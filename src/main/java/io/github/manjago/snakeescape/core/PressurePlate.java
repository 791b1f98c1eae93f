package io.github.manjago.snakeescape.core;

/**
 * Floor sensor. Active exactly while a snake segment, box or ice cube sits on it.
 * Never blocks; state is maintained by the state refresher, not by entry.
 */
public final class PressurePlate implements Entity {
    
    private final int id;
    private final Cell position;
    private final GroupColor color;
    private boolean active;
    
    public PressurePlate(int id, Cell position, GroupColor color) {
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
        return EntityKind.PRESSURE_PLATE;
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
        // occupancy is recomputed board-wide after every move
    }
    
    @Override
    public String toString() {
        return String.format("Plate#%d%s[%s, %s]", id, position, color, active ? "on" : "off");
    }
}

package io.github.manjago.snakeescape.core;

import org.jetbrains.annotations.Nullable;

/**
 * One endpoint of a same-colored portal pair.
 * 
 * A portal is active only when it is linked and its partner's cell is unobstructed;
 * activity is recomputed by the state refresher. An unlinked portal stays inert.
 */
public final class Portal implements Entity {
    
    private final int id;
    private final Cell position;
    private final PortalColor color;
    
    @Nullable
    private Portal linked;
    private boolean active;
    
    public Portal(int id, Cell position, PortalColor color) {
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
        return EntityKind.PORTAL;
    }
    
    public Cell getPosition() {
        return position;
    }
    
    public PortalColor getColor() {
        return color;
    }
    
    @Nullable
    public Portal getLinked() {
        return linked;
    }
    
    public int getLinkedId() {
        return linked != null ? linked.id : -1;
    }
    
    public boolean isLinked() {
        return linked != null;
    }
    
    /**
     * Cell a traveller arrives at, or null for an unlinked portal.
     */
    @Nullable
    public Cell getDestination() {
        return linked != null ? linked.position : null;
    }
    
    /**
     * Pair two portals. Only the link registry does this, once per level load.
     */
    static void link(Portal a, Portal b) {
        if (a == b) {
            throw new IllegalArgumentException("Portal #" + a.id + " cannot link to itself");
        }
        a.linked = b;
        b.linked = a;
    }
    
    public boolean isActive() {
        return active;
    }
    
    /**
     * @return true if the state changed
     */
    public boolean setActive(boolean active) {
        boolean effective = active && linked != null;
        if (this.active == effective) {
            return false;
        }
        this.active = effective;
        return true;
    }
    
    /**
     * The portal itself never blocks; whether its exit is usable is checked
     * by the resolver against the destination cell.
     */
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        return true;
    }
    
    /**
     * Teleport is done by the resolver before entry effects fire at the arrival cell,
     * so arriving on the partner portal does not bounce back.
     */
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
    }
    
    @Override
    public String toString() {
        return String.format("Portal#%d%s[%s, ->%s, %s]", id, position, color,
                linked != null ? linked.position : "none", active ? "active" : "inactive");
    }
}

package io.github.manjago.snakeescape.core;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Food. Eaten by a snake head whose color is in the allowed set; the snake grows by one.
 */
public final class Fruit implements Entity {
    
    private final int id;
    private final Cell position;
    private final Set<SnakeColor> allowedColors;
    
    public Fruit(int id, Cell position, Collection<SnakeColor> allowedColors) {
        if (allowedColors == null || allowedColors.isEmpty()) {
            throw new IllegalArgumentException("Fruit at " + position + " allows no color");
        }
        this.id = id;
        this.position = position;
        this.allowedColors = Collections.unmodifiableSet(EnumSet.copyOf(allowedColors));
    }
    
    @Override
    public int getId() {
        return id;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.FRUIT;
    }
    
    public Cell getPosition() {
        return position;
    }
    
    public Set<SnakeColor> getAllowedColors() {
        return allowedColors;
    }
    
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        // Tails never eat
        return end == SnakeEnd.HEAD && allowedColors.contains(mover.getColor());
    }
    
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
        handler.fruitEaten(this, mover);
    }
    
    @Override
    public String toString() {
        return "Fruit#" + id + position + allowedColors;
    }
}

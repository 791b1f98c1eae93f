package io.github.manjago.snakeescape.core;

/**
 * Level exit for one snake color. A matching head that is long enough leaves the board.
 */
public final class Exit implements Entity {
    
    private final int id;
    private final Cell position;
    private final SnakeColor color;
    private final int minLength;
    
    public Exit(int id, Cell position, SnakeColor color, int minLength) {
        this.id = id;
        this.position = position;
        this.color = color;
        this.minLength = minLength;
    }
    
    @Override
    public int getId() {
        return id;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.EXIT;
    }
    
    public Cell getPosition() {
        return position;
    }
    
    public SnakeColor getColor() {
        return color;
    }
    
    public int getMinLength() {
        return minLength;
    }
    
    @Override
    public boolean canEnter(Snake mover, SnakeEnd end) {
        return end == SnakeEnd.HEAD
                && mover.getColor() == color
                && mover.length() >= minLength;
    }
    
    @Override
    public void onEntered(Snake mover, SnakeEnd end, EntryHandler handler) {
        handler.snakeExited(mover, this);
    }
    
    @Override
    public String toString() {
        return String.format("Exit#%d%s[%s, min=%d]", id, position, color, minLength);
    }
}

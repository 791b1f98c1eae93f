package io.github.manjago.snakeescape.core;

/**
 * Receiver of the board-wide consequences of a snake entering a cell.
 * <p>
 * Entities only decide that something happens; removing fruit, taking a snake
 * out of play or slicing it is done by the session, which owns the collections.
 */
public interface EntryHandler {
    
    /**
     * A snake head ate a fruit.
     */
    void fruitEaten(Fruit fruit, Snake snake);
    
    /**
     * A snake head entered a matching exit.
     */
    void snakeExited(Snake snake, Exit exit);
    
    /**
     * A snake end entered an active laser gate.
     */
    void laserContact(Snake snake, LaserGate gate);
    
    /**
     * Handler that ignores all consequences.
     * Useful for testing entity rules in isolation.
     */
    EntryHandler IGNORING = new EntryHandler() {
        @Override
        public void fruitEaten(Fruit fruit, Snake snake) {
        }
        
        @Override
        public void snakeExited(Snake snake, Exit exit) {
        }
        
        @Override
        public void laserContact(Snake snake, LaserGate gate) {
        }
    };
}

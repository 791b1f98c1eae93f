package io.github.manjago.snakeescape.core;

/**
 * Anything stored on the board.
 * 
 * Every kind answers two questions for the move resolver:
 * <ul>
 *   <li>{@link #canEnter} - pure predicate, may the given snake end step here</li>
 *   <li>{@link #onEntered} - effect hook, fired only after a move is committed</li>
 * </ul>
 * Effects that reach beyond the entity itself (eating, exiting, slicing) are
 * delegated to an {@link EntryHandler} supplied by the session.
 */
public sealed interface Entity
        permits Wall, Fruit, Exit, Pushable, Hole, PressurePlate, LiftGate, LaserGate, Portal {
    
    /**
     * Arena index of this entity, stable for its whole lifetime.
     */
    int getId();
    
    EntityKind getKind();
    
    /**
     * Rule check, called before a snake end moves onto this entity's cell.
     * 
     * @param mover the snake attempting the move
     * @param end which end of the snake is moving
     * @return true if the snake end may enter
     */
    boolean canEnter(Snake mover, SnakeEnd end);
    
    /**
     * Effect hook, called after a snake end has moved onto this entity's cell.
     * 
     * @param mover the snake that entered
     * @param end the end that entered
     * @param handler receiver of board-wide consequences
     */
    void onEntered(Snake mover, SnakeEnd end, EntryHandler handler);
}

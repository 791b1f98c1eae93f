package io.github.manjago.snakeescape.sim;

/**
 * Listener for session output.
 * 
 * Implement this interface to replay events as animation, play sounds,
 * or record a transcript.
 */
public interface SessionListener {
    
    /**
     * Called for every event, in the order the core produced them.
     * Listeners must not request moves or reloads from here.
     * 
     * @param event the state delta
     */
    default void onEvent(GameEvent event) {}
    
    /**
     * Called when a move request was refused.
     * 
     * @param request the refused request
     * @param reason why it was refused
     */
    default void onMoveRejected(MoveRequest request, MoveResult reason) {}
    
    /**
     * No-op listener that does nothing.
     */
    SessionListener NOOP = new SessionListener() {};
}

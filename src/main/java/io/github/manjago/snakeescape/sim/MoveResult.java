package io.github.manjago.snakeescape.sim;

/**
 * Outcome of a move request. Rejections are ordinary results, never exceptions,
 * and a rejected move leaves the board untouched.
 */
public enum MoveResult {
    
    /** Move validated and executed */
    ACCEPTED(false),
    
    /** No snake in play with that id */
    UNKNOWN_SNAKE(true),
    
    /** The presentation layer is still animating this snake; retry later */
    ANIMATION_IN_PROGRESS(true),
    
    /** Tail move attempted by a snake that cannot reverse */
    ILLEGAL_END(true),
    
    /** Target is not one step away from the moving end */
    NOT_ADJACENT(true),
    
    /** Wall, closed gate, hole, snake, or a push/slide that cannot happen */
    OBSTRUCTED(true),
    
    /** An entity on the target refused the mover (wrong fruit or exit, tail into fruit) */
    INTERACTION_DENIED(true);
    
    private final boolean rejection;
    
    MoveResult(boolean rejection) {
        this.rejection = rejection;
    }
    
    /**
     * @return true if the move was refused
     */
    public boolean isRejection() {
        return rejection;
    }
    
    /**
     * @return true if the move was executed
     */
    public boolean isAccepted() {
        return !rejection;
    }
}

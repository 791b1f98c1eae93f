package io.github.manjago.snakeescape.sim;

import java.util.Map;

/**
 * Snapshot of session statistics.
 */
public record SessionStats(
    int movesAccepted,
    int movesRejected,
    Map<MoveResult, Integer> rejectionsByReason,
    int fruitsEaten,
    int snakesExited,
    int snakesLost,           // removed by lasers, not through an exit
    int holesFilled,
    int objectsDestroyed,
    int snakesRemaining,
    boolean won
) {
    
    public SessionStats {
        rejectionsByReason = Map.copyOf(rejectionsByReason);
    }
    
    public int totalMoves() {
        return movesAccepted + movesRejected;
    }
    
    public int rejections(MoveResult reason) {
        return rejectionsByReason.getOrDefault(reason, 0);
    }
    
    @Override
    public String toString() {
        return String.format("""
            === Session Statistics ===
            Moves:            %d (%d accepted, %d rejected)
              Not adjacent:   %d
              Obstructed:     %d
              Denied:         %d
            
            Fruits eaten:     %d
            Snakes:
              Exited:         %d
              Lost:           %d
              Remaining:      %d
            Holes filled:     %d
            Objects lost:     %d
            
            Result:           %s
            """,
            totalMoves(), movesAccepted, movesRejected,
            rejections(MoveResult.NOT_ADJACENT),
            rejections(MoveResult.OBSTRUCTED),
            rejections(MoveResult.INTERACTION_DENIED),
            fruitsEaten,
            snakesExited,
            snakesLost,
            snakesRemaining,
            holesFilled,
            objectsDestroyed,
            won ? "WON" : "in progress"
        );
    }
}

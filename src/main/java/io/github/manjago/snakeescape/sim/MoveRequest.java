package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.SnakeEnd;

/**
 * A move as requested by the input collaborator: drive one end of a snake toward
 * a raw target cell. The target may lie outside the board; the wrapping color maps
 * it onto the torus, every other color simply fails to enter it.
 */
public record MoveRequest(int snakeId, SnakeEnd end, Cell target) {
    
    public static MoveRequest head(int snakeId, int x, int y) {
        return new MoveRequest(snakeId, SnakeEnd.HEAD, Cell.of(x, y));
    }
    
    public static MoveRequest tail(int snakeId, int x, int y) {
        return new MoveRequest(snakeId, SnakeEnd.TAIL, Cell.of(x, y));
    }
    
    @Override
    public String toString() {
        return String.format("Move[snake #%d %s -> %s]", snakeId, end, target);
    }
}

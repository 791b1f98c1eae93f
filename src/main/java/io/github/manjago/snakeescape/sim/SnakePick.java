package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.core.SnakeEnd;

/**
 * Which snake end sits on a picked cell.
 */
public record SnakePick(int snakeId, SnakeEnd end) {}

package io.github.manjago.snakeescape.core;

/**
 * Snake colors. Which color may reverse (move its tail) and which one wraps
 * around the board edges is decided by the session rules, not here.
 */
public enum SnakeColor {
    RED,
    GREEN,
    BLUE,
    YELLOW
}

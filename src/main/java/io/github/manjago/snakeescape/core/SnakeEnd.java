package io.github.manjago.snakeescape.core;

/**
 * The end of a snake that a move request drives.
 */
public enum SnakeEnd {
    HEAD,
    TAIL
}

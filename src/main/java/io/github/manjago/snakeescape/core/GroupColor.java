package io.github.manjago.snakeescape.core;

/**
 * Color tag that ties pressure plates to the lift gates and laser gates they drive.
 */
public enum GroupColor {
    YELLOW,
    PURPLE,
    ORANGE
}

package io.github.manjago.snakeescape.core;

/**
 * Color tag pairing two portal endpoints.
 */
public enum PortalColor {
    ORANGE,
    CYAN,
    MAGENTA
}

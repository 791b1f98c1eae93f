package io.github.manjago.snakeescape.core;

/**
 * Closed set of stored entity kinds.
 * <p>
 * Empty floor is not a kind: a cell with no entities is floor.
 * Resolver and refresher switch over this enum without a default branch,
 * so a new kind does not compile until every interaction site handles it.
 */
public enum EntityKind {
    WALL,
    FRUIT,
    EXIT,
    BOX,
    ICE_CUBE,
    HOLE,
    PRESSURE_PLATE,
    LIFT_GATE,
    LASER_GATE,
    PORTAL
}

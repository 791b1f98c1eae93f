package io.github.manjago.snakeescape.core;

import java.util.List;

/**
 * Pushable box. Moves exactly one cell per push (or one portal hop).
 */
public final class Box extends Pushable {
    
    public Box(int id, List<Cell> footprint) {
        super(id, footprint);
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.BOX;
    }
}

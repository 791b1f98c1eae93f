package io.github.manjago.snakeescape.core;

import java.util.List;

/**
 * Slidable ice cube. Keeps moving in the push direction until something stops it.
 */
public final class IceCube extends Pushable {
    
    public IceCube(int id, List<Cell> footprint) {
        super(id, footprint);
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.ICE_CUBE;
    }
}

package io.github.manjago.snakeescape.core;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Arena owning every entity of a level.
 * 
 * Entities are addressed by index; the board only stores indices. Destroyed
 * entities leave a tombstone so indices are never reused within a level.
 */
public class EntityStore {
    
    private final List<Entity> entities = new ArrayList<>();
    private int liveCount = 0;
    
    /**
     * Create an entity with the next free id.
     * 
     * @param factory receives the id and builds the entity
     * @return the stored entity
     */
    public <T extends Entity> T create(IntFunction<T> factory) {
        int id = entities.size();
        T entity = factory.apply(id);
        if (entity.getId() != id) {
            throw new IllegalStateException("Entity built with id " + entity.getId() + ", expected " + id);
        }
        entities.add(entity);
        liveCount++;
        return entity;
    }
    
    /**
     * @return the entity, or null if the id is unknown or destroyed
     */
    @Nullable
    public Entity get(int id) {
        if (id < 0 || id >= entities.size()) {
            return null;
        }
        return entities.get(id);
    }
    
    public boolean isLive(int id) {
        return get(id) != null;
    }
    
    /**
     * Tombstone an entity.
     * 
     * @return true if it was live
     */
    public boolean remove(int id) {
        if (get(id) == null) {
            return false;
        }
        entities.set(id, null);
        liveCount--;
        return true;
    }
    
    /**
     * Live entities of one type, in creation order.
     */
    public <T extends Entity> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Entity entity : entities) {
            if (type.isInstance(entity)) {
                result.add(type.cast(entity));
            }
        }
        return result;
    }
    
    public int size() {
        return liveCount;
    }
    
    @Override
    public String toString() {
        return String.format("EntityStore[live=%d, created=%d]", liveCount, entities.size());
    }
}

package org.tactica.runtime.store;

import org.tactica.runtime.spi.IEntityStore;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;

/**
 * Heap-backed {@link IEntityStore}.
 * <p>
 * Entities are kept in creation order, so queries are deterministic. Queries scan every entity,
 * which is fine for the few dozen entities a single combat involves.
 * <p>
 * Not thread-safe.
 */
public class InMemoryEntityStore implements IEntityStore {

    private final Long2ObjectLinkedOpenHashMap<Reference2ObjectOpenHashMap<Class<?>, Object>> entities =
            new Long2ObjectLinkedOpenHashMap<>();
    private long nextEntityId = 1L;

    @Override
    public long createEntity() {
        long id = nextEntityId++;
        entities.put(id, new Reference2ObjectOpenHashMap<>(4));
        return id;
    }

    @Override
    public void destroyEntity(long entityId) {
        entities.remove(entityId);
    }

    @Override
    public boolean exists(long entityId) {
        return entities.containsKey(entityId);
    }

    @Override
    public <T> void attach(long entityId, Class<T> type, T component) {
        Reference2ObjectOpenHashMap<Class<?>, Object> components = entities.get(entityId);
        if (components == null) {
            throw new IllegalArgumentException("Entity " + entityId + " does not exist");
        }
        components.put(type, type.cast(component));
    }

    @Override
    public <T> T detach(long entityId, Class<T> type) {
        Reference2ObjectOpenHashMap<Class<?>, Object> components = entities.get(entityId);
        if (components == null) {
            return null;
        }
        return type.cast(components.remove(type));
    }

    @Override
    public <T> T get(long entityId, Class<T> type) {
        Reference2ObjectOpenHashMap<Class<?>, Object> components = entities.get(entityId);
        if (components == null) {
            return null;
        }
        return type.cast(components.get(type));
    }

    @Override
    public boolean has(long entityId, Class<?> type) {
        Reference2ObjectOpenHashMap<Class<?>, Object> components = entities.get(entityId);
        return components != null && components.containsKey(type);
    }

    @Override
    public LongList query(Class<?>... componentSet) {
        LongArrayList result = new LongArrayList();
        for (Long2ObjectMap.Entry<Reference2ObjectOpenHashMap<Class<?>, Object>> entry
                : entities.long2ObjectEntrySet()) {
            if (hasAll(entry.getValue(), componentSet)) {
                result.add(entry.getLongKey());
            }
        }
        return result;
    }

    /**
     * @return Number of live entities.
     */
    public int size() {
        return entities.size();
    }

    private static boolean hasAll(Reference2ObjectOpenHashMap<Class<?>, Object> components, Class<?>[] types) {
        for (Class<?> type : types) {
            if (!components.containsKey(type)) {
                return false;
            }
        }
        return true;
    }
}

package org.tactica.runtime.spi;

import it.unimi.dsi.fastutil.longs.LongList;

/**
 * The entity-component store the combat core reads and writes its records through.
 * <p>
 * Entity ids are opaque positive integers assigned by the store; {@code 0} never names an entity.
 * The core never invents or reuses ids itself. Components are keyed by their class, so an entity
 * holds at most one component of each type.
 */
public interface IEntityStore {

    /**
     * @return The id of a newly created, component-less entity.
     */
    long createEntity();

    /**
     * Destroys an entity and all its components. A no-op for unknown ids.
     *
     * @param entityId The entity to destroy.
     */
    void destroyEntity(long entityId);

    /**
     * @param entityId The entity to check.
     * @return {@code true} if the entity exists.
     */
    boolean exists(long entityId);

    /**
     * Attaches a component, replacing any existing component of the same type.
     *
     * @param entityId The target entity.
     * @param type The component type.
     * @param component The component instance.
     * @param <T> Component type.
     * @throws IllegalArgumentException if the entity does not exist.
     */
    <T> void attach(long entityId, Class<T> type, T component);

    /**
     * Detaches a component.
     *
     * @param entityId The target entity.
     * @param type The component type.
     * @param <T> Component type.
     * @return The detached component, or {@code null} if none was attached.
     */
    <T> T detach(long entityId, Class<T> type);

    /**
     * @param entityId The entity to read.
     * @param type The component type.
     * @param <T> Component type.
     * @return The component, or {@code null} if the entity has none of that type.
     */
    <T> T get(long entityId, Class<T> type);

    /**
     * @param entityId The entity to check.
     * @param type The component type.
     * @return {@code true} if the entity has a component of that type.
     */
    boolean has(long entityId, Class<?> type);

    /**
     * Yields every entity carrying all of the given component types, in creation order.
     *
     * @param componentSet The required component types.
     * @return Matching entity ids.
     */
    LongList query(Class<?>... componentSet);
}

package org.tactica.runtime.spatial;

/**
 * Thrown when an entity is expected at a cell of the {@link PositionIndex} but is not there.
 * <p>
 * This is a checked exception: removing or moving an absent entity is a recoverable condition
 * that the caller decides to retry or skip. Plain lookups never throw it, an unoccupied cell is
 * reported as an empty result instead.
 */
public class EntityNotFoundException extends Exception {

    private final long entityId;
    private final GridPosition position;

    /**
     * @param entityId The entity that was looked for.
     * @param position The cell it was expected at.
     * @param message The detail message.
     */
    public EntityNotFoundException(long entityId, GridPosition position, String message) {
        super(message);
        this.entityId = entityId;
        this.position = position;
    }

    public long getEntityId() {
        return entityId;
    }

    public GridPosition getPosition() {
        return position;
    }
}

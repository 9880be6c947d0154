package org.tactica.runtime.action;

import org.tactica.runtime.spatial.PositionIndex;

/**
 * Behavior invoked by a {@link MovementAction}.
 */
@FunctionalInterface
public interface MovementBehavior {

    /**
     * Moves the actor by the given offset.
     *
     * @param actorId The moving entity.
     * @param map The position index the movement is resolved against.
     * @param dx Horizontal offset in cells.
     * @param dy Vertical offset in cells.
     */
    void move(long actorId, PositionIndex map, int dx, int dy);
}

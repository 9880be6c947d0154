package org.tactica.runtime.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.spatial.PositionIndex;

/**
 * Moves an actor by a cell offset.
 *
 * @param actorId The moving entity.
 * @param map The position index the move is resolved against.
 * @param dx Horizontal offset in cells.
 * @param dy Vertical offset in cells.
 * @param behavior The movement implementation, may be {@code null}.
 */
public record MovementAction(long actorId, PositionIndex map, int dx, int dy, MovementBehavior behavior)
        implements Action {

    private static final Logger LOG = LoggerFactory.getLogger(MovementAction.class);

    @Override
    public Variant variant() {
        return Variant.MOVEMENT;
    }

    @Override
    public void execute() {
        if (behavior == null) {
            LOG.warn("Movement action for actor {} has no behavior, skipping", actorId);
            return;
        }
        behavior.move(actorId, map, dx, dy);
    }
}

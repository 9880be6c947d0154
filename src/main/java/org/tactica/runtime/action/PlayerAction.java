package org.tactica.runtime.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.spatial.PositionIndex;

/**
 * A multi-parameter action issued on behalf of a player-controlled actor.
 *
 * @param actorId The acting entity.
 * @param targetId The targeted entity, or {@code 0} for none.
 * @param map The position index the action is resolved against.
 * @param dx Horizontal offset of the target cell.
 * @param dy Vertical offset of the target cell.
 * @param behavior The action implementation, may be {@code null}.
 */
public record PlayerAction(long actorId, long targetId, PositionIndex map, int dx, int dy,
                           PlayerActionBehavior behavior) implements Action {

    private static final Logger LOG = LoggerFactory.getLogger(PlayerAction.class);

    @Override
    public Variant variant() {
        return Variant.PLAYER_ACTION;
    }

    @Override
    public void execute() {
        if (behavior == null) {
            LOG.warn("Player action for actor {} has no behavior, skipping", actorId);
            return;
        }
        behavior.perform(actorId, targetId, map, dx, dy);
    }
}

package org.tactica.runtime.action;

import org.tactica.runtime.spatial.PositionIndex;

/**
 * Behavior invoked by a {@link PlayerAction}.
 * <p>
 * Player actions cover everything that is neither a plain move nor a single-target attack
 * (picking up items, using abilities on a target cell, ...). All parameters are optional in the
 * sense that a behavior may ignore the ones it does not need.
 */
@FunctionalInterface
public interface PlayerActionBehavior {

    /**
     * Performs the player action.
     *
     * @param actorId The acting entity.
     * @param targetId The targeted entity, or {@code 0} if the action has no entity target.
     * @param map The position index the action is resolved against.
     * @param dx Horizontal offset of the target cell relative to the actor.
     * @param dy Vertical offset of the target cell relative to the actor.
     */
    void perform(long actorId, long targetId, PositionIndex map, int dx, int dy);
}

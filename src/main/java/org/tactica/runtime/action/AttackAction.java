package org.tactica.runtime.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attacks a single target entity.
 *
 * @param actorId The attacking entity.
 * @param targetId The defending entity.
 * @param behavior The attack implementation, may be {@code null}.
 */
public record AttackAction(long actorId, long targetId, AttackBehavior behavior) implements Action {

    private static final Logger LOG = LoggerFactory.getLogger(AttackAction.class);

    @Override
    public Variant variant() {
        return Variant.SINGLE_TARGET_ATTACK;
    }

    @Override
    public void execute() {
        if (behavior == null) {
            LOG.warn("Attack action {} -> {} has no behavior, skipping", actorId, targetId);
            return;
        }
        behavior.attack(actorId, targetId);
    }
}

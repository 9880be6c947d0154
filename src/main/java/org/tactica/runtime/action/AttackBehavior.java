package org.tactica.runtime.action;

/**
 * Behavior invoked by an {@link AttackAction}.
 */
@FunctionalInterface
public interface AttackBehavior {

    /**
     * Resolves an attack of one entity against another.
     *
     * @param attackerId The attacking entity.
     * @param defenderId The defending entity.
     */
    void attack(long attackerId, long defenderId);
}

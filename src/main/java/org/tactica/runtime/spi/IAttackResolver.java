package org.tactica.runtime.spi;

/**
 * Computes the effect of one squad attacking another.
 * <p>
 * Damage formulas live outside the combat core. The core only needs the damage total for
 * reporting and whether the defender was destroyed, so it can take the defender off the map.
 */
@FunctionalInterface
public interface IAttackResolver {

    /**
     * @param damageDealt Total damage dealt.
     * @param defenderDestroyed Whether the defending squad has no units left.
     */
    record Outcome(int damageDealt, boolean defenderDestroyed) {}

    /**
     * Applies an attack.
     *
     * @param attackerId The attacking squad.
     * @param defenderId The defending squad.
     * @return The outcome.
     */
    Outcome resolve(long attackerId, long defenderId);
}

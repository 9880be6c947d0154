package org.tactica.runtime.spi;

/**
 * Supplies how far a squad can strike.
 * <p>
 * A squad reaches as far as its longest-ranged unit; unit stats live outside the combat core.
 * Implementations are loaded from configuration and must provide a constructor taking a
 * {@code com.typesafe.config.Config} options block.
 */
@FunctionalInterface
public interface IAttackRangeProvider {

    /**
     * @param squadId The squad.
     * @return Maximum Chebyshev distance to a target, at least 1.
     */
    int getAttackRange(long squadId);
}

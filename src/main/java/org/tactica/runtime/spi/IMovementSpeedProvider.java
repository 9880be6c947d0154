package org.tactica.runtime.spi;

/**
 * Supplies the per-turn movement budget of a squad.
 * <p>
 * Squad speed derives from unit stats, which are computed elsewhere. Implementations are loaded
 * from configuration and must provide a constructor taking a {@code com.typesafe.config.Config}
 * options block.
 */
@FunctionalInterface
public interface IMovementSpeedProvider {

    /**
     * @param squadId The squad.
     * @return Cells the squad may move per turn, never negative.
     */
    int getMovementSpeed(long squadId);
}

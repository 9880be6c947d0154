package org.tactica.runtime.spi;

import org.tactica.runtime.combat.FactionManager;

/**
 * Decides at the end of each round whether the combat is over.
 * <p>
 * Implementations are loaded from configuration and must provide a constructor taking a
 * {@code com.typesafe.config.Config} options block.
 */
@FunctionalInterface
public interface ICombatEndCondition {

    /**
     * @param factions Read access to factions and their squads.
     * @param turnOrder The factions taking part, in turn order.
     * @return {@code true} if the combat should move to resolution.
     */
    boolean isCombatOver(FactionManager factions, long[] turnOrder);
}

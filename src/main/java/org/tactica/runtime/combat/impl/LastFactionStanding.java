package org.tactica.runtime.combat.impl;

import org.tactica.runtime.combat.FactionManager;
import org.tactica.runtime.spi.ICombatEndCondition;

import com.typesafe.config.Config;

/**
 * Ends the combat once fewer than a minimum number of factions still have squads on the map.
 * <p>
 * Configuration options:
 * <ul>
 *   <li>{@code minimum-factions}: Factions that must keep squads for the combat to go on (default: 2)</li>
 * </ul>
 */
public class LastFactionStanding implements ICombatEndCondition {

    private final int minimumFactions;

    public LastFactionStanding(Config options) {
        this.minimumFactions = options.hasPath("minimum-factions") ? options.getInt("minimum-factions") : 2;
        if (minimumFactions < 1) {
            throw new IllegalArgumentException("minimum-factions must be at least 1, got " + minimumFactions);
        }
    }

    @Override
    public boolean isCombatOver(FactionManager factions, long[] turnOrder) {
        int standing = 0;
        for (long factionId : turnOrder) {
            if (factions.hasRemainingSquads(factionId)) {
                standing++;
                if (standing >= minimumFactions) {
                    return false;
                }
            }
        }
        return true;
    }
}

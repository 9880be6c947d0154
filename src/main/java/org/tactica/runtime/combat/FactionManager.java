package org.tactica.runtime.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.model.ActionState;
import org.tactica.runtime.model.Faction;
import org.tactica.runtime.model.MapPosition;
import org.tactica.runtime.spatial.EntityNotFoundException;
import org.tactica.runtime.spatial.GridPosition;
import org.tactica.runtime.spatial.PositionIndex;
import org.tactica.runtime.spi.IEntityStore;

import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Creates factions and assigns squads to them.
 * <p>
 * Placing a squad attaches its {@link MapPosition} and registers it in the {@link PositionIndex};
 * the two are kept in step by routing every squad relocation through this class.
 */
public class FactionManager {

    private static final Logger LOG = LoggerFactory.getLogger(FactionManager.class);

    private final IEntityStore store;
    private final PositionIndex positionIndex;

    public FactionManager(IEntityStore store, PositionIndex positionIndex) {
        this.store = store;
        this.positionIndex = positionIndex;
    }

    /**
     * Creates a faction entity.
     *
     * @param name Display name.
     * @param playerControlled Whether a player issues this faction's orders.
     * @return The new faction id.
     */
    public long createFaction(String name, boolean playerControlled) {
        long factionId = store.createEntity();
        store.attach(factionId, Faction.class, new Faction(factionId, name, playerControlled));
        LOG.debug("Created faction {} '{}' (player={})", factionId, name, playerControlled);
        return factionId;
    }

    /**
     * Puts a squad on the combat map under the given faction. A squad that is already placed is
     * moved to the new position and reassigned.
     *
     * @param factionId The owning faction.
     * @param squadId The squad entity.
     * @param position Where the squad stands.
     * @throws CombatStateException if the faction or squad does not exist, or the squad's recorded
     *         position disagrees with the position index.
     */
    public void addSquadToFaction(long factionId, long squadId, GridPosition position) throws CombatStateException {
        if (CombatQueries.findFaction(store, factionId) == null) {
            throw new CombatStateException("Faction " + factionId + " not found", squadId, factionId);
        }
        if (!store.exists(squadId)) {
            throw new CombatStateException("Squad " + squadId + " not found", squadId, factionId);
        }

        MapPosition existing = CombatQueries.findMapPosition(store, squadId);
        if (existing == null) {
            positionIndex.addEntity(squadId, position);
        } else {
            try {
                positionIndex.moveEntity(squadId, existing.getPosition(), position);
            } catch (EntityNotFoundException e) {
                throw new CombatStateException("Failed to update position of squad " + squadId, squadId, e);
            }
        }
        store.attach(squadId, MapPosition.class, new MapPosition(squadId, factionId, position));
    }

    /**
     * Takes a squad out of combat: removes it from the map and drops its combat records.
     *
     * @param factionId The faction the squad is expected to belong to.
     * @param squadId The squad.
     * @throws CombatStateException if the squad does not exist, is not in combat, or belongs to
     *         another faction.
     */
    public void removeSquadFromFaction(long factionId, long squadId) throws CombatStateException {
        if (!store.exists(squadId)) {
            throw new CombatStateException("Squad " + squadId + " not found", squadId, factionId);
        }
        MapPosition mapPos = CombatQueries.findMapPosition(store, squadId);
        if (mapPos == null) {
            throw new CombatStateException("Squad " + squadId + " is not in combat", squadId, factionId);
        }
        if (mapPos.getFactionId() != factionId) {
            throw new CombatStateException("Squad " + squadId + " does not belong to faction " + factionId,
                    squadId, factionId);
        }

        try {
            positionIndex.removeEntity(squadId, mapPos.getPosition());
        } catch (EntityNotFoundException e) {
            LOG.warn("Squad {} was missing from the position index at {}", squadId, mapPos.getPosition());
        }
        store.detach(squadId, MapPosition.class);
        store.detach(squadId, ActionState.class);
        LOG.debug("Removed squad {} from faction {}", squadId, factionId);
    }

    /**
     * Moves a placed squad, updating both its map record and the position index.
     *
     * @param squadId The squad.
     * @param target The destination.
     * @throws CombatStateException if the squad is not on the map or not where its record says.
     */
    public void relocateSquad(long squadId, GridPosition target) throws CombatStateException {
        MapPosition mapPos = CombatQueries.findMapPosition(store, squadId);
        if (mapPos == null) {
            throw new CombatStateException("Squad " + squadId + " not on map", squadId, 0L);
        }
        try {
            positionIndex.moveEntity(squadId, mapPos.getPosition(), target);
        } catch (EntityNotFoundException e) {
            throw new CombatStateException("Failed to move squad " + squadId, squadId, e);
        }
        mapPos.setPosition(target);
    }

    /**
     * @return The squad's current position.
     * @throws CombatStateException if the squad is not on the map.
     */
    public GridPosition getSquadPosition(long squadId) throws CombatStateException {
        MapPosition mapPos = CombatQueries.findMapPosition(store, squadId);
        if (mapPos == null) {
            throw new CombatStateException("Squad " + squadId + " not on map", squadId, 0L);
        }
        return mapPos.getPosition();
    }

    public LongList getFactionSquads(long factionId) {
        return CombatQueries.getSquadsForFaction(store, factionId);
    }

    public boolean hasRemainingSquads(long factionId) {
        return !getFactionSquads(factionId).isEmpty();
    }

    /**
     * @return The owning faction, or {@code 0} if the squad is not on the map.
     */
    public long getFactionOwner(long squadId) {
        return CombatQueries.getFactionOwner(store, squadId);
    }

    public boolean isSquad(long entityId) {
        return CombatQueries.isSquad(store, entityId);
    }

    public Faction getFaction(long factionId) {
        return CombatQueries.findFaction(store, factionId);
    }

    public String getFactionName(long factionId) {
        Faction faction = getFaction(factionId);
        return faction == null ? "Unknown" : faction.name();
    }

    /**
     * @return All faction ids, in creation order.
     */
    public LongList getFactionIds() {
        return store.query(Faction.class);
    }
}

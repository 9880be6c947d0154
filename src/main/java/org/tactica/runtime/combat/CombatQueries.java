package org.tactica.runtime.combat;

import org.tactica.runtime.model.ActionState;
import org.tactica.runtime.model.Faction;
import org.tactica.runtime.model.MapPosition;
import org.tactica.runtime.model.TurnState;
import org.tactica.runtime.spi.IEntityStore;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Record lookups over the entity store.
 * <p>
 * Squad records ({@link MapPosition}, {@link ActionState}) live on the squad entity itself and
 * faction records on the faction entity, so most lookups are direct. Lookups by faction scan all
 * placed squads.
 */
public final class CombatQueries {

    private CombatQueries() {
    }

    /**
     * @return The squad's map record, or {@code null} if the squad is not on the combat map.
     */
    public static MapPosition findMapPosition(IEntityStore store, long squadId) {
        return store.get(squadId, MapPosition.class);
    }

    /**
     * @return The squad's turn budget, or {@code null} if it has none.
     */
    public static ActionState findActionState(IEntityStore store, long squadId) {
        return store.get(squadId, ActionState.class);
    }

    /**
     * @return The faction record, or {@code null} if the id does not name a faction.
     */
    public static Faction findFaction(IEntityStore store, long factionId) {
        return store.get(factionId, Faction.class);
    }

    /**
     * @return The entity holding the {@link TurnState}, or {@code 0} if no combat is running.
     */
    public static long findTurnStateEntity(IEntityStore store) {
        LongList ids = store.query(TurnState.class);
        return ids.isEmpty() ? 0L : ids.getLong(0);
    }

    /**
     * @return The running combat's turn state, or {@code null}.
     */
    public static TurnState findTurnState(IEntityStore store) {
        long entity = findTurnStateEntity(store);
        return entity == 0L ? null : store.get(entity, TurnState.class);
    }

    /**
     * @return The faction owning the squad, or {@code 0} if the squad is not on the map.
     */
    public static long getFactionOwner(IEntityStore store, long squadId) {
        MapPosition mapPos = findMapPosition(store, squadId);
        return mapPos == null ? 0L : mapPos.getFactionId();
    }

    /**
     * @return All squads on the map owned by the faction, in creation order.
     */
    public static LongList getSquadsForFaction(IEntityStore store, long factionId) {
        LongArrayList result = new LongArrayList();
        LongList placed = store.query(MapPosition.class);
        for (int i = 0; i < placed.size(); i++) {
            long squadId = placed.getLong(i);
            if (store.get(squadId, MapPosition.class).getFactionId() == factionId) {
                result.add(squadId);
            }
        }
        return result;
    }

    /**
     * @return {@code true} if the entity is a squad on the combat map.
     */
    public static boolean isSquad(IEntityStore store, long entityId) {
        return store.has(entityId, MapPosition.class);
    }
}

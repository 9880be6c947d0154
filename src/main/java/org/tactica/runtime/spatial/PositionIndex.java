package org.tactica.runtime.spatial;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Spatial grid mapping each occupied cell to the entities standing on it.
 * <p>
 * Cells are keyed by {@link GridPosition#pack()} for O(1) point lookup. A reverse map from entity
 * id to cell enforces that an entity occupies at most one cell at a time. Cells whose last
 * occupant is removed are dropped from the grid immediately, so no empty buckets persist.
 * <p>
 * Entity id {@code 0} is reserved as the "nothing here" value returned by {@link #getEntityIDAt}.
 * <p>
 * Not thread-safe. Each combat owns its own index.
 */
public class PositionIndex {

    private static final Logger LOG = LoggerFactory.getLogger(PositionIndex.class);

    /** Returned by {@link #getEntityIDAt(GridPosition)} for unoccupied cells. */
    public static final long NO_ENTITY = 0L;

    private static final long UNPLACED = Long.MIN_VALUE;

    private Long2ObjectOpenHashMap<LongArrayList> grid = new Long2ObjectOpenHashMap<>();
    private Long2LongOpenHashMap cellByEntity = newCellByEntity();

    /**
     * Returns the first entity at the given cell.
     *
     * @param pos The cell to look up.
     * @return The first occupant's id, or {@link #NO_ENTITY} if the cell is empty.
     */
    public long getEntityIDAt(GridPosition pos) {
        LongArrayList ids = grid.get(pos.pack());
        if (ids == null || ids.isEmpty()) {
            return NO_ENTITY;
        }
        return ids.getLong(0);
    }

    /**
     * Returns all entities at the given cell, in placement order.
     *
     * @param pos The cell to look up.
     * @return A copy of the occupant list; empty if the cell is unoccupied.
     */
    public LongList getAllEntityIDsAt(GridPosition pos) {
        LongArrayList ids = grid.get(pos.pack());
        if (ids == null) {
            return new LongArrayList();
        }
        return new LongArrayList(ids);
    }

    /**
     * Places an entity on a cell. A no-op if the entity is already registered at that cell.
     *
     * @param entityId The entity to place. Must not be {@link #NO_ENTITY}.
     * @param pos The cell to place it on.
     * @throws IllegalArgumentException if {@code entityId} is {@link #NO_ENTITY}.
     * @throws IllegalStateException if the entity is already placed on a different cell.
     */
    public void addEntity(long entityId, GridPosition pos) {
        if (entityId == NO_ENTITY) {
            throw new IllegalArgumentException("Entity id 0 is reserved");
        }
        long key = pos.pack();
        long current = cellByEntity.get(entityId);
        if (current == key) {
            return;
        }
        if (current != UNPLACED) {
            throw new IllegalStateException("Entity " + entityId + " is already placed at "
                    + GridPosition.unpack(current) + ", use moveEntity to relocate it to " + pos);
        }
        grid.computeIfAbsent(key, k -> new LongArrayList(2)).add(entityId);
        cellByEntity.put(entityId, key);
    }

    /**
     * Removes an entity from a cell. Removing the last occupant deletes the cell.
     *
     * @param entityId The entity to remove.
     * @param pos The cell it is expected at.
     * @throws EntityNotFoundException if the cell is empty or does not contain the entity.
     */
    public void removeEntity(long entityId, GridPosition pos) throws EntityNotFoundException {
        long key = pos.pack();
        LongArrayList ids = grid.get(key);
        if (ids == null) {
            throw new EntityNotFoundException(entityId, pos, "No entities at position " + pos);
        }
        if (!ids.rem(entityId)) {
            throw new EntityNotFoundException(entityId, pos,
                    "Entity " + entityId + " not found at position " + pos);
        }
        if (ids.isEmpty()) {
            grid.remove(key);
        }
        cellByEntity.remove(entityId);
    }

    /**
     * Moves an entity between cells. A no-op if both cells are equal.
     * <p>
     * Composed as remove-then-add. If the removal fails nothing is changed.
     *
     * @param entityId The entity to move.
     * @param oldPos The cell it currently occupies.
     * @param newPos The destination cell.
     * @throws EntityNotFoundException if the entity is not at {@code oldPos}.
     */
    public void moveEntity(long entityId, GridPosition oldPos, GridPosition newPos) throws EntityNotFoundException {
        if (oldPos.equals(newPos)) {
            return;
        }
        removeEntity(entityId, oldPos);
        addEntity(entityId, newPos);
        LOG.trace("Moved entity {} from {} to {}", entityId, oldPos, newPos);
    }

    /**
     * Collects all entities within a Chebyshev radius of a cell.
     * <p>
     * Walks the full {@code (2r+1) x (2r+1)} bounding square, so the cost is O(r²) regardless of
     * how many cells are occupied.
     *
     * @param center The center cell.
     * @param radius The radius in cells, {@code 0} meaning the center cell only.
     * @return The ids found, row-major by x then y.
     * @throws IllegalArgumentException if {@code radius} is negative.
     */
    public LongList getEntitiesInRadius(GridPosition center, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must not be negative: " + radius);
        }
        LongArrayList result = new LongArrayList();
        // Bounds are clamped to the int range; long counters keep the loops from wrapping.
        long minX = Math.max((long) center.x() - radius, Integer.MIN_VALUE);
        long maxX = Math.min((long) center.x() + radius, Integer.MAX_VALUE);
        long minY = Math.max((long) center.y() - radius, Integer.MIN_VALUE);
        long maxY = Math.min((long) center.y() + radius, Integer.MAX_VALUE);
        for (long x = minX; x <= maxX; x++) {
            for (long y = minY; y <= maxY; y++) {
                GridPosition pos = new GridPosition((int) x, (int) y);
                if (center.chebyshevDistance(pos) <= radius) {
                    LongArrayList ids = grid.get(pos.pack());
                    if (ids != null) {
                        result.addAll(ids);
                    }
                }
            }
        }
        return result;
    }

    /**
     * @param entityId The entity to look up.
     * @return {@code true} if the entity occupies some cell.
     */
    public boolean contains(long entityId) {
        return cellByEntity.containsKey(entityId);
    }

    /**
     * @param entityId The entity to look up.
     * @return The cell the entity occupies, or {@code null} if it is not placed.
     */
    public GridPosition positionOf(long entityId) {
        long key = cellByEntity.get(entityId);
        return key == UNPLACED ? null : GridPosition.unpack(key);
    }

    /**
     * @return Total number of placed entities.
     */
    public int getEntityCount() {
        int count = 0;
        for (LongArrayList ids : grid.values()) {
            count += ids.size();
        }
        return count;
    }

    /**
     * @return All cells holding at least one entity, in no particular order.
     */
    public List<GridPosition> getOccupiedPositions() {
        List<GridPosition> positions = new ArrayList<>(grid.size());
        for (Long2ObjectMap.Entry<LongArrayList> entry : grid.long2ObjectEntrySet()) {
            positions.add(GridPosition.unpack(entry.getLongKey()));
        }
        return positions;
    }

    /**
     * @param pos The cell to check.
     * @return {@code true} if the grid holds an entry for the cell.
     */
    public boolean isOccupied(GridPosition pos) {
        return grid.containsKey(pos.pack());
    }

    /**
     * Drops every entry by swapping in fresh backing maps.
     */
    public void clear() {
        grid = new Long2ObjectOpenHashMap<>();
        cellByEntity = newCellByEntity();
    }

    private static Long2LongOpenHashMap newCellByEntity() {
        Long2LongOpenHashMap map = new Long2LongOpenHashMap();
        map.defaultReturnValue(UNPLACED);
        return map;
    }
}

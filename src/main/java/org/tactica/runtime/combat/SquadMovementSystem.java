package org.tactica.runtime.combat;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.model.ActionState;
import org.tactica.runtime.spatial.GridPosition;
import org.tactica.runtime.spatial.PositionIndex;

/**
 * Moves squads across the combat grid.
 * <p>
 * Movement is 8-directional: a move costs the Chebyshev distance between start and destination,
 * charged against the squad's remaining movement for the turn. A squad may end its move on an
 * empty cell or on a cell held by a friendly squad, never on an enemy squad or a non-squad
 * occupant.
 */
public class SquadMovementSystem {

    private static final Logger LOG = LoggerFactory.getLogger(SquadMovementSystem.class);

    private final PositionIndex positionIndex;
    private final FactionManager factions;
    private final TurnManager turns;

    public SquadMovementSystem(PositionIndex positionIndex, FactionManager factions, TurnManager turns) {
        this.positionIndex = positionIndex;
        this.factions = factions;
        this.turns = turns;
    }

    /**
     * @param squadId The moving squad.
     * @param target The destination cell.
     * @return {@code true} if the destination is free or held by a squad of the same faction.
     */
    public boolean canMoveTo(long squadId, GridPosition target) {
        long occupant = positionIndex.getEntityIDAt(target);
        if (occupant == PositionIndex.NO_ENTITY || occupant == squadId) {
            return true;
        }
        if (!factions.isSquad(occupant)) {
            return false;
        }
        return factions.getFactionOwner(occupant) == factions.getFactionOwner(squadId);
    }

    /**
     * Moves a squad and charges the distance against its movement budget.
     *
     * @param squadId The squad.
     * @param target The destination.
     * @return The movement charged.
     * @throws CombatStateException if the squad cannot move there: no movement left, not enough
     *         movement, destination blocked, or the squad is not on the map.
     */
    public int moveSquad(long squadId, GridPosition target) throws CombatStateException {
        if (!turns.canSquadMove(squadId)) {
            throw new CombatStateException("Squad " + squadId + " has no movement remaining", squadId, 0L);
        }
        GridPosition current = factions.getSquadPosition(squadId);
        int cost = current.chebyshevDistance(target);

        ActionState state = turns.getActionState(squadId)
                .orElseThrow(() -> new CombatStateException("No action state for squad " + squadId, squadId, 0L));
        if (state.getMovementRemaining() < cost) {
            throw new CombatStateException("Insufficient movement: need " + cost + ", have "
                    + state.getMovementRemaining(), squadId, 0L);
        }
        if (!canMoveTo(squadId, target)) {
            throw new CombatStateException("Cannot move squad " + squadId + " to " + target, squadId, 0L);
        }

        factions.relocateSquad(squadId, target);
        turns.decrementMovementRemaining(squadId, cost);
        turns.markSquadAsMoved(squadId);
        LOG.debug("Squad {} moved {} -> {} (cost {})", squadId, current, target, cost);
        return cost;
    }

    /**
     * Lists the cells the squad could move to with its remaining movement.
     *
     * @param squadId The squad.
     * @return Reachable destinations, excluding the current cell; empty if the squad cannot move.
     */
    public List<GridPosition> getValidMovementTiles(long squadId) {
        List<GridPosition> tiles = new ArrayList<>();
        int range = turns.getActionState(squadId).map(ActionState::getMovementRemaining).orElse(0);
        if (range <= 0) {
            return tiles;
        }
        GridPosition current;
        try {
            current = factions.getSquadPosition(squadId);
        } catch (CombatStateException e) {
            LOG.debug("No movement tiles for squad {}: {}", squadId, e.getMessage());
            return tiles;
        }
        long minX = Math.max((long) current.x() - range, Integer.MIN_VALUE);
        long maxX = Math.min((long) current.x() + range, Integer.MAX_VALUE);
        long minY = Math.max((long) current.y() - range, Integer.MIN_VALUE);
        long maxY = Math.min((long) current.y() + range, Integer.MAX_VALUE);
        for (long x = minX; x <= maxX; x++) {
            for (long y = minY; y <= maxY; y++) {
                GridPosition candidate = new GridPosition((int) x, (int) y);
                if (!candidate.equals(current) && canMoveTo(squadId, candidate)) {
                    tiles.add(candidate);
                }
            }
        }
        return tiles;
    }
}

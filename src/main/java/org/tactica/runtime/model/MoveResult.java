package org.tactica.runtime.model;

import org.tactica.runtime.spatial.GridPosition;

/**
 * Outcome of a resolved squad move, reported to combat log listeners.
 *
 * @param success Whether the squad moved.
 * @param errorReason Why it did not, or {@code null} on success.
 * @param squadId The moving squad.
 * @param newPosition The requested destination.
 * @param movementCost Movement charged, in cells.
 * @param movementRemaining Movement left after the move.
 */
public record MoveResult(boolean success, String errorReason, long squadId, GridPosition newPosition,
                         int movementCost, int movementRemaining) {

    public static MoveResult failure(long squadId, GridPosition newPosition, String reason) {
        return new MoveResult(false, reason, squadId, newPosition, 0, 0);
    }

    public static MoveResult success(long squadId, GridPosition newPosition, int movementCost, int movementRemaining) {
        return new MoveResult(true, null, squadId, newPosition, movementCost, movementRemaining);
    }
}

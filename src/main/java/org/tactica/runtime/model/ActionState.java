package org.tactica.runtime.model;

/**
 * Per-turn action budget of a squad. Attached to the squad entity while a combat is running.
 */
public class ActionState {

    private final long squadId;
    private boolean hasActed;
    private boolean hasMoved;
    private int movementRemaining;

    public ActionState(long squadId) {
        this.squadId = squadId;
    }

    public long getSquadId() {
        return squadId;
    }

    public boolean hasActed() {
        return hasActed;
    }

    public void setHasActed(boolean hasActed) {
        this.hasActed = hasActed;
    }

    public boolean hasMoved() {
        return hasMoved;
    }

    public void setHasMoved(boolean hasMoved) {
        this.hasMoved = hasMoved;
    }

    public int getMovementRemaining() {
        return movementRemaining;
    }

    /**
     * @param movementRemaining Remaining movement in cells.
     * @throws IllegalArgumentException if negative.
     */
    public void setMovementRemaining(int movementRemaining) {
        if (movementRemaining < 0) {
            throw new IllegalArgumentException("Movement remaining must not be negative: " + movementRemaining);
        }
        this.movementRemaining = movementRemaining;
    }

    /**
     * @return {@code true} once the squad has used its action and has no movement left.
     */
    public boolean isExhausted() {
        return hasActed && movementRemaining == 0;
    }
}

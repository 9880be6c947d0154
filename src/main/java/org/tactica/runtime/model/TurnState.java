package org.tactica.runtime.model;

import java.util.Arrays;

/**
 * Turn bookkeeping of one active combat. Exactly one instance exists while a combat runs.
 */
public class TurnState {

    private final long[] turnOrder;
    private int currentTurnIndex;
    private int currentRound;
    private boolean combatActive;
    private CombatPhase phase;

    /**
     * @param turnOrder Faction ids in the order they take turns; copied.
     */
    public TurnState(long[] turnOrder) {
        this.turnOrder = Arrays.copyOf(turnOrder, turnOrder.length);
        this.currentTurnIndex = 0;
        this.currentRound = 1;
        this.combatActive = true;
        this.phase = CombatPhase.COMBAT_ACTIVE;
    }

    /**
     * @return A copy of the turn order.
     */
    public long[] getTurnOrder() {
        return Arrays.copyOf(turnOrder, turnOrder.length);
    }

    public int getTurnOrderLength() {
        return turnOrder.length;
    }

    public long getFactionAt(int index) {
        return turnOrder[index];
    }

    public int getCurrentTurnIndex() {
        return currentTurnIndex;
    }

    public void setCurrentTurnIndex(int currentTurnIndex) {
        this.currentTurnIndex = currentTurnIndex;
    }

    public int getCurrentRound() {
        return currentRound;
    }

    public void setCurrentRound(int currentRound) {
        this.currentRound = currentRound;
    }

    public boolean isCombatActive() {
        return combatActive;
    }

    public void setCombatActive(boolean combatActive) {
        this.combatActive = combatActive;
    }

    public CombatPhase getPhase() {
        return phase;
    }

    public void setPhase(CombatPhase phase) {
        this.phase = phase;
    }
}

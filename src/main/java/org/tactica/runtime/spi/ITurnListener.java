package org.tactica.runtime.spi;

import org.tactica.runtime.model.CombatPhase;

/**
 * Observer of turn state machine transitions. All callbacks run synchronously on the simulation
 * thread, after the transition has been applied.
 */
public interface ITurnListener {

    /**
     * @param from The previous phase.
     * @param to The new phase.
     */
    default void onPhaseChanged(CombatPhase from, CombatPhase to) {
    }

    /**
     * Called when a round wraps around, before the first faction of the new round is reset.
     *
     * @param round The new round number.
     */
    default void onRoundStarted(int round) {
    }

    /**
     * @param factionId The faction whose turn begins.
     * @param round The current round.
     */
    default void onFactionTurnStarted(long factionId, int round) {
    }
}

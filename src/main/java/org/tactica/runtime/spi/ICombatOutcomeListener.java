package org.tactica.runtime.spi;

import org.tactica.runtime.model.AttackResult;
import org.tactica.runtime.model.MoveResult;

/**
 * Receives combat outcomes as plain values. Formatting and routing them (battle log, UI) is up
 * to the implementation.
 */
public interface ICombatOutcomeListener {

    default void onAttackResolved(AttackResult result) {
    }

    default void onMoveResolved(MoveResult result) {
    }
}

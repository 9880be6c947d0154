package org.tactica.runtime.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tactica.test.utils.CombatTestUtils.noopMove;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tactica.runtime.action.ActionKind;
import org.tactica.runtime.action.AttackAction;
import org.tactica.runtime.action.MovementAction;

/**
 * Unit tests for {@link ActionQueue}: FIFO execution, kind deduplication and action point accounting.
 */
public class ActionQueueTest {

    @Test
    @Tag("unit")
    void executesInInsertionOrderAndDeductsCosts() {
        List<String> log = new ArrayList<>();
        ActionQueue queue = new ActionQueue(1L, 20);
        queue.addAction(new MovementAction(1L, null, 1, 0, (id, map, dx, dy) -> log.add("move")), 5, ActionKind.MOVEMENT);
        queue.addAction(new AttackAction(1L, 2L, (a, d) -> log.add("attack")), 10, ActionKind.ATTACK);

        assertThat(queue.executeAction()).isTrue();
        assertThat(queue.getTotalActionPoints()).isEqualTo(15);
        assertThat(queue.executeAction()).isTrue();
        assertThat(queue.getTotalActionPoints()).isEqualTo(5);

        assertThat(log).containsExactly("move", "attack");
        assertThat(queue.numOfActions()).isZero();
    }

    @Test
    @Tag("unit")
    void dropsSecondActionOfSameKind() {
        ActionQueue queue = new ActionQueue(1L, 10);

        assertThat(queue.addAction(noopMove(1L), 2, ActionKind.MOVEMENT)).isEqualTo(SubmissionResult.ACCEPTED);
        assertThat(queue.addAction(noopMove(1L), 3, ActionKind.MOVEMENT)).isEqualTo(SubmissionResult.DEDUPLICATED);

        assertThat(queue.numOfActions()).isEqualTo(1);
        assertThat(queue.peek()).hasValueSatisfying(e -> assertThat(e.cost()).isEqualTo(2));
    }

    @Test
    @Tag("unit")
    void kindCanBeQueuedAgainAfterItWasConsumed() {
        ActionQueue queue = new ActionQueue(1L, 10);
        queue.addAction(noopMove(1L), 2, ActionKind.MOVEMENT);
        queue.executeAction();

        assertThat(queue.hasAction(ActionKind.MOVEMENT)).isFalse();
        assertThat(queue.addAction(noopMove(1L), 2, ActionKind.MOVEMENT)).isEqualTo(SubmissionResult.ACCEPTED);
    }

    @Test
    @Tag("unit")
    void differentKindsCoexist() {
        ActionQueue queue = new ActionQueue(1L, 10);
        queue.addAction(noopMove(1L), 1, ActionKind.MOVEMENT);
        queue.addAction(noopMove(1L), 1, ActionKind.MELEE_ATTACK);
        queue.addAction(noopMove(1L), 1, ActionKind.RANGED_ATTACK);

        assertThat(queue.numOfActions()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveCostWithoutChangingTheQueue() {
        ActionQueue queue = new ActionQueue(1L, 10);

        assertThatThrownBy(() -> queue.addAction(noopMove(1L), 0, ActionKind.MOVEMENT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> queue.addAction(noopMove(1L), -4, ActionKind.ATTACK))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(queue.numOfActions()).isZero();
        assertThat(queue.hasAction(ActionKind.MOVEMENT)).isFalse();
    }

    @Test
    @Tag("unit")
    void balanceMayGoNegative() {
        ActionQueue queue = new ActionQueue(1L, 3);
        queue.addAction(noopMove(1L), 5, ActionKind.MOVEMENT);

        queue.executeAction();

        assertThat(queue.getTotalActionPoints()).isEqualTo(-2);
    }

    @Test
    @Tag("unit")
    void emptyQueueOperationsAreNoOps() {
        ActionQueue queue = new ActionQueue(1L, 10);

        assertThat(queue.executeAction()).isFalse();
        assertThat(queue.pop()).isFalse();
        assertThat(queue.peek()).isEmpty();
        assertThat(queue.getTotalActionPoints()).isEqualTo(10);
    }

    @Test
    @Tag("unit")
    void entryIsPoppedEvenIfTheActionThrows() {
        ActionQueue queue = new ActionQueue(1L, 10);
        queue.addAction(new AttackAction(1L, 2L, (a, d) -> {
            throw new IllegalStateException("boom");
        }), 4, ActionKind.ATTACK);

        assertThatThrownBy(queue::executeAction).isInstanceOf(IllegalStateException.class);

        assertThat(queue.numOfActions()).isZero();
        assertThat(queue.hasAction(ActionKind.ATTACK)).isFalse();
        assertThat(queue.getTotalActionPoints()).isEqualTo(6);
    }

    @Test
    @Tag("unit")
    void clearKeepsTheBalance() {
        ActionQueue queue = new ActionQueue(1L, 10);
        queue.addAction(noopMove(1L), 1, ActionKind.MOVEMENT);

        queue.clear();
        queue.addActionPoints(5);

        assertThat(queue.numOfActions()).isZero();
        assertThat(queue.hasAction(ActionKind.MOVEMENT)).isFalse();
        assertThat(queue.getTotalActionPoints()).isEqualTo(15);
    }
}

package org.tactica.runtime.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tactica.test.utils.CombatTestUtils.noopMove;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tactica.runtime.action.ActionKind;
import org.tactica.runtime.action.AttackAction;
import org.tactica.runtime.action.MovementAction;

public class ActionControllerTest {

    private ActionController controller;
    private List<String> executed;

    @BeforeEach
    void setUp() {
        controller = new ActionController();
        executed = new ArrayList<>();
    }

    private MovementAction recordingMove(String label) {
        return new MovementAction(0L, null, 0, 0, (id, map, dx, dy) -> executed.add(label));
    }

    private AttackAction recordingAttack(String label) {
        return new AttackAction(0L, 0L, (a, d) -> executed.add(label));
    }

    @Test
    @Tag("unit")
    void highestBalanceRunsFirst() {
        ActionQueue low = new ActionQueue(1L, 5);
        low.addAction(recordingMove("low"), 1, ActionKind.MOVEMENT);
        ActionQueue high = new ActionQueue(2L, 50);
        high.addAction(recordingMove("high"), 1, ActionKind.MOVEMENT);

        controller.addActionQueue(low);
        controller.addActionQueue(high);
        controller.executeFirst();

        assertThat(executed).containsExactly("high");
        assertThat(high.getTotalActionPoints()).isEqualTo(49);
        assertThat(low.getTotalActionPoints()).isEqualTo(5);
    }

    @Test
    @Tag("unit")
    void equalBalanceFavoursTheLaterRegistration() {
        ActionQueue first = new ActionQueue(1L, 10);
        first.addAction(recordingMove("first"), 1, ActionKind.MOVEMENT);
        ActionQueue second = new ActionQueue(2L, 10);
        second.addAction(recordingMove("second"), 1, ActionKind.MOVEMENT);

        controller.addActionQueue(first);
        controller.addActionQueue(second);

        assertThat(controller.snapshot()).containsExactly(second, first);
        controller.executeFirst();
        assertThat(executed).containsExactly("second");
    }

    @Test
    @Tag("unit")
    void interleavesQueuesByRemainingBalance() {
        // A=20 with move(5) and attack(10), B=15 with move(3)
        ActionQueue a = new ActionQueue(1L, 20);
        a.addAction(recordingMove("A move"), 5, ActionKind.MOVEMENT);
        a.addAction(recordingAttack("A attack"), 10, ActionKind.ATTACK);
        ActionQueue b = new ActionQueue(2L, 15);
        b.addAction(recordingMove("B move"), 3, ActionKind.MOVEMENT);
        controller.addActionQueue(a);
        controller.addActionQueue(b);

        controller.executeFirst();
        assertThat(a.getTotalActionPoints()).isEqualTo(15);
        assertThat(controller.peekFirst()).containsSame(b);

        controller.executeFirst();
        assertThat(b.getTotalActionPoints()).isEqualTo(12);

        controller.executeFirst();
        assertThat(a.getTotalActionPoints()).isEqualTo(5);

        assertThat(executed).containsExactly("A move", "B move", "A attack");
        assertThat(controller.snapshot()).containsExactly(b, a);
    }

    @Test
    @Tag("unit")
    void emptyHeadQueueBlocksExecution() {
        ActionQueue idle = new ActionQueue(1L, 100);
        ActionQueue busy = new ActionQueue(2L, 10);
        busy.addAction(recordingMove("busy"), 1, ActionKind.MOVEMENT);
        controller.addActionQueue(idle);
        controller.addActionQueue(busy);

        assertThat(controller.executeFirst()).isFalse();
        assertThat(executed).isEmpty();
        assertThat(controller.hasPendingActions()).isTrue();

        assertThat(controller.cleanController()).isEqualTo(1);
        assertThat(controller.executeFirst()).isTrue();
        assertThat(executed).containsExactly("busy");
    }

    @Test
    @Tag("unit")
    void executeFirstOnEmptyControllerIsANoOp() {
        assertThat(controller.executeFirst()).isFalse();
        assertThat(controller.cleanController()).isZero();
        assertThat(controller.peekFirst()).isEmpty();
    }

    @Test
    @Tag("unit")
    void registeringTheSameInstanceTwiceKeepsOneRegistration() {
        ActionQueue queue = new ActionQueue(1L, 10);

        QueueHandle first = controller.addActionQueue(queue);
        QueueHandle second = controller.addActionQueue(queue);

        assertThat(second).isEqualTo(first);
        assertThat(controller.size()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void distinctInstancesWithEqualStateAreDistinctRegistrations() {
        controller.addActionQueue(new ActionQueue(1L, 10));
        controller.addActionQueue(new ActionQueue(1L, 10));

        assertThat(controller.size()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void cleanControllerKeepsOrderOfRemainingQueues() {
        ActionQueue a = new ActionQueue(1L, 30);
        a.addAction(noopMove(1L), 1, ActionKind.MOVEMENT);
        ActionQueue empty = new ActionQueue(2L, 20);
        ActionQueue c = new ActionQueue(3L, 10);
        c.addAction(noopMove(3L), 1, ActionKind.MOVEMENT);
        controller.addActionQueue(a);
        controller.addActionQueue(empty);
        controller.addActionQueue(c);

        controller.cleanController();

        assertThat(controller.snapshot()).containsExactly(a, c);
    }

    @Test
    @Tag("unit")
    void removedQueueHandleBecomesStale() {
        ActionQueue queue = new ActionQueue(1L, 10);
        QueueHandle handle = controller.addActionQueue(queue);

        assertThat(controller.removeActionQueue(handle)).isTrue();

        assertThat(controller.get(handle)).isEmpty();
        assertThat(controller.contains(handle)).isFalse();
        assertThat(controller.removeActionQueue(handle)).isFalse();
    }

    @Test
    @Tag("unit")
    void reusedSlotDoesNotResurrectOldHandle() {
        QueueHandle old = controller.addActionQueue(new ActionQueue(1L, 10));
        controller.removeActionQueue(old);
        ActionQueue replacement = new ActionQueue(2L, 10);
        QueueHandle fresh = controller.addActionQueue(replacement);

        assertThat(fresh.slot()).isEqualTo(old.slot());
        assertThat(controller.get(old)).isEmpty();
        assertThat(controller.get(fresh)).containsSame(replacement);
    }

    @Test
    @Tag("unit")
    void removesQueueByOwner() {
        ActionQueue a = new ActionQueue(1L, 10);
        ActionQueue b = new ActionQueue(2L, 10);
        controller.addActionQueue(a);
        controller.addActionQueue(b);

        assertThat(controller.removeActionQueueFor(1L)).isTrue();
        assertThat(controller.removeActionQueueFor(1L)).isFalse();
        assertThat(controller.snapshot()).containsExactly(b);
        assertThat(controller.handleOf(a)).isEmpty();
    }

    @Test
    @Tag("unit")
    void resetActionPointsReordersQueues() {
        ActionQueue a = new ActionQueue(1L, 50);
        ActionQueue b = new ActionQueue(2L, 5);
        controller.addActionQueue(a);
        controller.addActionQueue(b);

        controller.resetActionPoints(10);

        assertThat(a.getTotalActionPoints()).isEqualTo(10);
        assertThat(b.getTotalActionPoints()).isEqualTo(10);
        assertThat(controller.snapshot()).containsExactly(b, a);
    }

    @Test
    @Tag("unit")
    void resetQueuesDropsEntriesButKeepsRegistrations() {
        ActionQueue a = new ActionQueue(1L, 10);
        a.addAction(noopMove(1L), 1, ActionKind.MOVEMENT);
        controller.addActionQueue(a);

        controller.resetQueues();

        assertThat(controller.size()).isEqualTo(1);
        assertThat(controller.hasPendingActions()).isFalse();
    }

    @Test
    @Tag("unit")
    void failingActionIsConsumedAndOrderIsRestored() {
        ActionQueue failing = new ActionQueue(1L, 20);
        failing.addAction(new AttackAction(1L, 2L, (a, d) -> {
            throw new IllegalStateException("boom");
        }), 15, ActionKind.ATTACK);
        ActionQueue other = new ActionQueue(2L, 10);
        controller.addActionQueue(failing);
        controller.addActionQueue(other);

        assertThatThrownBy(controller::executeFirst).isInstanceOf(IllegalStateException.class);

        assertThat(failing.numOfActions()).isZero();
        assertThat(controller.snapshot()).containsExactly(other, failing);
    }

    @Test
    @Tag("unit")
    void rejectsNullQueue() {
        assertThatThrownBy(() -> controller.addActionQueue(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @Tag("unit")
    void clearInvalidatesAllHandles() {
        QueueHandle handle = controller.addActionQueue(new ActionQueue(1L, 10));

        controller.clear();

        assertThat(controller.size()).isZero();
        assertThat(controller.get(handle)).isEmpty();
    }
}

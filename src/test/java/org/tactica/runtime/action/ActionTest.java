package org.tactica.runtime.action;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tactica.runtime.spatial.PositionIndex;

public class ActionTest {

    @Test
    @Tag("unit")
    void movementActionPassesItsArgumentsToTheBehavior() {
        MovementBehavior behavior = mock(MovementBehavior.class);
        PositionIndex map = new PositionIndex();

        Action action = new MovementAction(7L, map, 2, -1, behavior);
        action.execute();

        verify(behavior).move(7L, map, 2, -1);
        verifyNoMoreInteractions(behavior);
        assertThat(action.variant()).isEqualTo(Action.Variant.MOVEMENT);
        assertThat(action.actorId()).isEqualTo(7L);
    }

    @Test
    @Tag("unit")
    void attackActionPassesAttackerAndDefender() {
        AttackBehavior behavior = mock(AttackBehavior.class);

        Action action = new AttackAction(3L, 9L, behavior);
        action.execute();

        verify(behavior).attack(3L, 9L);
        assertThat(action.variant()).isEqualTo(Action.Variant.SINGLE_TARGET_ATTACK);
    }

    @Test
    @Tag("unit")
    void playerActionPassesAllFiveArguments() {
        PlayerActionBehavior behavior = mock(PlayerActionBehavior.class);
        PositionIndex map = new PositionIndex();

        Action action = new PlayerAction(1L, 2L, map, 0, 3, behavior);
        action.execute();

        verify(behavior).perform(1L, 2L, map, 0, 3);
        assertThat(action.variant()).isEqualTo(Action.Variant.PLAYER_ACTION);
    }

    @Test
    @Tag("unit")
    void missingBehaviorIsANoOp() {
        assertThatCode(() -> new MovementAction(1L, null, 0, 0, null).execute()).doesNotThrowAnyException();
        assertThatCode(() -> new AttackAction(1L, 2L, null).execute()).doesNotThrowAnyException();
        assertThatCode(() -> new PlayerAction(1L, 0L, null, 0, 0, null).execute()).doesNotThrowAnyException();
    }

    @Test
    @Tag("unit")
    void executingTwiceReplaysTheBehavior() {
        int[] calls = {0};
        Action action = new AttackAction(1L, 2L, (attacker, defender) -> calls[0]++);

        action.execute();
        action.execute();

        assertThat(calls[0]).isEqualTo(2);
    }
}

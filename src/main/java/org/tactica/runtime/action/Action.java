package org.tactica.runtime.action;

/**
 * An executable unit of work handed to the scheduler.
 * <p>
 * The set of variants is closed: every action is a {@link MovementAction}, an {@link AttackAction}
 * or a {@link PlayerAction}. Each variant carries exactly the handles its behavior needs and
 * invokes that behavior on {@link #execute()}.
 * <p>
 * Actions are immutable. They are consumed once by the owning queue, which pops an entry after
 * executing it. Calling {@link #execute()} directly bypasses that protocol and will replay the
 * behavior.
 */
public sealed interface Action permits MovementAction, AttackAction, PlayerAction {

    /**
     * Discriminator for the closed set of action shapes.
     */
    enum Variant {
        MOVEMENT,
        SINGLE_TARGET_ATTACK,
        PLAYER_ACTION
    }

    /**
     * @return The variant tag of this action.
     */
    Variant variant();

    /**
     * @return The entity id of the actor performing this action.
     */
    long actorId();

    /**
     * Invokes the embedded behavior with the embedded arguments.
     * <p>
     * An action constructed without a behavior logs a warning and does nothing.
     */
    void execute();
}

package org.tactica.runtime.action;

/**
 * Category tag of a queued action.
 * <p>
 * An {@link org.tactica.runtime.scheduling.ActionQueue} holds at most one pending entry per kind,
 * so the kind doubles as the deduplication key for submissions.
 */
public enum ActionKind {
    MOVEMENT,
    ATTACK,
    MELEE_ATTACK,
    RANGED_ATTACK,
    PICKUP_ITEM
}

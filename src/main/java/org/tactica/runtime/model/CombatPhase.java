package org.tactica.runtime.model;

/**
 * Top-level state of a combat.
 * <p>
 * {@code COMBAT_INACTIVE -> COMBAT_ACTIVE -> COMBAT_RESOLVING -> COMBAT_INACTIVE}
 */
public enum CombatPhase {
    COMBAT_INACTIVE,
    COMBAT_ACTIVE,
    COMBAT_RESOLVING
}

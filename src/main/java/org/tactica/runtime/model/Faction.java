package org.tactica.runtime.model;

/**
 * A side in combat. Attached to the faction's own entity; {@code factionId} is that entity's id.
 *
 * @param factionId The faction entity id.
 * @param name Display name.
 * @param playerControlled Whether a player issues this faction's orders.
 */
public record Faction(long factionId, String name, boolean playerControlled) {
}

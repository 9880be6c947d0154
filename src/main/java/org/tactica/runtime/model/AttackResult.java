package org.tactica.runtime.model;

/**
 * Outcome of a resolved attack, reported to combat log listeners.
 *
 * @param success Whether the attack was carried out.
 * @param errorReason Why it was not, or {@code null} on success.
 * @param attackerId The attacking squad.
 * @param targetId The defending squad.
 * @param damageDealt Total damage dealt.
 * @param targetDestroyed Whether the defender was destroyed.
 */
public record AttackResult(boolean success, String errorReason, long attackerId, long targetId,
                           int damageDealt, boolean targetDestroyed) {

    public static AttackResult failure(long attackerId, long targetId, String reason) {
        return new AttackResult(false, reason, attackerId, targetId, 0, false);
    }

    public static AttackResult success(long attackerId, long targetId, int damageDealt, boolean targetDestroyed) {
        return new AttackResult(true, null, attackerId, targetId, damageDealt, targetDestroyed);
    }
}

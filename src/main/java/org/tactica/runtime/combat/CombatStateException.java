package org.tactica.runtime.combat;

/**
 * Thrown when a combat operation cannot be carried out in the current combat state: no combat is
 * running, a squad or faction record cannot be found, or a squad lacks the budget for a move.
 * <p>
 * This is a checked exception. It is returned to the immediate caller, which decides whether to
 * skip or retry; the combat core never retries on its own.
 */
public class CombatStateException extends Exception {

    private final long squadId;
    private final long factionId;

    /**
     * @param message The detail message.
     */
    public CombatStateException(String message) {
        this(message, 0L, 0L);
    }

    /**
     * @param message The detail message.
     * @param squadId The squad involved, or {@code 0}.
     * @param factionId The faction involved, or {@code 0}.
     */
    public CombatStateException(String message, long squadId, long factionId) {
        super(message);
        this.squadId = squadId;
        this.factionId = factionId;
    }

    /**
     * @param message The detail message.
     * @param squadId The squad involved, or {@code 0}.
     * @param cause The underlying failure.
     */
    public CombatStateException(String message, long squadId, Throwable cause) {
        super(message, cause);
        this.squadId = squadId;
        this.factionId = 0L;
    }

    public long getSquadId() {
        return squadId;
    }

    public long getFactionId() {
        return factionId;
    }
}

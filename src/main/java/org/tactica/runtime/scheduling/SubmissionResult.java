package org.tactica.runtime.scheduling;

/**
 * Outcome of submitting an action for scheduling.
 */
public enum SubmissionResult {
    /** The action was appended to the queue. */
    ACCEPTED,
    /** An action of the same kind is already pending; the submission was dropped. */
    DEDUPLICATED,
    /** The submitter is not allowed to act right now (wrong faction, budget spent, ...). */
    REJECTED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}

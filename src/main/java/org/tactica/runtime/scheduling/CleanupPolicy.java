package org.tactica.runtime.scheduling;

/**
 * When a combat session drops empty queues from its controller.
 */
public enum CleanupPolicy {
    /** {@link ActionController#cleanController()} runs whenever a new round starts. */
    BETWEEN_ROUNDS,
    /** The caller invokes {@link ActionController#cleanController()} itself. */
    MANUAL
}

package org.tactica.runtime.scheduling;

import java.util.Objects;

import org.tactica.runtime.action.Action;
import org.tactica.runtime.action.ActionKind;

/**
 * A pending action together with its action point cost and kind.
 *
 * @param action The action to execute.
 * @param cost Action points deducted on execution, strictly positive.
 * @param kind The deduplication category.
 */
public record QueueEntry(Action action, int cost, ActionKind kind) {

    public QueueEntry {
        if (cost <= 0) {
            throw new IllegalArgumentException("Action cost must be positive, got " + cost);
        }
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(kind, "kind");
    }
}

package org.tactica.runtime.scheduling;

import java.util.ArrayDeque;
import java.util.EnumSet;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.action.Action;
import org.tactica.runtime.action.ActionKind;

/**
 * Pending actions of one actor plus its action point ledger.
 * <p>
 * Entries are appended at the tail and executed from the head. At most one entry per
 * {@link ActionKind} is pending at any time. Executing an entry deducts its cost from
 * {@link #getTotalActionPoints()} without a floor: an actor may go into debt and then sorts behind
 * everyone else until its points are replenished.
 */
public class ActionQueue {

    private static final Logger LOG = LoggerFactory.getLogger(ActionQueue.class);

    private final long ownerId;
    private int totalActionPoints;
    private final ArrayDeque<QueueEntry> entries = new ArrayDeque<>();
    private final EnumSet<ActionKind> pendingKinds = EnumSet.noneOf(ActionKind.class);

    /**
     * @param ownerId The entity whose actions this queue holds.
     * @param totalActionPoints The starting action point balance.
     */
    public ActionQueue(long ownerId, int totalActionPoints) {
        this.ownerId = ownerId;
        this.totalActionPoints = totalActionPoints;
    }

    /**
     * Appends an action unless one of the same kind is already pending.
     *
     * @param action The action to queue.
     * @param cost Its action point cost.
     * @param kind Its deduplication kind.
     * @return {@link SubmissionResult#ACCEPTED} or {@link SubmissionResult#DEDUPLICATED}.
     * @throws IllegalArgumentException if {@code cost} is not positive. The queue is left untouched.
     */
    public SubmissionResult addAction(Action action, int cost, ActionKind kind) {
        QueueEntry entry = new QueueEntry(action, cost, kind);
        if (pendingKinds.contains(kind)) {
            LOG.debug("Dropping duplicate {} action for owner {}", kind, ownerId);
            return SubmissionResult.DEDUPLICATED;
        }
        entries.addLast(entry);
        pendingKinds.add(kind);
        return SubmissionResult.ACCEPTED;
    }

    /**
     * Executes the head entry: deducts its cost, runs the action, then pops it.
     * <p>
     * The entry is popped even if the action throws, so it can never run twice.
     *
     * @return {@code false} if the queue was empty.
     */
    public boolean executeAction() {
        QueueEntry head = entries.peekFirst();
        if (head == null) {
            return false;
        }
        totalActionPoints -= head.cost();
        try {
            head.action().execute();
        } finally {
            pop();
        }
        return true;
    }

    /**
     * Removes the head entry. Idempotent on an empty queue.
     *
     * @return {@code true} if an entry was removed.
     */
    public boolean pop() {
        QueueEntry head = entries.pollFirst();
        if (head == null) {
            return false;
        }
        pendingKinds.remove(head.kind());
        return true;
    }

    /**
     * @return The head entry without removing it.
     */
    public Optional<QueueEntry> peek() {
        return Optional.ofNullable(entries.peekFirst());
    }

    /**
     * @param kind The kind to check.
     * @return {@code true} if an entry of that kind is pending.
     */
    public boolean hasAction(ActionKind kind) {
        return pendingKinds.contains(kind);
    }

    public int numOfActions() {
        return entries.size();
    }

    /**
     * Drops all pending entries. The action point balance is kept.
     */
    public void clear() {
        entries.clear();
        pendingKinds.clear();
    }

    public long getOwnerId() {
        return ownerId;
    }

    public int getTotalActionPoints() {
        return totalActionPoints;
    }

    /**
     * Overwrites the balance. Used by whoever regenerates action points.
     *
     * @param totalActionPoints The new balance.
     */
    public void setTotalActionPoints(int totalActionPoints) {
        this.totalActionPoints = totalActionPoints;
    }

    /**
     * @param delta Points to add; may be negative.
     */
    public void addActionPoints(int delta) {
        this.totalActionPoints += delta;
    }

    @Override
    public String toString() {
        return "ActionQueue{owner=" + ownerId + ", points=" + totalActionPoints + ", pending=" + entries.size() + "}";
    }
}

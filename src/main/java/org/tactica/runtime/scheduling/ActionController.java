package org.tactica.runtime.scheduling;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;

/**
 * Priority scheduler over all live {@link ActionQueue}s of one combat.
 * <p>
 * Queues are kept sorted by {@link ActionQueue#getTotalActionPoints()} descending. Queues with
 * equal totals are ordered by registration recency: the queue registered later comes first.
 * The order is recomputed after every registration and every executed step, since executing an
 * action changes the executing queue's total.
 * <p>
 * {@link #executeFirst()} is the single simulation step primitive. It runs exactly the head
 * entry of the highest-priority queue. The surrounding loop drives the tick by calling it
 * repeatedly and calls {@link #cleanController()} between rounds.
 * <p>
 * Queues live in an arena and are addressed through generational {@link QueueHandle}s.
 * Registration deduplicates by identity: registering the same queue instance twice returns the
 * original handle. Two distinct queue instances are always distinct registrations.
 * <p>
 * Not thread-safe. Each combat owns its own controller.
 */
public class ActionController {

    private static final Logger LOG = LoggerFactory.getLogger(ActionController.class);

    private final ObjectArrayList<ActionQueue> slots = new ObjectArrayList<>();
    private final IntArrayList generations = new IntArrayList();
    private final LongArrayList registrationStamps = new LongArrayList();
    private final IntArrayList freeSlots = new IntArrayList();
    private final Reference2IntOpenHashMap<ActionQueue> slotByQueue = new Reference2IntOpenHashMap<>();

    // Slot indices in priority order.
    private final IntArrayList order = new IntArrayList();
    private long nextStamp = 0L;

    private final IntComparator priority = (a, b) -> {
        int byPoints = Integer.compare(slots.get(b).getTotalActionPoints(), slots.get(a).getTotalActionPoints());
        if (byPoints != 0) {
            return byPoints;
        }
        return Long.compare(registrationStamps.getLong(b), registrationStamps.getLong(a));
    };

    public ActionController() {
        slotByQueue.defaultReturnValue(-1);
    }

    /**
     * Registers a queue unless this exact instance is already registered, then re-sorts.
     *
     * @param queue The queue to register.
     * @return The handle of the (possibly pre-existing) registration.
     */
    public QueueHandle addActionQueue(ActionQueue queue) {
        Objects.requireNonNull(queue, "queue");
        int slot = slotByQueue.getInt(queue);
        if (slot < 0) {
            slot = allocateSlot(queue);
            order.add(slot);
            LOG.debug("Registered {} in slot {}", queue, slot);
        }
        reorderActions();
        return new QueueHandle(slot, generations.getInt(slot));
    }

    /**
     * Resolves a handle.
     *
     * @param handle The handle to resolve.
     * @return The queue, or empty if the handle is stale or unknown.
     */
    public Optional<ActionQueue> get(QueueHandle handle) {
        if (!isLive(handle)) {
            return Optional.empty();
        }
        return Optional.of(slots.get(handle.slot()));
    }

    /**
     * @param handle The handle to check.
     * @return {@code true} if the handle still refers to a registered queue.
     */
    public boolean contains(QueueHandle handle) {
        return isLive(handle);
    }

    /**
     * Finds the handle of a registered queue instance.
     *
     * @param queue The queue to look up.
     * @return Its handle, or empty if the instance is not registered.
     */
    public Optional<QueueHandle> handleOf(ActionQueue queue) {
        int slot = slotByQueue.getInt(queue);
        if (slot < 0) {
            return Optional.empty();
        }
        return Optional.of(new QueueHandle(slot, generations.getInt(slot)));
    }

    /**
     * Executes the head action of the highest-priority queue, then re-sorts.
     * <p>
     * A no-op if no queue is registered or if the highest-priority queue has nothing pending.
     *
     * @return {@code true} if an action was executed.
     */
    public boolean executeFirst() {
        if (order.isEmpty()) {
            return false;
        }
        ActionQueue first = slots.get(order.getInt(0));
        int before = first.getTotalActionPoints();
        boolean executed;
        try {
            executed = first.executeAction();
        } finally {
            reorderActions();
        }
        if (executed) {
            LOG.debug("Executed action of owner {} ({} -> {} points)", first.getOwnerId(), before,
                    first.getTotalActionPoints());
        }
        return executed;
    }

    /**
     * Unregisters every queue with no pending entries. The relative order of the remaining
     * queues is preserved.
     * <p>
     * Call this between rounds, never while a queue that is empty right now may still receive
     * entries in the current round.
     *
     * @return The number of queues removed.
     */
    public int cleanController() {
        int removed = 0;
        IntArrayList remaining = new IntArrayList(order.size());
        for (int i = 0; i < order.size(); i++) {
            int slot = order.getInt(i);
            if (slots.get(slot).numOfActions() == 0) {
                releaseSlot(slot);
                removed++;
            } else {
                remaining.add(slot);
            }
        }
        order.clear();
        order.addAll(remaining);
        if (removed > 0) {
            LOG.debug("Cleaned {} empty queue(s), {} remaining", removed, order.size());
        }
        return removed;
    }

    /**
     * Unregisters a single queue.
     *
     * @param handle The queue's handle.
     * @return {@code false} if the handle was stale.
     */
    public boolean removeActionQueue(QueueHandle handle) {
        if (!isLive(handle)) {
            return false;
        }
        order.rem(handle.slot());
        releaseSlot(handle.slot());
        return true;
    }

    /**
     * Unregisters the first queue (in priority order) owned by the given entity.
     *
     * @param ownerId The owning entity.
     * @return {@code false} if no queue of that owner is registered.
     */
    public boolean removeActionQueueFor(long ownerId) {
        for (int i = 0; i < order.size(); i++) {
            int slot = order.getInt(i);
            if (slots.get(slot).getOwnerId() == ownerId) {
                order.removeInt(i);
                releaseSlot(slot);
                return true;
            }
        }
        return false;
    }

    /**
     * Sets every registered queue's balance to the given value, then re-sorts.
     *
     * @param points The new balance.
     */
    public void resetActionPoints(int points) {
        for (int i = 0; i < order.size(); i++) {
            slots.get(order.getInt(i)).setTotalActionPoints(points);
        }
        reorderActions();
    }

    /**
     * Drops the pending entries of every registered queue. Registrations are kept.
     */
    public void resetQueues() {
        for (int i = 0; i < order.size(); i++) {
            slots.get(order.getInt(i)).clear();
        }
    }

    /**
     * Unregisters everything. Outstanding handles become stale.
     */
    public void clear() {
        for (int i = 0; i < order.size(); i++) {
            releaseSlot(order.getInt(i));
        }
        order.clear();
    }

    /**
     * @return The number of registered queues.
     */
    public int size() {
        return order.size();
    }

    /**
     * @return {@code true} if any registered queue has a pending entry.
     */
    public boolean hasPendingActions() {
        for (int i = 0; i < order.size(); i++) {
            if (slots.get(order.getInt(i)).numOfActions() > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The highest-priority queue, if any is registered.
     */
    public Optional<ActionQueue> peekFirst() {
        if (order.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(slots.get(order.getInt(0)));
    }

    /**
     * @return The registered queues in current priority order.
     */
    public List<ActionQueue> snapshot() {
        List<ActionQueue> result = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            result.add(slots.get(order.getInt(i)));
        }
        return result;
    }

    private void reorderActions() {
        order.sort(priority);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Priority order: {}", snapshot());
        }
    }

    private int allocateSlot(ActionQueue queue) {
        int slot;
        if (freeSlots.isEmpty()) {
            slot = slots.size();
            slots.add(queue);
            generations.add(0);
            registrationStamps.add(nextStamp++);
        } else {
            slot = freeSlots.popInt();
            slots.set(slot, queue);
            registrationStamps.set(slot, nextStamp++);
        }
        slotByQueue.put(queue, slot);
        return slot;
    }

    private void releaseSlot(int slot) {
        ActionQueue queue = slots.get(slot);
        slotByQueue.removeInt(queue);
        slots.set(slot, null);
        generations.set(slot, generations.getInt(slot) + 1);
        freeSlots.push(slot);
    }

    private boolean isLive(QueueHandle handle) {
        if (handle == null || handle.slot() < 0 || handle.slot() >= slots.size()) {
            return false;
        }
        return slots.get(handle.slot()) != null && generations.getInt(handle.slot()) == handle.generation();
    }
}

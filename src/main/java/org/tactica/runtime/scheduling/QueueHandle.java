package org.tactica.runtime.scheduling;

/**
 * Stable reference to a queue registered with an {@link ActionController}.
 * <p>
 * A handle is a slot index plus the generation the slot had when the queue was registered. Once
 * the queue is removed the slot's generation advances, so stale handles resolve to nothing
 * instead of aliasing whatever queue reuses the slot.
 *
 * @param slot Arena slot index.
 * @param generation Slot generation at registration time.
 */
public record QueueHandle(int slot, int generation) {
}

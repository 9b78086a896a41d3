package org.starledger.timeline.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Restores sequence order for items that complete out of order.
 * <p>
 * Items are offered with their sequence number; an item is released only once every item with a lower
 * sequence number has been released.
 *
 * @param <T> The item type.
 */
public final class SnapshotReorderBuffer<T> {

    private final NavigableMap<Integer, T> pending = new TreeMap<>();
    private int nextSequence;

    public SnapshotReorderBuffer() {
        this(0);
    }

    public SnapshotReorderBuffer(int firstSequence) {
        this.nextSequence = firstSequence;
    }

    /**
     * Adds a completed item.
     *
     * @param sequence The item's sequence number.
     * @param item     The item.
     * @return The items that are now in order, possibly empty.
     * @throws IllegalArgumentException if the sequence number was already offered or released.
     */
    public synchronized List<T> offer(int sequence, T item) {
        if (sequence < nextSequence || pending.containsKey(sequence)) {
            throw new IllegalArgumentException("Sequence " + sequence + " was already offered");
        }
        pending.put(sequence, item);
        List<T> ready = new ArrayList<>();
        while (!pending.isEmpty() && pending.firstKey() == nextSequence) {
            ready.add(pending.pollFirstEntry().getValue());
            nextSequence++;
        }
        return ready;
    }

    public synchronized int nextSequence() {
        return nextSequence;
    }

    /**
     * @return The number of items waiting for an earlier one.
     */
    public synchronized int pendingCount() {
        return pending.size();
    }
}

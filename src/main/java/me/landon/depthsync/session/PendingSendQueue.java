package me.landon.depthsync.session;

import it.unimi.dsi.fastutil.longs.LongArrayFIFOQueue;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import java.util.OptionalLong;

/** Bounded FIFO of request timestamps waiting to be sent. Overflow evicts the oldest entry. */
public final class PendingSendQueue {
    public static final int DEFAULT_CAPACITY = 60;

    private final int capacity;
    private final LongArrayFIFOQueue queue = new LongArrayFIFOQueue();

    public PendingSendQueue() {
        this(DEFAULT_CAPACITY);
    }

    public PendingSendQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }

        this.capacity = capacity;
    }

    /**
     * Appends a timestamp.
     *
     * @return the evicted timestamp when the queue was already full
     */
    public OptionalLong offer(long timestampMs) {
        queue.enqueue(timestampMs);

        if (queue.size() > capacity) {
            return OptionalLong.of(queue.dequeueLong());
        }

        return OptionalLong.empty();
    }

    public long poll() {
        return queue.dequeueLong();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }

    /** Returns the queued timestamps oldest first without consuming them. */
    public LongList snapshot() {
        int size = queue.size();
        LongList out = new LongArrayList(size);

        for (int i = 0; i < size; i++) {
            long value = queue.dequeueLong();
            out.add(value);
            queue.enqueue(value);
        }

        return out;
    }
}

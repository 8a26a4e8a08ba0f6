package me.landon.depthsync.buffer;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import java.util.OptionalLong;

/**
 * Single table of outstanding frame requests keyed by requested timestamp.
 *
 * <p>Each entry carries two independent views:
 *
 * <ul>
 *   <li>the <em>marker</em>: when the scheduler last asked for the timestamp, used for gap
 *       detection and timeout-based re-request;
 *   <li>the <em>transmit</em> record: when the request actually went over the wire, used to
 *       correlate responses for RTT.
 * </ul>
 *
 * <p>An entry disappears once its frame arrives or both views have been invalidated. A timestamp
 * sent more than once before its response arrives produces no RTT sample, since the response
 * cannot be matched to a specific send.
 */
public final class RequestTracker {
    private static final long NONE = Long.MIN_VALUE;

    private static final class Entry {
        private long markedAtMs = NONE;
        private long transmittedAtMs = NONE;
        private int transmitCount;

        private boolean isEmpty() {
            return markedAtMs == NONE && transmitCount == 0;
        }

        private void clearTransmit() {
            transmittedAtMs = NONE;
            transmitCount = 0;
        }
    }

    private final Long2ObjectOpenHashMap<Entry> entries = new Long2ObjectOpenHashMap<>();

    public void mark(long timestampMs, long nowMs) {
        entry(timestampMs).markedAtMs = nowMs;
    }

    public boolean isMarked(long timestampMs) {
        Entry entry = entries.get(timestampMs);
        return entry != null && entry.markedAtMs != NONE;
    }

    /** Returns true while the timestamp is marked and its marker is younger than the timeout. */
    public boolean isAwaiting(long timestampMs, long nowMs, long timeoutMs) {
        Entry entry = entries.get(timestampMs);

        if (entry == null || entry.markedAtMs == NONE) {
            return false;
        }

        return nowMs - entry.markedAtMs < timeoutMs;
    }

    /**
     * Drops every entry strictly older than {@code thresholdMs}, transmit records included. A
     * response for such a timestamp may never arrive, or may come back under a different one.
     */
    public void clearBefore(long thresholdMs) {
        ObjectIterator<Long2ObjectMap.Entry<Entry>> iterator =
                entries.long2ObjectEntrySet().fastIterator();

        while (iterator.hasNext()) {
            if (iterator.next().getLongKey() < thresholdMs) {
                iterator.remove();
            }
        }
    }

    public void recordTransmit(long timestampMs, long nowMs) {
        Entry entry = entry(timestampMs);
        entry.transmittedAtMs = nowMs;
        entry.transmitCount++;
    }

    /**
     * Consumes the transmit record for a response.
     *
     * @return the send time, or empty when the timestamp was never sent or was sent more than once
     */
    public OptionalLong takeTransmitTime(long timestampMs) {
        Entry entry = entries.get(timestampMs);

        if (entry == null || entry.transmitCount == 0) {
            return OptionalLong.empty();
        }

        boolean unambiguous = entry.transmitCount == 1;
        long transmittedAt = entry.transmittedAtMs;
        entry.clearTransmit();
        removeIfEmpty(timestampMs, entry);
        return unambiguous ? OptionalLong.of(transmittedAt) : OptionalLong.empty();
    }

    public boolean isTransmitted(long timestampMs) {
        Entry entry = entries.get(timestampMs);
        return entry != null && entry.transmitCount > 0;
    }

    public void forgetTransmit(long timestampMs) {
        Entry entry = entries.get(timestampMs);

        if (entry == null) {
            return;
        }

        entry.clearTransmit();
        removeIfEmpty(timestampMs, entry);
    }

    public void forgetAllTransmits() {
        ObjectIterator<Entry> iterator = entries.values().iterator();

        while (iterator.hasNext()) {
            Entry entry = iterator.next();
            entry.clearTransmit();

            if (entry.isEmpty()) {
                iterator.remove();
            }
        }
    }

    /** Removes every trace of the timestamp; called when its frame arrives. */
    public void resolve(long timestampMs) {
        entries.remove(timestampMs);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int markedCount() {
        int count = 0;

        for (Entry entry : entries.values()) {
            if (entry.markedAtMs != NONE) {
                count++;
            }
        }

        return count;
    }

    public int transmittedCount() {
        int count = 0;

        for (Entry entry : entries.values()) {
            if (entry.transmitCount > 0) {
                count++;
            }
        }

        return count;
    }

    private Entry entry(long timestampMs) {
        Entry entry = entries.get(timestampMs);

        if (entry == null) {
            entry = new Entry();
            entries.put(timestampMs, entry);
        }

        return entry;
    }

    private void removeIfEmpty(long timestampMs, Entry entry) {
        if (entry.isEmpty()) {
            entries.remove(timestampMs);
        }
    }
}

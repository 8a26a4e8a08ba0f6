package me.landon.depthsync.runtime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/** Holds the current {@link TuningSnapshot}; updates replace it as a whole. */
public final class TuningState {
    private final AtomicReference<TuningSnapshot> current;

    public TuningState(TuningSnapshot initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public TuningSnapshot snapshot() {
        return current.get();
    }

    /**
     * Applies {@code update} to the current snapshot.
     *
     * @return the snapshot now in effect
     */
    public TuningSnapshot update(UnaryOperator<TuningSnapshot> update) {
        Objects.requireNonNull(update, "update");
        return current.updateAndGet(snapshot -> Objects.requireNonNull(update.apply(snapshot)));
    }

    public void setMaxInflightRequests(int maxInflightRequests) {
        update(snapshot -> snapshot.withMaxInflightRequests(maxInflightRequests));
    }

    public void setLeadTimeMs(int leadTimeMs) {
        update(snapshot -> snapshot.withLeadTimeMs(leadTimeMs));
    }

    public void setAutoLeadEnabled(boolean autoLeadEnabled) {
        update(snapshot -> snapshot.withAutoLeadEnabled(autoLeadEnabled));
    }
}

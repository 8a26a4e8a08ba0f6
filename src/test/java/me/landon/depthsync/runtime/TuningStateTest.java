package me.landon.depthsync.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import me.landon.depthsync.config.DepthSyncConfig;
import org.junit.jupiter.api.Test;

class TuningStateTest {
    @Test
    void startsFromConfig() {
        DepthSyncConfig config = DepthSyncConfig.defaults();
        config.autoLeadEnabled = true;

        TuningState state = new TuningState(TuningSnapshot.fromConfig(config));

        assertEquals(new TuningSnapshot(8, 2000, true), state.snapshot());
    }

    @Test
    void updatesReplaceTheSnapshot() {
        TuningState state = new TuningState(new TuningSnapshot(8, 2000, false));
        TuningSnapshot before = state.snapshot();

        state.setMaxInflightRequests(12);
        state.setLeadTimeMs(260);

        assertEquals(new TuningSnapshot(8, 2000, false), before);
        assertEquals(new TuningSnapshot(12, 260, false), state.snapshot());
        assertNotSame(before, state.snapshot());
    }

    @Test
    void rejectsInvalidValues() {
        TuningState state = new TuningState(new TuningSnapshot(8, 2000, false));

        assertThrows(IllegalArgumentException.class, () -> state.setMaxInflightRequests(0));
        assertThrows(IllegalArgumentException.class, () -> state.setLeadTimeMs(-1));
        assertEquals(new TuningSnapshot(8, 2000, false), state.snapshot());
    }
}

package me.landon.depthsync.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import me.landon.depthsync.network.SessionStatus;
import me.landon.depthsync.network.StatusSource;
import org.junit.jupiter.api.Test;

class AdaptiveTunerTest {
    private final RecordingStatusSource statusSource = new RecordingStatusSource();
    private final TuningState tuningState = new TuningState(new TuningSnapshot(8, 2000, true));
    private final AdaptiveTuner tuner =
            new AdaptiveTuner(statusSource, "s1", tuningState, Runnable::run);

    @Test
    void workerCountDrivesInflightAndLead() {
        TuningSnapshot result = tuner.adjust(status(3, 0.05, 0.1, null));

        assertEquals(12, result.maxInflightRequests());
        assertEquals(260, result.leadTimeMs());
        assertEquals(result, tuningState.snapshot());
    }

    @Test
    void pipelineMinimumAppliesWithManyWorkers() {
        TuningSnapshot result = tuner.adjust(status(20, 0.0, 0.01, 0.01));

        assertEquals(80, result.maxInflightRequests());
        assertEquals(800, result.leadTimeMs());
    }

    @Test
    void leadIsClamped() {
        assertEquals(2000, tuner.adjust(status(1, 3.0, 4.0, null)).leadTimeMs());

        tuningState.setLeadTimeMs(500);
        assertEquals(50, tuner.adjust(status(0, 0.0, 0.0, 0.0001)).leadTimeMs());
    }

    @Test
    void zeroDecodeTimeUsesDefault() {
        tuningState.setLeadTimeMs(0);

        assertEquals(100, tuner.adjust(status(0, 0.0, 0.0, 0.0)).leadTimeMs());
    }

    @Test
    void smallLeadChangesAreIgnored() {
        tuningState.setLeadTimeMs(250);

        assertEquals(250, tuner.adjust(status(3, 0.05, 0.1, null)).leadTimeMs());

        tuningState.setLeadTimeMs(239);
        assertEquals(260, tuner.adjust(status(3, 0.05, 0.1, null)).leadTimeMs());
    }

    @Test
    void manualLeadIsLeftAlone() {
        tuningState.setAutoLeadEnabled(false);

        TuningSnapshot result = tuner.adjust(status(3, 0.05, 0.1, null));

        assertEquals(12, result.maxInflightRequests());
        assertEquals(2000, result.leadTimeMs());
    }

    @Test
    void missingSectionsChangeNothing() {
        SessionStatus status = new SessionStatus();

        TuningSnapshot result = tuner.adjust(status);

        assertEquals(new TuningSnapshot(8, 2000, true), result);
    }

    @Test
    void onlyOnePollIsOutstanding() {
        tuner.poll();
        tuner.poll();

        assertEquals(1, statusSource.requests);
        assertTrue(tuner.isPollInFlight());

        statusSource.callback.onStatus(status(2, 0.05, 0.1, null));

        assertFalse(tuner.isPollInFlight());
        assertEquals(8, tuningState.snapshot().maxInflightRequests());

        tuner.poll();
        assertEquals(2, statusSource.requests);
    }

    @Test
    void failedPollLeavesTuningUntouched() {
        tuner.poll();

        statusSource.callback.onFailure(new IOException("HTTP 503"));

        assertFalse(tuner.isPollInFlight());
        assertEquals(1, tuner.pollFailures());
        assertEquals(new TuningSnapshot(8, 2000, true), tuningState.snapshot());
    }

    private static SessionStatus status(
            int workers, double queueSeconds, double inferSeconds, Double decodeSeconds) {
        SessionStatus status = new SessionStatus();
        status.config = new SessionStatus.ServerConfig();
        status.config.inferenceWorkers = workers;
        status.rollingStats = new SessionStatus.RollingStats();
        status.rollingStats.queueAvgSeconds = queueSeconds;
        status.rollingStats.inferAvgSeconds = inferSeconds;
        status.rollingStats.decodeAvgSeconds = decodeSeconds;
        return status;
    }

    private static final class RecordingStatusSource implements StatusSource {
        private int requests;
        private StatusSource.Callback callback;

        @Override
        public void fetchStatus(String sessionId, StatusSource.Callback callback) {
            requests++;
            this.callback = callback;
        }
    }
}

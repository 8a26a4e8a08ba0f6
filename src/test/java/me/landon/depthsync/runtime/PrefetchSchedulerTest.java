package me.landon.depthsync.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicLong;
import me.landon.depthsync.buffer.JitterBuffer;
import me.landon.depthsync.buffer.RequestTracker;
import me.landon.depthsync.protocol.DepthFrame;
import me.landon.depthsync.protocol.DepthFrameCodec;
import me.landon.depthsync.session.FrameTransport;
import org.junit.jupiter.api.Test;

class PrefetchSchedulerTest {
    private final AtomicLong now = new AtomicLong(1_000L);
    private final RequestTracker tracker = new RequestTracker();
    private final JitterBuffer buffer = new JitterBuffer(tracker, now::get);
    private final FakeFrameConnector connector = new FakeFrameConnector();
    private final FrameTransport transport =
            new FrameTransport(
                    connector,
                    "s1",
                    new DepthFrameCodec(),
                    tracker,
                    now::get,
                    Runnable::run,
                    true);
    private final PrefetchScheduler scheduler = new PrefetchScheduler(buffer, transport, 30.0);

    PrefetchSchedulerTest() {
        transport.onFrame(buffer::add);
        transport.connect();
        connector.listener.onOpen();
    }

    @Test
    void issuesAtMostTheFreeSlots() {
        PrefetchScheduler.TickResult result =
                scheduler.tick(0.0, new TuningSnapshot(8, 2000, false));

        assertEquals(2000.0, result.leadMs());
        assertEquals(2000.0, result.startMs(), 1e-6);
        assertEquals(5000.0, result.endMs(), 1e-6);
        assertEquals(8, result.availableSlots());
        assertEquals(8, result.issued().size());
        assertEquals(2000L, result.issued().getLong(0));
        assertEquals(2033L, result.issued().getLong(1));
        assertEquals(2067L, result.issued().getLong(2));
        assertTrue(result.missingCount() > 8);
        assertEquals(8, transport.inflightCount());
        assertEquals(8, connector.sent.size());
        assertEquals("{\"time_ms\":2000}", connector.sent.get(0));
    }

    @Test
    void fullPipelineIssuesNothingButStillCleansUp() {
        TuningSnapshot tuning = new TuningSnapshot(2, 0, false);
        scheduler.tick(0.0, tuning);
        assertEquals(2, transport.inflightCount());
        assertTrue(tracker.isMarked(0L));

        PrefetchScheduler.TickResult result = scheduler.tick(2_500.0, tuning);

        assertEquals(0, result.availableSlots());
        assertTrue(result.issued().isEmpty());
        assertFalse(tracker.isMarked(0L));
        assertEquals(2, connector.sent.size());
    }

    @Test
    void outstandingRequestsAreNotReissuedBeforeTimeout() {
        TuningSnapshot tuning = new TuningSnapshot(4, 0, false);
        PrefetchScheduler.TickResult first = scheduler.tick(0.0, tuning);

        connector.listener.onText("{\"type\":\"error\",\"message\":\"busy\"}");
        PrefetchScheduler.TickResult second = scheduler.tick(0.0, tuning);

        assertEquals(1, second.availableSlots());
        assertTrue(second.issued().isEmpty());
        assertEquals(4, first.issued().size());

        now.addAndGet(1_000L);
        PrefetchScheduler.TickResult third = scheduler.tick(0.0, tuning);
        assertEquals(1, third.issued().size());
        assertEquals(0L, third.issued().getLong(0));
    }

    @Test
    void bufferedFramesAreSkipped() {
        buffer.add(DepthFrame.of(0L, 1, 1, new float[] {1.0f}, 1.0f, 0.0f, 1.0f));

        PrefetchScheduler.TickResult result = scheduler.tick(0.0, new TuningSnapshot(1, 0, false));

        assertEquals(33L, result.issued().getLong(0));
    }

    @Test
    void negativeStartIsClampedToZero() {
        PrefetchScheduler.TickResult result =
                scheduler.tick(-500.0, new TuningSnapshot(1, 100, false));

        assertEquals(0.0, result.startMs());
        assertEquals(0L, result.issued().getLong(0));
    }

    @Test
    void autoLeadFollowsRtt() {
        TuningSnapshot auto = new TuningSnapshot(8, 2000, true);

        assertEquals(100.0, PrefetchScheduler.leadMs(auto, 0.0));
        assertEquals(350.0, PrefetchScheduler.leadMs(auto, 250.0));
        assertEquals(3000.0, PrefetchScheduler.leadMs(auto, 5000.0));
        assertEquals(2000.0, PrefetchScheduler.leadMs(auto.withAutoLeadEnabled(false), 250.0));
    }

    @Test
    void timeoutGrowsWithRtt() {
        assertEquals(1000L, PrefetchScheduler.timeoutMs(0.0));
        assertEquals(1000L, PrefetchScheduler.timeoutMs(250.0));
        assertEquals(1300L, PrefetchScheduler.timeoutMs(400.0));
    }

    @Test
    void unknownFpsFallsBackToThirty() {
        PrefetchScheduler fallback = new PrefetchScheduler(buffer, transport, 0.0);

        assertEquals(1000.0 / 30.0, fallback.stepMs(), 1e-9);
    }
}

package me.landon.depthsync.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import me.landon.depthsync.config.DepthSyncConfig;
import me.landon.depthsync.network.StatusSource;
import me.landon.depthsync.protocol.DepthFrameCodec;
import me.landon.depthsync.session.ConnectionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DepthSyncRuntimeTest {
    private final AtomicLong now = new AtomicLong(0L);
    private final FakeFrameConnector connector = new FakeFrameConnector();
    private final ManualPlayback playback = new ManualPlayback();
    private final List<String> remoteLog = new ArrayList<>();
    private final StatusSource idleStatusSource = (sessionId, callback) -> {};

    private ScheduledExecutorService executor;
    private DepthSyncRuntime runtime;

    @BeforeEach
    void setUp() {
        DepthSyncConfig config = DepthSyncConfig.defaults();
        // Keep the periodic ticks out of the way; tests drive them by hand.
        config.refreshIntervalMs = 60_000;
        config.statusPollIntervalMs = 60_000;
        config.healthReportIntervalMs = 60_000;

        executor = Executors.newSingleThreadScheduledExecutor();
        runtime =
                new DepthSyncRuntime(
                        config,
                        "f00d",
                        30.0,
                        playback,
                        connector,
                        idleStatusSource,
                        remoteLog::add,
                        executor,
                        true,
                        now::get);
    }

    @AfterEach
    void tearDown() throws Exception {
        runtime.close();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void requestsFramesAndServesThemToTheRenderer() throws Exception {
        runtime.start();
        connector.listener.onOpen();
        drain();
        assertEquals(ConnectionState.OPEN, runtime.connectionState());

        PrefetchScheduler.TickResult tick = runtime.tick();

        assertEquals(8, tick.issued().size());
        assertEquals(8, connector.sent.size());
        assertEquals(8, runtime.inflightCount());

        now.addAndGet(120L);
        connector.listener.onBinary(frame(2000L));
        drain();

        assertEquals(1, runtime.bufferedFrames());
        assertEquals(7, runtime.inflightCount());
        assertEquals(120.0, runtime.rttMs(), 1e-9);
        assertNotNull(runtime.frameAt(2010.0));
        assertNull(runtime.frameAt(2100.0));
        SyncStats stats = runtime.syncStats();
        assertEquals(2, stats.lookups());
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0, stats.starvations());
        assertEquals(10.0, stats.averageDeltaMs(), 1e-9);
    }

    @Test
    void currentFrameFollowsPlayback() throws Exception {
        runtime.start();
        connector.listener.onOpen();
        connector.listener.onBinary(frame(0L));
        drain();
        playback.positionMs = 10.0;

        assertNull(runtime.currentFrame());

        playback.playing = true;
        assertNotNull(runtime.currentFrame());
    }

    @Test
    void seekClearsBufferAndReconnects() throws Exception {
        runtime.start();
        connector.listener.onOpen();
        connector.listener.onBinary(frame(5000L));
        drain();
        assertEquals(1, runtime.bufferedFrames());

        runtime.seek();

        assertEquals(0, runtime.bufferedFrames());
        assertEquals(2, connector.opened);
        assertEquals(1, connector.closed);
        assertEquals(ConnectionState.CONNECTING, runtime.connectionState());

        connector.listener.onOpen();
        connector.listener.onBinary(frame(100L));
        drain();
        assertEquals(1, runtime.bufferedFrames());
        assertEquals(2, runtime.decodeCounters().accepted());
    }

    @Test
    void healthReportGoesToRemoteSink() {
        String line = runtime.reportHealth();

        assertEquals(List.of(line), remoteLog);
        assertTrue(line.startsWith("[Health] Buffer=0"));
    }

    @Test
    void stopClosesConnection() {
        runtime.start();

        runtime.stop();

        assertEquals(ConnectionState.CLOSED, runtime.connectionState());
        assertEquals(1, connector.closed);
    }

    private void drain() throws Exception {
        executor.submit(() -> {}).get(5, TimeUnit.SECONDS);
    }

    private static byte[] frame(long timestampMs) {
        return new DepthFrameCodec()
                .encode(
                        new DepthFrameCodec.RawFrame(
                                1, timestampMs, 2, 1, 1.0f, 0.0f, 1.0f, new int[] {5, 6}),
                        false);
    }

    private static final class ManualPlayback implements PlaybackClock {
        private volatile double positionMs;
        private volatile boolean playing;

        @Override
        public double currentTimeMs() {
            return positionMs;
        }

        @Override
        public boolean isPlaying() {
            return playing;
        }
    }
}

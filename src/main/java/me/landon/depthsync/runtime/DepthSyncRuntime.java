package me.landon.depthsync.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import me.landon.depthsync.buffer.JitterBuffer;
import me.landon.depthsync.buffer.RequestTracker;
import me.landon.depthsync.config.DepthSyncConfig;
import me.landon.depthsync.network.FrameConnector;
import me.landon.depthsync.network.OkHttpFrameConnector;
import me.landon.depthsync.network.SessionStatusClient;
import me.landon.depthsync.network.StatusSource;
import me.landon.depthsync.protocol.DepthFrame;
import me.landon.depthsync.protocol.DepthFrameCodec;
import me.landon.depthsync.session.ConnectionState;
import me.landon.depthsync.session.FrameTransport;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one session's depth maps in step with video playback.
 *
 * <p>Scheduler, tuner and health ticks run on a single-threaded executor. Every tick, every
 * transport event and every call from the renderer holds this object's monitor, so the buffer,
 * the transport and the codec are only ever touched by one thread at a time.
 */
public final class DepthSyncRuntime implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DepthSyncRuntime.class);

    private final DepthSyncConfig config;
    private final String sessionId;
    private final PlaybackClock playbackClock;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;
    private final Executor eventLoop;
    private final DepthFrameCodec frameCodec;
    private final JitterBuffer buffer;
    private final FrameTransport transport;
    private final TuningState tuningState;
    private final PrefetchScheduler scheduler;
    private final AdaptiveTuner tuner;
    private final HealthReporter healthReporter;
    private final SyncStats syncStats = new SyncStats();
    private final List<ScheduledFuture<?>> scheduledTasks = new ArrayList<>();

    private boolean started;
    private boolean closed;

    /**
     * Creates a runtime that talks to {@link DepthSyncConfig#serverBaseUrl} over OkHttp and owns
     * its event loop thread.
     */
    public static DepthSyncRuntime create(
            DepthSyncConfig config,
            String sessionId,
            double sessionFps,
            PlaybackClock playbackClock,
            OkHttpClient httpClient) {
        SessionStatusClient statusClient =
                new SessionStatusClient(httpClient, config.serverBaseUrl);
        ScheduledExecutorService executor =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "depth-sync-" + sessionId);
                            thread.setDaemon(true);
                            return thread;
                        });

        return new DepthSyncRuntime(
                config,
                sessionId,
                sessionFps,
                playbackClock,
                new OkHttpFrameConnector(httpClient, config.serverBaseUrl),
                statusClient,
                config.remoteHealthLogging ? statusClient::postLog : null,
                executor,
                true,
                DepthSyncRuntime::monotonicMillis);
    }

    DepthSyncRuntime(
            DepthSyncConfig config,
            String sessionId,
            double sessionFps,
            PlaybackClock playbackClock,
            FrameConnector connector,
            StatusSource statusSource,
            Consumer<String> remoteLogSink,
            ScheduledExecutorService executor,
            boolean ownsExecutor,
            LongSupplier clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.playbackClock = Objects.requireNonNull(playbackClock, "playbackClock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.eventLoop = task -> executor.execute(() -> runLocked(task));

        RequestTracker requestTracker = new RequestTracker();
        this.frameCodec = new DepthFrameCodec(config.versionPolicy());
        this.buffer = new JitterBuffer(requestTracker, clock);
        this.transport =
                new FrameTransport(
                        connector,
                        sessionId,
                        frameCodec,
                        requestTracker,
                        clock,
                        eventLoop,
                        config.logMalformedOncePerConnection);
        this.tuningState = new TuningState(TuningSnapshot.fromConfig(config));
        this.scheduler = new PrefetchScheduler(buffer, transport, sessionFps);
        this.tuner = new AdaptiveTuner(statusSource, sessionId, tuningState, eventLoop);
        this.healthReporter =
                new HealthReporter(buffer, transport, remoteLogSink, config.verboseHealthLogging);

        transport.onFrame(buffer::add);
    }

    /** Connects and schedules the periodic ticks. */
    public synchronized void start() {
        if (started || closed) {
            return;
        }

        started = true;
        transport.connect();
        schedule(this::tick, config.refreshIntervalMs);
        schedule(tuner::poll, config.statusPollIntervalMs);
        schedule(healthReporter::report, config.healthReportIntervalMs);
        LOGGER.info(
                "Depth sync started for session {} (step {}ms)",
                sessionId,
                scheduler.stepMs());
    }

    /** Cancels the ticks and closes the connection. The runtime can be started again. */
    public synchronized void stop() {
        if (!started) {
            return;
        }

        started = false;

        for (ScheduledFuture<?> task : scheduledTasks) {
            task.cancel(false);
        }

        scheduledTasks.clear();
        transport.close();
        LOGGER.info("Depth sync stopped for session {}", sessionId);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }

        stop();
        closed = true;

        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    /** Runs one prefetch pass for the current playback position. */
    public synchronized PrefetchScheduler.TickResult tick() {
        return scheduler.tick(playbackClock.currentTimeMs(), tuningState.snapshot());
    }

    /**
     * Depth map for the current playback position.
     *
     * @return the matching frame, or {@code null} while paused or when nothing is close enough
     */
    public synchronized DepthFrame currentFrame() {
        if (!playbackClock.isPlaying()) {
            return null;
        }

        return frameAt(playbackClock.currentTimeMs());
    }

    /** @return the frame closest to {@code playbackMs}, or {@code null} */
    public synchronized DepthFrame frameAt(double playbackMs) {
        DepthFrame frame = buffer.getFrame(playbackMs);

        if (frame != null) {
            syncStats.recordHit(Math.abs(playbackMs - frame.timestampMs()), buffer.size());
        } else {
            syncStats.recordMiss(buffer.size());
        }

        return frame;
    }

    /**
     * Drops everything buffered and starts over on a fresh connection. Used after a seek and when
     * playback ends so a replay starts clean.
     */
    public synchronized void seek() {
        buffer.clear();
        frameCodec.resetOrdering();
        transport.close();

        if (started) {
            transport.connect();
        }

        LOGGER.debug("Depth buffer reset for session {}", sessionId);
    }

    public synchronized String reportHealth() {
        return healthReporter.report();
    }

    public synchronized void pollStatus() {
        tuner.poll();
    }

    public TuningState tuningState() {
        return tuningState;
    }

    public synchronized SyncStats syncStats() {
        return syncStats;
    }

    public synchronized ConnectionState connectionState() {
        return transport.state();
    }

    public synchronized int bufferedFrames() {
        return buffer.size();
    }

    public synchronized int inflightCount() {
        return transport.inflightCount();
    }

    public synchronized double rttMs() {
        return transport.rttMs();
    }

    public synchronized FrameTransport.TransportCounters transportCounters() {
        return transport.counters();
    }

    public synchronized DepthFrameCodec.DecodeCounters decodeCounters() {
        return frameCodec.counters();
    }

    public String sessionId() {
        return sessionId;
    }

    private void schedule(Runnable task, long periodMs) {
        scheduledTasks.add(
                executor.scheduleAtFixedRate(
                        () -> runLocked(task), periodMs, periodMs, TimeUnit.MILLISECONDS));
    }

    private synchronized void runLocked(Runnable task) {
        if (closed) {
            return;
        }

        // A task that throws would cancel its periodic schedule.
        try {
            task.run();
        } catch (RuntimeException ex) {
            LOGGER.warn("Depth sync task failed", ex);
        }
    }

    private static long monotonicMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }
}

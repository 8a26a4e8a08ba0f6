package me.landon.depthsync.session;

import com.google.gson.JsonParseException;
import it.unimi.dsi.fastutil.longs.LongList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import me.landon.depthsync.buffer.RequestTracker;
import me.landon.depthsync.network.FrameConnector;
import me.landon.depthsync.network.FrameLink;
import me.landon.depthsync.protocol.BinaryDecodingException;
import me.landon.depthsync.protocol.ControlMessage;
import me.landon.depthsync.protocol.ControlMessageCodec;
import me.landon.depthsync.protocol.DepthFrame;
import me.landon.depthsync.protocol.DepthFrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection state machine for the depth stream.
 *
 * <p>Requests are queued in a bounded {@link PendingSendQueue} and transmitted while the
 * connection is {@link ConnectionState#OPEN}. Every response (frame or control message) counts as
 * the completion of one in-flight request. Link callbacks are converted into {@link
 * TransportEvent}s and re-posted onto the event loop, so all state here is touched from that one
 * thread.
 */
public final class FrameTransport {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameTransport.class);

    /** Counters accumulated over the lifetime of the transport. */
    public record TransportCounters(
            long transmitted,
            long refusedSends,
            long framesReceived,
            long controlMessages,
            long serverErrors,
            long droppedPending,
            long decodeRejections) {}

    private final FrameConnector connector;
    private final String sessionId;
    private final DepthFrameCodec frameCodec;
    private final ControlMessageCodec controlCodec = new ControlMessageCodec();
    private final RequestTracker requestTracker;
    private final LongSupplier clock;
    private final Executor eventLoop;
    private final boolean logMalformedOncePerConnection;
    private final PendingSendQueue pendingSend = new PendingSendQueue();
    private final RttEstimator rttEstimator = new RttEstimator();
    private final JitterEstimator jitterEstimator = new JitterEstimator();
    private final List<Consumer<DepthFrame>> frameListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Boolean>> connectionListeners = new CopyOnWriteArrayList<>();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private FrameLink link;
    private long connectionId;
    private int inflight;
    private boolean malformedFrameLogged;

    private long transmitted;
    private long refusedSends;
    private long framesReceived;
    private long controlMessages;
    private long serverErrors;
    private long droppedPending;
    private long decodeRejections;

    public FrameTransport(
            FrameConnector connector,
            String sessionId,
            DepthFrameCodec frameCodec,
            RequestTracker requestTracker,
            LongSupplier clock,
            Executor eventLoop,
            boolean logMalformedOncePerConnection) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.frameCodec = Objects.requireNonNull(frameCodec, "frameCodec");
        this.requestTracker = Objects.requireNonNull(requestTracker, "requestTracker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.logMalformedOncePerConnection = logMalformedOncePerConnection;
    }

    /** Opens a new connection unless one is already connecting or open. */
    public void connect() {
        if (state.isActive()) {
            return;
        }

        long id = ++connectionId;
        state = ConnectionState.CONNECTING;
        malformedFrameLogged = false;
        LOGGER.info("Opening depth stream for session {} (connection {})", sessionId, id);

        try {
            FrameLink opened = connector.open(sessionId, new EventForwarder(id));

            if (id == connectionId && state.isActive()) {
                link = opened;
                flushPending();
            } else {
                opened.close();
            }
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to open depth stream for session {}", sessionId, ex);
            teardown();
        }
    }

    /** Closes the connection and abandons everything queued or in flight. */
    public void close() {
        FrameLink current = link;
        connectionId++;
        teardown();

        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException ex) {
                LOGGER.debug("Ignoring error while closing depth stream", ex);
            }
        }
    }

    public void enqueueRequest(long timestampMs) {
        OptionalLong evicted = pendingSend.offer(timestampMs);

        if (evicted.isPresent()) {
            requestTracker.forgetTransmit(evicted.getAsLong());
            droppedPending++;
        }

        flushPending();
    }

    /** Applies one link event. Events from a superseded connection are ignored. */
    public void handle(TransportEvent event) {
        Objects.requireNonNull(event, "event");

        if (event.connectionId() != connectionId || !state.isActive()) {
            LOGGER.trace("Ignoring stale transport event {}", event);
            return;
        }

        if (event instanceof TransportEvent.Opened) {
            onOpened();
        } else if (event instanceof TransportEvent.TextReceived text) {
            onText(text.text());
        } else if (event instanceof TransportEvent.BinaryReceived binary) {
            onBinary(binary.payload());
        } else if (event instanceof TransportEvent.Failed failed) {
            LOGGER.warn("Depth stream failed: {}", failed.error().toString());
            teardown();
        } else if (event instanceof TransportEvent.Closed closed) {
            LOGGER.info("Depth stream closed ({} {})", closed.code(), closed.reason());
            teardown();
        }
    }

    /** Registers a frame listener and returns a handle that removes it. */
    public Runnable onFrame(Consumer<DepthFrame> listener) {
        Objects.requireNonNull(listener, "listener");
        frameListeners.add(listener);
        return () -> frameListeners.remove(listener);
    }

    /** Registers a connectivity listener and returns a handle that removes it. */
    public Runnable onConnectionChange(Consumer<Boolean> listener) {
        Objects.requireNonNull(listener, "listener");
        connectionListeners.add(listener);
        return () -> connectionListeners.remove(listener);
    }

    public ConnectionState state() {
        return state;
    }

    public int inflightCount() {
        return inflight;
    }

    public double rttMs() {
        return rttEstimator.rttMs();
    }

    public double jitterMs() {
        return jitterEstimator.jitterMs();
    }

    public int pendingCount() {
        return pendingSend.size();
    }

    public LongList pendingSnapshot() {
        return pendingSend.snapshot();
    }

    public long connectionId() {
        return connectionId;
    }

    public TransportCounters counters() {
        return new TransportCounters(
                transmitted,
                refusedSends,
                framesReceived,
                controlMessages,
                serverErrors,
                droppedPending,
                decodeRejections);
    }

    private void onOpened() {
        if (state != ConnectionState.CONNECTING) {
            return;
        }

        state = ConnectionState.OPEN;
        frameCodec.resetOrdering();
        LOGGER.info("Depth stream open for session {}", sessionId);
        emitConnection(true);
        flushPending();
    }

    private void onText(String text) {
        completeRequest();
        controlMessages++;

        try {
            ControlMessage message = controlCodec.decode(text);

            if (message instanceof ControlMessage.ServerError error) {
                serverErrors++;
                LOGGER.warn("Depth stream error from server: {}", error.message());
            } else {
                LOGGER.debug("Ignoring control message {}", message);
            }
        } catch (JsonParseException ex) {
            LOGGER.warn("Dropped malformed control message: {}", ex.getMessage());
        }

        flushPending();
    }

    private void onBinary(byte[] payload) {
        long now = clock.getAsLong();
        completeRequest();
        jitterEstimator.onArrival(now);

        DepthFrame frame;

        try {
            frame = frameCodec.decode(payload);
        } catch (BinaryDecodingException ex) {
            decodeRejections++;
            logRejectedFrame(ex);
            flushPending();
            return;
        }

        OptionalLong transmittedAt = requestTracker.takeTransmitTime(frame.timestampMs());

        if (transmittedAt.isPresent()) {
            rttEstimator.addSample(now - transmittedAt.getAsLong());
        }

        framesReceived++;
        emitFrame(frame);
        flushPending();
    }

    private void flushPending() {
        while (state.canSend() && link != null && !pendingSend.isEmpty()) {
            long timestampMs = pendingSend.poll();
            String request = controlCodec.encode(new ControlMessage.DepthRequest(timestampMs));

            if (!link.sendText(request)) {
                refusedSends++;
                LOGGER.debug("Depth stream refused request for {}ms", timestampMs);
                break;
            }

            requestTracker.recordTransmit(timestampMs, clock.getAsLong());
            inflight++;
            transmitted++;
        }
    }

    private void completeRequest() {
        inflight = Math.max(0, inflight - 1);
    }

    private void teardown() {
        boolean wasActive = state.isActive();
        state = ConnectionState.CLOSED;
        link = null;
        inflight = 0;
        pendingSend.clear();
        requestTracker.forgetAllTransmits();

        if (wasActive) {
            emitConnection(false);
        }
    }

    private void logRejectedFrame(BinaryDecodingException ex) {
        if (ex.reason() == BinaryDecodingException.Reason.OUT_OF_ORDER) {
            LOGGER.debug("Dropped stale depth frame: {}", ex.getMessage());
            return;
        }

        if (logMalformedOncePerConnection && malformedFrameLogged) {
            return;
        }

        malformedFrameLogged = true;
        LOGGER.warn("Dropped depth frame ({}): {}", ex.reason(), ex.getMessage());
    }

    private void emitFrame(DepthFrame frame) {
        for (Consumer<DepthFrame> listener : frameListeners) {
            try {
                listener.accept(frame);
            } catch (RuntimeException ex) {
                LOGGER.warn("Depth frame listener failed", ex);
            }
        }
    }

    private void emitConnection(boolean connected) {
        for (Consumer<Boolean> listener : connectionListeners) {
            try {
                listener.accept(connected);
            } catch (RuntimeException ex) {
                LOGGER.warn("Connection listener failed", ex);
            }
        }
    }

    /** Turns link callbacks into events for one connection and posts them to the event loop. */
    private final class EventForwarder implements FrameLink.Listener {
        private final long id;

        private EventForwarder(long id) {
            this.id = id;
        }

        @Override
        public void onOpen() {
            post(new TransportEvent.Opened(id));
        }

        @Override
        public void onText(String text) {
            post(new TransportEvent.TextReceived(id, text));
        }

        @Override
        public void onBinary(byte[] payload) {
            post(new TransportEvent.BinaryReceived(id, payload));
        }

        @Override
        public void onFailure(Throwable error) {
            post(new TransportEvent.Failed(id, error));
        }

        @Override
        public void onClosed(int code, String reason) {
            post(new TransportEvent.Closed(id, code, reason));
        }

        private void post(TransportEvent event) {
            try {
                eventLoop.execute(() -> handle(event));
            } catch (RejectedExecutionException ex) {
                LOGGER.debug("Event loop stopped, dropping {}", event);
            }
        }
    }
}

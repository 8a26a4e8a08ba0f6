package me.landon.depthsync.protocol;

import java.io.ByteArrayOutputStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Decodes and encodes the 32-byte-header depth frame format.
 *
 * <p>The codec is stateless apart from an ordering cursor: a frame older than the last accepted
 * one is rejected unless the backward jump exceeds {@link ProtocolConstants#SEEK_THRESHOLD_MS},
 * in which case it is treated as a seek and accepted.
 */
public final class DepthFrameCodec {
    /** Handling of frames whose version is not {@link ProtocolConstants#FRAME_VERSION}. */
    public enum VersionPolicy {
        REJECT,
        TOLERATE
    }

    /** Header fields and raw uint16 samples of a frame prior to encoding. */
    public record RawFrame(
            int version,
            long timestampMs,
            int width,
            int height,
            float scale,
            float bias,
            float zMax,
            int[] samples) {
        public RawFrame {
            samples = Objects.requireNonNull(samples, "samples").clone();
        }

        @Override
        public int[] samples() {
            return samples.clone();
        }
    }

    /** Point-in-time view of the codec counters. */
    public record DecodeCounters(
            long accepted,
            long seeks,
            long toleratedVersionMismatches,
            Map<BinaryDecodingException.Reason, Long> rejections) {
        public DecodeCounters {
            rejections = Map.copyOf(rejections);
        }

        public long rejected(BinaryDecodingException.Reason reason) {
            return rejections.getOrDefault(reason, 0L);
        }

        public long totalRejected() {
            return rejections.values().stream().mapToLong(Long::longValue).sum();
        }
    }

    private final VersionPolicy versionPolicy;
    private final long[] rejectionCounts = new long[BinaryDecodingException.Reason.values().length];

    private boolean hasLastTimestamp;
    private long lastTimestampMs;
    private long acceptedCount;
    private long seekCount;
    private long toleratedVersionMismatches;

    public DepthFrameCodec() {
        this(VersionPolicy.REJECT);
    }

    public DepthFrameCodec(VersionPolicy versionPolicy) {
        this.versionPolicy = Objects.requireNonNull(versionPolicy, "versionPolicy");
    }

    public DepthFrame decode(byte[] payload) throws BinaryDecodingException {
        Objects.requireNonNull(payload, "payload");

        try {
            DepthFrame frame = decodeFrame(payload);
            acceptedCount++;
            return frame;
        } catch (BinaryDecodingException ex) {
            rejectionCounts[ex.reason().ordinal()]++;
            throw ex;
        }
    }

    private DepthFrame decodeFrame(byte[] payload) throws BinaryDecodingException {
        if (payload.length < ProtocolConstants.HEADER_BYTES) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.TRUNCATED,
                    "Frame shorter than header: " + payload.length + " bytes");
        }

        BinaryReader reader = new BinaryReader(payload);
        String tag = reader.readAscii(ProtocolConstants.TAG_BYTES);
        boolean compressed;

        if (ProtocolConstants.TAG_DEFLATE.equals(tag)) {
            compressed = true;
        } else if (ProtocolConstants.TAG_RAW.equals(tag)) {
            compressed = false;
        } else {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.UNKNOWN_TAG, "Unknown frame tag: " + tag);
        }

        int version = reader.readUnsignedShort();
        reader.skip(2);
        long timestampMs = reader.readUnsignedInt();
        long width = reader.readUnsignedInt();
        long height = reader.readUnsignedInt();
        float scale = reader.readFloat();
        float bias = reader.readFloat();
        float zMax = reader.readFloat();

        if (version != ProtocolConstants.FRAME_VERSION) {
            if (versionPolicy == VersionPolicy.REJECT) {
                throw new BinaryDecodingException(
                        BinaryDecodingException.Reason.VERSION_MISMATCH,
                        "Unsupported frame version: " + version);
            }

            toleratedVersionMismatches++;
        }

        if (width == 0
                || height == 0
                || width > ProtocolConstants.MAX_DIMENSION
                || height > ProtocolConstants.MAX_DIMENSION) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.DIMENSIONS_OUT_OF_BOUNDS,
                    "Frame dimensions out of bounds: " + width + "x" + height);
        }

        boolean seek =
                hasLastTimestamp
                        && lastTimestampMs - timestampMs > ProtocolConstants.SEEK_THRESHOLD_MS;

        if (hasLastTimestamp && timestampMs < lastTimestampMs && !seek) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.OUT_OF_ORDER,
                    "Stale frame " + timestampMs + " after " + lastTimestampMs);
        }

        int sampleCount = (int) (width * height);
        int expectedBytes = sampleCount * ProtocolConstants.BYTES_PER_SAMPLE;
        byte[] sampleBytes =
                compressed
                        ? inflate(reader.readRemaining(), expectedBytes)
                        : reader.readRemaining();

        if (sampleBytes.length != expectedBytes) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.SIZE_MISMATCH,
                    "Expected " + expectedBytes + " sample bytes, got " + sampleBytes.length);
        }

        float[] depth = new float[sampleCount];

        for (int i = 0; i < sampleCount; i++) {
            int offset = i * ProtocolConstants.BYTES_PER_SAMPLE;
            int sample = (sampleBytes[offset] & 0xFF) | ((sampleBytes[offset + 1] & 0xFF) << 8);
            depth[i] = sample * scale + bias;
        }

        if (seek) {
            seekCount++;
        }

        hasLastTimestamp = true;
        lastTimestampMs = timestampMs;
        return new DepthFrame(timestampMs, (int) width, (int) height, depth, scale, bias, zMax);
    }

    public byte[] encode(RawFrame frame, boolean compress) {
        Objects.requireNonNull(frame, "frame");
        int[] samples = frame.samples();

        if ((long) frame.width() * frame.height() != samples.length) {
            throw new IllegalArgumentException(
                    "Sample count "
                            + samples.length
                            + " does not match "
                            + frame.width()
                            + "x"
                            + frame.height());
        }

        byte[] sampleBytes = new byte[samples.length * ProtocolConstants.BYTES_PER_SAMPLE];

        for (int i = 0; i < samples.length; i++) {
            int sample = samples[i];

            if (sample < 0 || sample > 0xFFFF) {
                throw new IllegalArgumentException("Sample out of uint16 range: " + sample);
            }

            sampleBytes[i * 2] = (byte) (sample & 0xFF);
            sampleBytes[i * 2 + 1] = (byte) ((sample >>> 8) & 0xFF);
        }

        byte[] body = compress ? deflate(sampleBytes) : sampleBytes;
        BinaryWriter writer = new BinaryWriter(ProtocolConstants.HEADER_BYTES + body.length);
        writer.writeAscii(
                compress ? ProtocolConstants.TAG_DEFLATE : ProtocolConstants.TAG_RAW,
                ProtocolConstants.TAG_BYTES);
        writer.writeShort(frame.version());
        writer.writeShort(ProtocolConstants.SAMPLE_TYPE_UINT16);
        writer.writeUnsignedInt(frame.timestampMs());
        writer.writeUnsignedInt(frame.width());
        writer.writeUnsignedInt(frame.height());
        writer.writeFloat(frame.scale());
        writer.writeFloat(frame.bias());
        writer.writeFloat(frame.zMax());
        writer.writeBytes(body);
        return writer.toByteArray();
    }

    /** Forgets the ordering cursor so the next frame is accepted regardless of its timestamp. */
    public void resetOrdering() {
        hasLastTimestamp = false;
        lastTimestampMs = 0L;
    }

    public boolean hasLastTimestamp() {
        return hasLastTimestamp;
    }

    public long lastTimestampMs() {
        return lastTimestampMs;
    }

    public VersionPolicy versionPolicy() {
        return versionPolicy;
    }

    public DecodeCounters counters() {
        Map<BinaryDecodingException.Reason, Long> rejections =
                new EnumMap<>(BinaryDecodingException.Reason.class);

        for (BinaryDecodingException.Reason reason : BinaryDecodingException.Reason.values()) {
            long count = rejectionCounts[reason.ordinal()];

            if (count > 0) {
                rejections.put(reason, count);
            }
        }

        return new DecodeCounters(acceptedCount, seekCount, toleratedVersionMismatches, rejections);
    }

    private static byte[] inflate(byte[] compressed, int expectedBytes)
            throws BinaryDecodingException {
        Inflater inflater = new Inflater();

        try {
            inflater.setInput(compressed);
            byte[] out = new byte[expectedBytes];
            int written = 0;

            while (written < expectedBytes && !inflater.finished()) {
                int count = inflater.inflate(out, written, expectedBytes - written);

                if (count == 0) {
                    throw new BinaryDecodingException(
                            BinaryDecodingException.Reason.CORRUPT_PAYLOAD,
                            "Compressed payload ended after " + written + " bytes");
                }

                written += count;
            }

            if (!inflater.finished()) {
                if (inflater.inflate(new byte[1]) > 0) {
                    throw new BinaryDecodingException(
                            BinaryDecodingException.Reason.SIZE_MISMATCH,
                            "Compressed payload inflates beyond " + expectedBytes + " bytes");
                }

                if (!inflater.finished()) {
                    throw new BinaryDecodingException(
                            BinaryDecodingException.Reason.CORRUPT_PAYLOAD,
                            "Compressed payload is incomplete");
                }
            }

            if (written != expectedBytes) {
                byte[] shortOut = new byte[written];
                System.arraycopy(out, 0, shortOut, 0, written);
                return shortOut;
            }

            return out;
        } catch (DataFormatException ex) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.CORRUPT_PAYLOAD,
                    "Failed to inflate payload: " + ex.getMessage(),
                    ex);
        } finally {
            inflater.end();
        }
    }

    private static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater(Deflater.BEST_SPEED);

        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream output = new ByteArrayOutputStream(raw.length / 2 + 16);
            byte[] chunk = new byte[4096];

            while (!deflater.finished()) {
                int count = deflater.deflate(chunk);
                output.write(chunk, 0, count);
            }

            return output.toByteArray();
        } finally {
            deflater.end();
        }
    }
}

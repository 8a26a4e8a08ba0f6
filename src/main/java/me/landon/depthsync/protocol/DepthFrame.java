package me.landon.depthsync.protocol;

import java.nio.FloatBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * One decoded depth map.
 *
 * <p>Instances are immutable. The depth plane is shared by reference through {@link #depth()},
 * which returns a read-only view, so a frame can be handed to a renderer without copying.
 */
public final class DepthFrame {
    private final long timestampMs;
    private final int width;
    private final int height;
    private final float[] depth;
    private final float scale;
    private final float bias;
    private final float zMax;

    DepthFrame(
            long timestampMs,
            int width,
            int height,
            float[] depth,
            float scale,
            float bias,
            float zMax) {
        Objects.requireNonNull(depth, "depth");

        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Frame dimensions must be positive: " + width + "x" + height);
        }

        if ((long) width * height != depth.length) {
            throw new IllegalArgumentException(
                    "Depth plane has "
                            + depth.length
                            + " values, expected "
                            + ((long) width * height));
        }

        this.timestampMs = timestampMs;
        this.width = width;
        this.height = height;
        this.depth = depth;
        this.scale = scale;
        this.bias = bias;
        this.zMax = zMax;
    }

    /** Creates a frame from a caller-owned depth plane. The array is copied. */
    public static DepthFrame of(
            long timestampMs,
            int width,
            int height,
            float[] depth,
            float scale,
            float bias,
            float zMax) {
        return new DepthFrame(
                timestampMs,
                width,
                height,
                Objects.requireNonNull(depth, "depth").clone(),
                scale,
                bias,
                zMax);
    }

    public long timestampMs() {
        return timestampMs;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int sampleCount() {
        return depth.length;
    }

    public float depthAt(int index) {
        return depth[index];
    }

    public float depthAt(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel out of bounds: " + x + "," + y);
        }

        return depth[y * width + x];
    }

    public FloatBuffer depth() {
        return FloatBuffer.wrap(depth).asReadOnlyBuffer();
    }

    public float[] copyDepth() {
        return Arrays.copyOf(depth, depth.length);
    }

    public float scale() {
        return scale;
    }

    public float bias() {
        return bias;
    }

    public float zMax() {
        return zMax;
    }

    @Override
    public String toString() {
        return "DepthFrame{ts="
                + timestampMs
                + ", "
                + width
                + "x"
                + height
                + ", scale="
                + scale
                + ", bias="
                + bias
                + ", zMax="
                + zMax
                + "}";
    }
}

package me.landon.depthsync.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

public final class BinaryWriter {
    private final ByteArrayOutputStream output;

    public BinaryWriter() {
        this(64);
    }

    public BinaryWriter(int initialCapacity) {
        output = new ByteArrayOutputStream(initialCapacity);
    }

    public void writeAscii(String value, int byteCount) {
        byte[] ascii = value.getBytes(StandardCharsets.US_ASCII);

        if (ascii.length != byteCount) {
            throw new IllegalArgumentException(
                    "ASCII field must be exactly " + byteCount + " bytes: " + value);
        }

        writeBytes(ascii);
    }

    public void writeShort(int value) {
        output.write(value & 0xFF);
        output.write((value >>> 8) & 0xFF);
    }

    public void writeInt(int value) {
        for (int i = 0; i < Integer.BYTES; i++) {
            output.write((value >>> (i * 8)) & 0xFF);
        }
    }

    public void writeUnsignedInt(long value) {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("uint32 out of range: " + value);
        }

        writeInt((int) value);
    }

    public void writeFloat(float value) {
        writeInt(Float.floatToIntBits(value));
    }

    public void writeBytes(byte[] data) {
        output.writeBytes(data);
    }

    public byte[] toByteArray() {
        return output.toByteArray();
    }
}

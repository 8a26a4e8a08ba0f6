package me.landon.depthsync.protocol;

import java.nio.charset.StandardCharsets;

/** Little-endian cursor over a frame buffer. */
public final class BinaryReader {
    private final byte[] data;
    private int cursor;

    public BinaryReader(byte[] data) {
        this.data = data;
    }

    public String readAscii(int byteCount) throws BinaryDecodingException {
        return new String(readBytes(byteCount), StandardCharsets.US_ASCII);
    }

    public int readUnsignedShort() throws BinaryDecodingException {
        require(Short.BYTES, "uint16");
        int value = (data[cursor] & 0xFF) | ((data[cursor + 1] & 0xFF) << 8);
        cursor += Short.BYTES;
        return value;
    }

    public long readUnsignedInt() throws BinaryDecodingException {
        return readIntBits() & 0xFFFFFFFFL;
    }

    public float readFloat() throws BinaryDecodingException {
        return Float.intBitsToFloat(readIntBits());
    }

    public void skip(int byteCount) throws BinaryDecodingException {
        require(byteCount, "skip");
        cursor += byteCount;
    }

    public byte[] readBytes(int byteCount) throws BinaryDecodingException {
        if (byteCount < 0) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.TRUNCATED,
                    "Requested byte count out of bounds: " + byteCount);
        }

        require(byteCount, "bytes");
        byte[] out = new byte[byteCount];
        System.arraycopy(data, cursor, out, 0, byteCount);
        cursor += byteCount;
        return out;
    }

    public byte[] readRemaining() {
        byte[] out = new byte[remaining()];
        System.arraycopy(data, cursor, out, 0, out.length);
        cursor = data.length;
        return out;
    }

    public int remaining() {
        return data.length - cursor;
    }

    private int readIntBits() throws BinaryDecodingException {
        require(Integer.BYTES, "uint32");
        int value =
                (data[cursor] & 0xFF)
                        | ((data[cursor + 1] & 0xFF) << 8)
                        | ((data[cursor + 2] & 0xFF) << 16)
                        | ((data[cursor + 3] & 0xFF) << 24);
        cursor += Integer.BYTES;
        return value;
    }

    private void require(int byteCount, String field) throws BinaryDecodingException {
        if (byteCount > remaining()) {
            throw new BinaryDecodingException(
                    BinaryDecodingException.Reason.TRUNCATED,
                    "Unexpected end of frame while reading " + field);
        }
    }
}

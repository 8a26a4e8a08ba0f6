package me.landon.depthsync.protocol;

public final class ProtocolConstants {
    public static final String TAG_RAW = "VDZ1";
    public static final String TAG_DEFLATE = "VDZ2";
    public static final int FRAME_VERSION = 1;
    public static final int SAMPLE_TYPE_UINT16 = 1;

    public static final int HEADER_BYTES = 32;
    public static final int TAG_BYTES = 4;
    public static final int BYTES_PER_SAMPLE = 2;
    public static final int MAX_DIMENSION = 4096;

    public static final long SEEK_THRESHOLD_MS = 500;

    public static final String REQUEST_TIME_FIELD = "time_ms";
    public static final String CONTROL_TYPE_FIELD = "type";
    public static final String CONTROL_MESSAGE_FIELD = "message";
    public static final String CONTROL_TYPE_ERROR = "error";

    public static final String SESSIONS_PATH = "api/sessions";
    public static final String STREAM_SEGMENT = "stream";
    public static final String STATUS_SEGMENT = "status";
    public static final String LOG_PATH = "api/log";
    public static final String LOG_MESSAGE_FIELD = "message";

    private ProtocolConstants() {}
}

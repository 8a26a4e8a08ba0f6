package me.landon.depthsync.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

class SessionStatusClientTest {
    private static final String STATUS_JSON =
            "{\"session_id\":\"f00d\",\"width\":640,\"height\":360,\"fps\":29.97,"
                    + "\"duration_ms\":12000.0,\"buffer_length\":4,\"last_depth_time_ms\":1033.0,"
                    + "\"telemetry\":{\"decode_ms\":4.5},"
                    + "\"rolling_stats\":{\"depth_fps\":24.0,\"latency_ms\":180.0,"
                    + "\"infer_avg_s\":0.1,\"queue_avg_s\":0.05,\"ws_send_avg_s\":0.002,"
                    + "\"drop_count\":3},"
                    + "\"config\":{\"inference_workers\":3,\"process_res\":384,"
                    + "\"downsample_factor\":2}}";

    private final SessionStatusClient client =
            new SessionStatusClient(new OkHttpClient(), "http://localhost:8000/depth");

    @Test
    void buildsSessionScopedUrls() {
        assertEquals(
                "http://localhost:8000/depth/api/sessions/f00d/status",
                client.statusUrl("f00d").toString());

        HttpUrl stream =
                SessionStatusClient.sessionUrl(
                        HttpUrl.get("https://example.com"), "a/b", "stream");
        assertEquals("https://example.com/api/sessions/a%2Fb/stream", stream.toString());
    }

    @Test
    void rejectsInvalidBaseUrl() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new SessionStatusClient(new OkHttpClient(), "not a url"));
    }

    @Test
    void parsesStatusDocument() throws Exception {
        SessionStatus status = client.parseStatus(response(200, STATUS_JSON));

        assertEquals("f00d", status.sessionId);
        assertEquals(29.97, status.fps, 1e-9);
        assertEquals(4, status.bufferLength);
        assertEquals(4.5, status.telemetry.get("decode_ms"), 1e-9);
        assertEquals(0.1, status.rollingStats.inferAvgSeconds, 1e-9);
        assertEquals(3, status.rollingStats.dropCount);
        assertNull(status.rollingStats.decodeAvgSeconds);
        assertEquals(3, status.config.inferenceWorkers);
        assertEquals(384, status.config.processResolution);
    }

    @Test
    void toleratesMissingOptionalSections() throws Exception {
        SessionStatus status = client.parseStatus(response(200, "{\"session_id\":\"x\"}"));

        assertNull(status.config);
        assertNull(status.rollingStats);
    }

    @Test
    void failsOnHttpError() {
        assertThrows(IOException.class, () -> client.parseStatus(response(404, "{}")));
    }

    private static Response response(int code, String body) {
        return new Response.Builder()
                .request(new Request.Builder().url("http://localhost:8000/").build())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("test")
                .body(ResponseBody.create(body, MediaType.get("application/json")))
                .build();
    }
}

package me.landon.depthsync.network;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.util.Objects;
import me.landon.depthsync.protocol.ProtocolConstants;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** HTTP side of the session API: status polling and remote log lines. */
public final class SessionStatusClient implements StatusSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStatusClient.class);
    private static final MediaType JSON_MEDIA_TYPE =
            MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final HttpUrl logUrl;
    private final Gson gson = new Gson();

    public SessionStatusClient(OkHttpClient httpClient, String serverBaseUrl) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = parseBaseUrl(serverBaseUrl);
        this.logUrl = baseUrl.newBuilder().addPathSegments(ProtocolConstants.LOG_PATH).build();
    }

    @Override
    public void fetchStatus(String sessionId, Callback callback) {
        Objects.requireNonNull(callback, "callback");
        Request request = new Request.Builder().url(statusUrl(sessionId)).get().build();

        httpClient
                .newCall(request)
                .enqueue(
                        new okhttp3.Callback() {
                            @Override
                            public void onFailure(Call call, IOException error) {
                                callback.onFailure(error);
                            }

                            @Override
                            public void onResponse(Call call, Response response) {
                                try (response) {
                                    callback.onStatus(parseStatus(response));
                                } catch (IOException | JsonParseException ex) {
                                    callback.onFailure(ex);
                                }
                            }
                        });
    }

    /** Posts one log line to the server. Failures are logged and otherwise ignored. */
    public void postLog(String message) {
        JsonObject body = new JsonObject();
        body.addProperty(
                ProtocolConstants.LOG_MESSAGE_FIELD, Objects.requireNonNull(message, "message"));
        Request request =
                new Request.Builder()
                        .url(logUrl)
                        .post(RequestBody.create(gson.toJson(body), JSON_MEDIA_TYPE))
                        .build();

        httpClient
                .newCall(request)
                .enqueue(
                        new okhttp3.Callback() {
                            @Override
                            public void onFailure(Call call, IOException error) {
                                LOGGER.debug("Remote log post failed: {}", error.toString());
                            }

                            @Override
                            public void onResponse(Call call, Response response) {
                                response.close();
                            }
                        });
    }

    HttpUrl statusUrl(String sessionId) {
        return sessionUrl(baseUrl, sessionId, ProtocolConstants.STATUS_SEGMENT);
    }

    SessionStatus parseStatus(Response response) throws IOException {
        if (!response.isSuccessful()) {
            throw new IOException("Status request failed with HTTP " + response.code());
        }

        ResponseBody body = response.body();

        if (body == null) {
            throw new IOException("Status response has no body");
        }

        SessionStatus status = gson.fromJson(body.charStream(), SessionStatus.class);

        if (status == null) {
            throw new JsonParseException("Status response is empty");
        }

        return status;
    }

    static HttpUrl parseBaseUrl(String serverBaseUrl) {
        Objects.requireNonNull(serverBaseUrl, "serverBaseUrl");
        HttpUrl parsed = HttpUrl.parse(serverBaseUrl);

        if (parsed == null) {
            throw new IllegalArgumentException("Invalid server base URL: " + serverBaseUrl);
        }

        return parsed;
    }

    /** Builds {@code <base>/api/sessions/{sessionId}/{leaf}} with the id as a single segment. */
    static HttpUrl sessionUrl(HttpUrl baseUrl, String sessionId, String leaf) {
        Objects.requireNonNull(sessionId, "sessionId");

        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }

        return baseUrl.newBuilder()
                .addPathSegments(ProtocolConstants.SESSIONS_PATH)
                .addPathSegment(sessionId)
                .addPathSegment(leaf)
                .build();
    }
}

package me.landon.depthsync.network;

import java.util.Objects;
import me.landon.depthsync.protocol.ProtocolConstants;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

/** Opens the session depth stream as an OkHttp WebSocket. */
public final class OkHttpFrameConnector implements FrameConnector {
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;

    public OkHttpFrameConnector(OkHttpClient httpClient, String serverBaseUrl) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = SessionStatusClient.parseBaseUrl(serverBaseUrl);
    }

    @Override
    public FrameLink open(String sessionId, FrameLink.Listener listener) {
        Objects.requireNonNull(listener, "listener");
        HttpUrl url =
                SessionStatusClient.sessionUrl(baseUrl, sessionId, ProtocolConstants.STREAM_SEGMENT);
        Request request = new Request.Builder().url(url).build();
        WebSocket webSocket = httpClient.newWebSocket(request, new ListenerBridge(listener));
        return new WebSocketLink(webSocket);
    }

    private static final class WebSocketLink implements FrameLink {
        private final WebSocket webSocket;

        private WebSocketLink(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public boolean sendText(String text) {
            return webSocket.send(text);
        }

        @Override
        public void close() {
            if (!webSocket.close(NORMAL_CLOSURE, "client closed")) {
                webSocket.cancel();
            }
        }
    }

    private static final class ListenerBridge extends WebSocketListener {
        private final FrameLink.Listener listener;

        private ListenerBridge(FrameLink.Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            listener.onOpen();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            listener.onText(text);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            listener.onBinary(bytes.toByteArray());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            listener.onClosed(code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable error, Response response) {
            listener.onFailure(error);
        }
    }
}

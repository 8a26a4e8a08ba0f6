package me.landon.depthsync.runtime;

import java.util.ArrayList;
import java.util.List;
import me.landon.depthsync.network.FrameConnector;
import me.landon.depthsync.network.FrameLink;

/** Connector that records what is sent and lets a test drive the link callbacks. */
final class FakeFrameConnector implements FrameConnector {
    final List<String> sent = new ArrayList<>();
    FrameLink.Listener listener;
    int opened;
    int closed;

    @Override
    public FrameLink open(String sessionId, FrameLink.Listener listener) {
        this.listener = listener;
        opened++;
        return new FrameLink() {
            @Override
            public boolean sendText(String text) {
                sent.add(text);
                return true;
            }

            @Override
            public void close() {
                closed++;
            }
        };
    }
}

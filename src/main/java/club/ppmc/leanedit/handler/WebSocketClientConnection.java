/**
 * WebSocketClientConnection.java
 *
 * Adapts a Spring WebSocket session to the blocking ClientConnection a
 * SessionBridge reads from. Incoming text frames are queued by the handler
 * thread and taken by the bridge's inbound loop; sends go through a
 * ConcurrentWebSocketSessionDecorator so that the outbound loop and the close
 * path may use the session concurrently and a stalled client cannot block forever.
 */
package club.ppmc.leanedit.handler;

import club.ppmc.leanedit.service.ClientConnection;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;
    private final BlockingQueue<Optional<String>> inbox = new LinkedBlockingQueue<>();

    public WebSocketClientConnection(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    /** Queues a frame received from the client. */
    public void deliver(String text) {
        inbox.add(Optional.of(text));
    }

    /** Marks the end of input; pending frames are still delivered first. */
    public void complete() {
        inbox.add(Optional.empty());
    }

    @Override
    public String receive() throws InterruptedException {
        Optional<String> next = inbox.take();
        if (next.isEmpty()) {
            // keep the end marker for any later caller
            inbox.add(next);
            return null;
        }
        return next.get();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(CloseStatus status) throws IOException {
        session.close(status);
    }
}

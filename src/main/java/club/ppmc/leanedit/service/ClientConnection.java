/**
 * ClientConnection.java
 *
 * The client side of a session as seen by SessionBridge: a blocking source of
 * text frames, a sink for text frames and a way to close with a status.
 * WebSocketClientConnection adapts a Spring WebSocket session to it.
 */
package club.ppmc.leanedit.service;

import java.io.IOException;
import org.springframework.web.socket.CloseStatus;

public interface ClientConnection {

    /** Identifier used in log lines. */
    String id();

    /**
     * Blocks until the next text frame arrives.
     *
     * @return the frame, or {@code null} once the client has disconnected.
     * @throws InterruptedException if the reading thread is interrupted.
     */
    String receive() throws InterruptedException;

    void send(String text) throws IOException;

    boolean isOpen();

    void close(CloseStatus status) throws IOException;
}

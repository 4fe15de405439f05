/**
 * WebSocketRoomClient.java
 *
 * RoomClient over a WebSocket session. Broadcasts from other connections' threads
 * are serialized by the decorator.
 */
package club.ppmc.leanedit.handler;

import club.ppmc.leanedit.service.room.RoomClient;
import java.io.IOException;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

public class WebSocketRoomClient implements RoomClient {

    private final WebSocketSession session;

    public WebSocketRoomClient(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(byte[] frame) throws IOException {
        session.sendMessage(new BinaryMessage(frame));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}

/**
 * RoomWebSocketHandler.java
 *
 * Endpoint {@code /yjs/{room}}. Joins each connection to its DocumentRoom and
 * passes the binary y-websocket frames through; the room does the protocol work.
 */
package club.ppmc.leanedit.handler;

import club.ppmc.leanedit.service.RoomRegistry;
import club.ppmc.leanedit.service.SettingsService;
import club.ppmc.leanedit.service.room.DocumentRoom;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.BinaryWebSocketHandler;

@Component
@Slf4j
public class RoomWebSocketHandler extends BinaryWebSocketHandler {

    public static final String ROOM_ATTRIBUTE = "room";

    private final RoomRegistry roomRegistry;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimit;
    private final Map<String, Membership> memberships = new ConcurrentHashMap<>();

    public RoomWebSocketHandler(RoomRegistry roomRegistry, SettingsService settingsService) {
        this.roomRegistry = roomRegistry;
        this.sendTimeLimitMillis = settingsService.getSendTimeLimitMillis();
        this.bufferSizeLimit = settingsService.getMaxMessageBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String roomName = (String) session.getAttributes().get(ROOM_ATTRIBUTE);
        DocumentRoom room;
        try {
            room = roomRegistry.getOrCreateRoom(roomName);
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting room connection {}: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("invalid-room-name"));
            return;
        }
        var client = new WebSocketRoomClient(session, sendTimeLimitMillis, bufferSizeLimit);
        memberships.put(session.getId(), new Membership(room, client));
        room.join(client);
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        Membership membership = memberships.get(session.getId());
        if (membership == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] frame = new byte[payload.remaining()];
        payload.get(frame);
        membership.room().handleMessage(membership.client(), frame);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on room connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Membership membership = memberships.remove(session.getId());
        if (membership != null) {
            membership.room().leave(membership.client());
        }
    }

    private record Membership(DocumentRoom room, WebSocketRoomClient client) {}
}

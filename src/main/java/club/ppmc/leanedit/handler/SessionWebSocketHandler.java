/**
 * SessionWebSocketHandler.java
 *
 * Endpoint {@code /lsp/{sessionId}}. Each connection gets its own SessionBridge
 * running on the bridge executor; this handler only feeds it frames and tells it
 * when the client is gone. Frames are JSON-RPC messages, one per text frame.
 */
package club.ppmc.leanedit.handler;

import club.ppmc.leanedit.service.SessionBridgeFactory;
import club.ppmc.leanedit.service.SettingsService;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class SessionWebSocketHandler extends TextWebSocketHandler {

    public static final String SESSION_ID_ATTRIBUTE = "sessionId";

    private final SessionBridgeFactory bridgeFactory;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimit;
    private final Map<String, WebSocketClientConnection> connections = new ConcurrentHashMap<>();

    public SessionWebSocketHandler(SessionBridgeFactory bridgeFactory, SettingsService settingsService) {
        this.bridgeFactory = bridgeFactory;
        this.sendTimeLimitMillis = settingsService.getSendTimeLimitMillis();
        this.bufferSizeLimit = settingsService.getMaxMessageBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String sessionId = (String) session.getAttributes().get(SESSION_ID_ATTRIBUTE);
        var connection = new WebSocketClientConnection(session, sendTimeLimitMillis, bufferSizeLimit);
        connections.put(session.getId(), connection);
        log.info("Session connection {} opened for session {}", session.getId(), sessionId);
        bridgeFactory.start(sessionId, connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketClientConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.warn("Text frame on unknown session connection {}; ignoring.", session.getId());
            return;
        }
        connection.deliver(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketClientConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.complete();
        }
        log.info("Session connection {} closed: {}", session.getId(), status);
    }
}

package club.ppmc.leanedit.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.leanedit.service.ClientConnection;
import club.ppmc.leanedit.service.SessionBridgeFactory;
import club.ppmc.leanedit.service.SettingsService;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class SessionWebSocketHandlerTest {

    @TempDir
    Path tempDir;

    @Test
    void connectionStartsBridgeAndFeedsItFrames() throws Exception {
        var settings = new SettingsService(
                tempDir.toString(), "src/Scratch.lean", new String[] {"lake", "serve"}, 5, 2000,
                tempDir.resolve("data").toString(), 1024 * 1024, 1000);
        SessionBridgeFactory factory = mock(SessionBridgeFactory.class);
        var handler = new SessionWebSocketHandler(factory, settings);
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.getAttributes()).thenReturn(Map.of(SessionWebSocketHandler.SESSION_ID_ATTRIBUTE, "alice"));

        handler.afterConnectionEstablished(session);
        handler.handleMessage(session, new TextMessage("{\"method\":\"initialized\",\"params\":{}}"));
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        ArgumentCaptor<ClientConnection> connection = ArgumentCaptor.forClass(ClientConnection.class);
        verify(factory).start(eq("alice"), connection.capture());
        assertThat(connection.getValue().receive()).isEqualTo("{\"method\":\"initialized\",\"params\":{}}");
        assertThat(connection.getValue().receive()).isNull();
    }

    @Test
    void framesForUnknownConnectionsAreIgnored() throws Exception {
        var settings = new SettingsService(
                tempDir.toString(), "src/Scratch.lean", new String[] {"lake", "serve"}, 5, 2000,
                tempDir.resolve("data").toString(), 1024 * 1024, 1000);
        SessionBridgeFactory factory = mock(SessionBridgeFactory.class);
        var handler = new SessionWebSocketHandler(factory, settings);
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ghost");

        handler.handleMessage(session, new TextMessage("{}"));

        verify(factory, never()).start(any(), any());
    }
}

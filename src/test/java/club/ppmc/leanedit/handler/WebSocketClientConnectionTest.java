package club.ppmc.leanedit.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class WebSocketClientConnectionTest {

    @Test
    void framesAreReceivedInOrderThenEndOfInputRepeats() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        var connection = new WebSocketClientConnection(session, 1000, 1024);

        connection.deliver("a");
        connection.deliver("b");
        connection.complete();

        assertThat(connection.id()).isEqualTo("ws-1");
        assertThat(connection.receive()).isEqualTo("a");
        assertThat(connection.receive()).isEqualTo("b");
        assertThat(connection.receive()).isNull();
        assertThat(connection.receive()).isNull();
    }

    @Test
    void sendAndCloseGoToTheSession() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-2");
        when(session.isOpen()).thenReturn(true);
        var connection = new WebSocketClientConnection(session, 1000, 1024);

        connection.send("{\"id\":1}");
        connection.close(CloseStatus.POLICY_VIOLATION);

        verify(session).sendMessage(new TextMessage("{\"id\":1}"));
        verify(session).close(CloseStatus.POLICY_VIOLATION);
    }
}

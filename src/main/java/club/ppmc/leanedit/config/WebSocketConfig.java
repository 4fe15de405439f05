/**
 * WebSocketConfig.java
 *
 * Registers the two raw WebSocket endpoints:
 *
 * <ul>
 *   <li>{@code /yjs/{room}}: binary y-websocket frames for a shared document room;</li>
 *   <li>{@code /lsp/{sessionId}}: JSON-RPC text frames bridged to a language server.</li>
 * </ul>
 *
 * The trailing path segment is copied into a session attribute during the handshake.
 * Container buffers are raised because full-document sync messages and Yjs
 * snapshots easily exceed the 8 KB default.
 */
package club.ppmc.leanedit.config;

import club.ppmc.leanedit.handler.PathVariableHandshakeInterceptor;
import club.ppmc.leanedit.handler.RoomWebSocketHandler;
import club.ppmc.leanedit.handler.SessionWebSocketHandler;
import club.ppmc.leanedit.service.SettingsService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SessionWebSocketHandler sessionHandler;
    private final RoomWebSocketHandler roomHandler;

    public WebSocketConfig(SessionWebSocketHandler sessionHandler, RoomWebSocketHandler roomHandler) {
        this.sessionHandler = sessionHandler;
        this.roomHandler = roomHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(roomHandler, "/yjs/*")
                .addInterceptors(new PathVariableHandshakeInterceptor(RoomWebSocketHandler.ROOM_ATTRIBUTE))
                .setAllowedOriginPatterns("*");
        registry.addHandler(sessionHandler, "/lsp/*")
                .addInterceptors(new PathVariableHandshakeInterceptor(SessionWebSocketHandler.SESSION_ID_ATTRIBUTE))
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(SettingsService settingsService) {
        int maxMessageBytes = settingsService.getMaxMessageBytes();
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxMessageBytes);
        container.setMaxBinaryMessageBufferSize(maxMessageBytes);
        return container;
    }
}

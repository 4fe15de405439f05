/**
 * PathVariableHandshakeInterceptor.java
 *
 * Copies the last path segment of a WebSocket handshake URL (the session id in
 * {@code /lsp/{sessionId}}, the room name in {@code /yjs/{room}}) into a session
 * attribute. Handshakes without a segment are rejected with 400.
 */
package club.ppmc.leanedit.handler;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriUtils;

@Slf4j
public class PathVariableHandshakeInterceptor implements HandshakeInterceptor {

    private final String attributeName;

    public PathVariableHandshakeInterceptor(String attributeName) {
        this.attributeName = attributeName;
    }

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        String value = lastSegment(request.getURI().getRawPath());
        if (value == null) {
            log.warn("Rejecting WebSocket handshake without {}: {}", attributeName, request.getURI());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(attributeName, value);
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }

    static String lastSegment(String rawPath) {
        if (rawPath == null) {
            return null;
        }
        int slash = rawPath.lastIndexOf('/');
        String segment;
        try {
            segment = UriUtils.decode(rawPath.substring(slash + 1), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // broken percent-encoding
            return null;
        }
        return segment.isBlank() ? null : segment;
    }
}

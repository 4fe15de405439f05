/**
 * FramingException.java
 *
 * Raised when a Content-Length framed message read from an analysis process is
 * malformed: missing or invalid length header, truncated body, or a body that is
 * not a JSON-RPC message. Fatal to the read; the session's outbound loop ends on it.
 */
package club.ppmc.leanedit.exception;

import java.io.IOException;

public class FramingException extends IOException {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}

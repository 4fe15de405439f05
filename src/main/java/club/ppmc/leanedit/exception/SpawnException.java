/**
 * SpawnException.java
 *
 * Raised when the analysis process for a session cannot be started (missing
 * executable, bad working directory, OS resource exhaustion). It is never retried;
 * the session connection is closed with a server-error status instead.
 */
package club.ppmc.leanedit.exception;

import lombok.Getter;

@Getter
public class SpawnException extends RuntimeException {

    /** Session whose process failed to start. */
    private final String sessionId;

    public SpawnException(String sessionId, Throwable cause) {
        super("Failed to start analysis process for session " + sessionId + ": " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }
}

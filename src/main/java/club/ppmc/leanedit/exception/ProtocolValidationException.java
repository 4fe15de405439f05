/**
 * ProtocolValidationException.java
 *
 * Raised when a message from a client fails the URI-shape checks or cannot be
 * parsed at all. One such message poisons the whole session: the bridge closes the
 * connection with a policy-violation status whose reason is {@link #getReason()}.
 */
package club.ppmc.leanedit.exception;

import lombok.Getter;

@Getter
public class ProtocolValidationException extends RuntimeException {

    /** Short machine-readable reason, e.g. {@code invalid-uri: textDocument.uri}. */
    private final String reason;

    public ProtocolValidationException(String reason, String detail) {
        super(reason + " (" + detail + ")");
        this.reason = reason;
    }
}

/**
 * BridgeState.java
 *
 * Lifecycle of a session bridge: CONNECTING -> ACTIVE -> CLOSING -> CLOSED.
 * A bridge whose process cannot be spawned goes from CONNECTING straight to CLOSED.
 */
package club.ppmc.leanedit.model;

public enum BridgeState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}

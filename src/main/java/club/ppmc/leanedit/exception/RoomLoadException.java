/**
 * RoomLoadException.java
 *
 * The persisted update history of a room could not be replayed. The room is still
 * marked ready and served with whatever state was recovered; the exception is
 * logged and kept on the room for inspection.
 */
package club.ppmc.leanedit.exception;

import lombok.Getter;

@Getter
public class RoomLoadException extends RuntimeException {

    private final String roomName;

    public RoomLoadException(String roomName, Throwable cause) {
        super("Failed to load persisted history of room '" + roomName + "': " + cause.getMessage(), cause);
        this.roomName = roomName;
    }
}

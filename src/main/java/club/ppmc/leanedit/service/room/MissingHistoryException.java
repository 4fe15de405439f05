/**
 * MissingHistoryException.java
 *
 * No update history has been persisted for a room yet. Expected for new rooms.
 */
package club.ppmc.leanedit.service.room;

import java.io.IOException;

public class MissingHistoryException extends IOException {

    public MissingHistoryException(String message) {
        super(message);
    }
}

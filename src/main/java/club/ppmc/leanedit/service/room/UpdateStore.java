/**
 * UpdateStore.java
 *
 * Durable, append-only update history of one room.
 */
package club.ppmc.leanedit.service.room;

import java.io.IOException;

public interface UpdateStore {

    /**
     * Applies every persisted update to the document, oldest first.
     *
     * @throws MissingHistoryException if nothing has been persisted for the room yet.
     * @throws IOException if the history exists but cannot be read completely.
     */
    void replay(ReplicatedDocument document) throws IOException;

    void append(byte[] update) throws IOException;
}

/**
 * ReplicatedDocument.java
 *
 * The shared document state of a room, treated as an opaque capability: updates
 * go in, a snapshot that reproduces the whole state comes out. How concurrent
 * edits merge is the business of the CRDT library on the clients.
 */
package club.ppmc.leanedit.service.room;

import java.util.List;

public interface ReplicatedDocument {

    /**
     * Applies an update received from a client or replayed from the log.
     *
     * @return false if the update was already part of the state and changed nothing.
     */
    boolean applyUpdate(byte[] update);

    /** Updates that, applied in order, reproduce the current state. */
    List<byte[]> snapshot();

    int updateCount();
}

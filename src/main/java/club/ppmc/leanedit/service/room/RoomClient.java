/**
 * RoomClient.java
 *
 * A connection joined to a DocumentRoom. Implementations must allow sends from
 * several threads.
 */
package club.ppmc.leanedit.service.room;

import java.io.IOException;

public interface RoomClient {

    String id();

    void send(byte[] frame) throws IOException;

    boolean isOpen();
}

/**
 * UpdateLogDocument.java
 *
 * ReplicatedDocument that keeps the ordered list of updates it has seen.
 * Yjs updates are commutative and idempotent, so replaying the list on a client
 * yields the merged document without the server understanding the updates.
 * A byte-identical update is kept once, so the same client edits echoed back by
 * several peers during their initial sync do not grow the log.
 */
package club.ppmc.leanedit.service.room;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class UpdateLogDocument implements ReplicatedDocument {

    private final List<byte[]> updates = new ArrayList<>();
    private final Set<ByteBuffer> seen = new HashSet<>();

    @Override
    public synchronized boolean applyUpdate(byte[] update) {
        Objects.requireNonNull(update, "update");
        byte[] copy = update.clone();
        if (!seen.add(ByteBuffer.wrap(copy))) {
            return false;
        }
        updates.add(copy);
        return true;
    }

    @Override
    public synchronized List<byte[]> snapshot() {
        return List.copyOf(updates);
    }

    @Override
    public synchronized int updateCount() {
        return updates.size();
    }
}

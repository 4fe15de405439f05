/**
 * AwarenessRegistry.java
 *
 * Latest awareness state (cursor, selection, user name) of every Yjs client in a
 * room, plus which connection announced which client ids, so that a connection
 * that drops can have its clients removed for everyone else.
 */
package club.ppmc.leanedit.service.room;

import club.ppmc.leanedit.util.YjsMessageCodec.AwarenessEntry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

class AwarenessRegistry {

    private final Map<Long, AwarenessEntry> states = new LinkedHashMap<>();
    private final Map<String, Set<Long>> clientIdsByConnection = new HashMap<>();

    synchronized void apply(String connectionId, List<AwarenessEntry> entries) {
        for (AwarenessEntry entry : entries) {
            AwarenessEntry current = states.get(entry.clientId());
            if (current != null && current.clock() > entry.clock()) {
                continue;
            }
            if (entry.isRemoval()) {
                states.remove(entry.clientId());
                Set<Long> owned = clientIdsByConnection.get(connectionId);
                if (owned != null) {
                    owned.remove(entry.clientId());
                }
            } else {
                states.put(entry.clientId(), entry);
                clientIdsByConnection.computeIfAbsent(connectionId, k -> new LinkedHashSet<>()).add(entry.clientId());
            }
        }
    }

    /**
     * Forgets a connection's clients.
     *
     * @return removal entries (state {@code null}, clock advanced) to broadcast.
     */
    synchronized List<AwarenessEntry> removeConnection(String connectionId) {
        Set<Long> owned = clientIdsByConnection.remove(connectionId);
        var removals = new ArrayList<AwarenessEntry>();
        if (owned == null) {
            return removals;
        }
        for (Long clientId : owned) {
            AwarenessEntry last = states.remove(clientId);
            long clock = last == null ? 0 : last.clock() + 1;
            removals.add(new AwarenessEntry(clientId, clock, "null"));
        }
        return removals;
    }

    synchronized List<AwarenessEntry> snapshot() {
        return List.copyOf(states.values());
    }
}

/**
 * RoomRegistry.java
 *
 * Maps room names to their DocumentRoom. The first connection naming a room
 * creates it, bound to the update log derived from the name; every lookup makes
 * sure the room is started and its persisted history replayed exactly once.
 * Rooms stay for the lifetime of the application.
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.service.room.DocumentRoom;
import club.ppmc.leanedit.service.room.UpdateLogDocument;
import club.ppmc.leanedit.service.room.UpdateStoreFactory;
import jakarta.annotation.PreDestroy;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RoomRegistry {

    // Room names become file names under the data directory.
    private static final Pattern ROOM_NAME = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final Map<String, DocumentRoom> rooms = new ConcurrentHashMap<>();
    private final UpdateStoreFactory storeFactory;

    public RoomRegistry(UpdateStoreFactory storeFactory) {
        this.storeFactory = storeFactory;
    }

    /**
     * Returns the room with the given name, creating it on first use.
     * Creation is atomic: concurrent callers for a new name get the same instance.
     * The call returns once the room's history has been replayed (or the replay failed).
     *
     * @param name client-supplied room name.
     * @return the started, ready room.
     * @throws IllegalArgumentException if the name is not a valid room name.
     */
    public DocumentRoom getOrCreateRoom(String name) {
        if (!isValidRoomName(name)) {
            throw new IllegalArgumentException("Invalid room name: " + name);
        }
        DocumentRoom room = rooms.computeIfAbsent(name, this::createRoom);
        room.start();
        room.loadHistoryOnce();
        return room;
    }

    private DocumentRoom createRoom(String name) {
        log.info("Creating room '{}'", name);
        return new DocumentRoom(name, new UpdateLogDocument(), storeFactory.create(name));
    }

    public Optional<DocumentRoom> find(String name) {
        return Optional.ofNullable(rooms.get(name));
    }

    public List<DocumentRoom> rooms() {
        return rooms.values().stream()
                .sorted(Comparator.comparing(DocumentRoom::getName))
                .toList();
    }

    public static boolean isValidRoomName(String name) {
        return name != null && ROOM_NAME.matcher(name).matches() && !".".equals(name) && !"..".equals(name);
    }

    @PreDestroy
    public void shutdown() {
        Collection<DocumentRoom> all = rooms.values();
        log.info("Stopping {} room(s)", all.size());
        all.forEach(DocumentRoom::stop);
    }
}

/**
 * DocumentRoom.java
 *
 * A named collaborative document shared by every connection that addresses it.
 * The room answers the Yjs sync handshake from its ReplicatedDocument, applies and
 * rebroadcasts updates, relays awareness, and hands every update to a background
 * writer that appends it to the room's UpdateStore.
 *
 * History is replayed from the store at most once per room; see {@link #loadHistoryOnce()}.
 */
package club.ppmc.leanedit.service.room;

import club.ppmc.leanedit.exception.RoomLoadException;
import club.ppmc.leanedit.util.YjsMessageCodec;
import club.ppmc.leanedit.util.YjsMessageCodec.AwarenessEntry;
import club.ppmc.leanedit.util.YjsMessageCodec.YjsMessage;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DocumentRoom {

    private final String name;
    private final ReplicatedDocument document;
    private final UpdateStore store;
    private final AwarenessRegistry awareness = new AwarenessRegistry();
    private final Set<RoomClient> clients = new CopyOnWriteArraySet<>();

    private final Object lifecycleLock = new Object();
    private final Object loadLock = new Object();
    private final Object updateLock = new Object();

    private volatile boolean ready;
    private volatile RoomLoadException loadFailure;
    private ExecutorService writer;

    public DocumentRoom(String name, ReplicatedDocument document, UpdateStore store) {
        this.name = name;
        this.document = document;
        this.store = store;
    }

    public String getName() {
        return name;
    }

    public ReplicatedDocument getDocument() {
        return document;
    }

    public boolean isReady() {
        return ready;
    }

    public boolean isStarted() {
        synchronized (lifecycleLock) {
            return writer != null && !writer.isShutdown();
        }
    }

    /** Failure of the history replay, if the replay failed for a reason other than missing history. */
    public Optional<RoomLoadException> loadFailure() {
        return Optional.ofNullable(loadFailure);
    }

    public int clientCount() {
        return clients.size();
    }

    /**
     * Starts the background writer. Calling it again is a no-op.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (writer != null) {
                return;
            }
            writer = Executors.newSingleThreadExecutor(runnable -> {
                var thread = new Thread(runnable, "room-" + name + "-writer");
                thread.setDaemon(true);
                return thread;
            });
            log.debug("Room '{}' started", name);
        }
    }

    /**
     * Stops the background writer after it has persisted every queued update.
     */
    public void stop() {
        ExecutorService current;
        synchronized (lifecycleLock) {
            current = writer;
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Room '{}': pending updates were not persisted before shutdown", name);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Replays persisted history into the document the first time it is called;
     * later and concurrent callers wait for that replay and then return.
     * A missing history is normal for a new room. Any other failure is logged and
     * kept as {@link #loadFailure()}, and the room becomes ready regardless.
     */
    public void loadHistoryOnce() {
        if (ready) {
            return;
        }
        synchronized (loadLock) {
            if (ready) {
                return;
            }
            try {
                store.replay(document);
                log.info("Room '{}': replayed {} persisted update(s)", name, document.updateCount());
            } catch (MissingHistoryException e) {
                log.debug("Room '{}': no persisted history yet", name);
            } catch (IOException | RuntimeException e) {
                loadFailure = new RoomLoadException(name, e);
                log.error("Room '{}' serves {} recovered update(s) after a failed history load",
                        name, document.updateCount(), loadFailure);
            }
            ready = true;
        }
    }

    /**
     * Adds a connection and starts the sync handshake with it.
     */
    public void join(RoomClient client) {
        clients.add(client);
        log.info("Client {} joined room '{}' ({} connected)", client.id(), name, clients.size());
        send(client, YjsMessageCodec.syncStep1(YjsMessageCodec.EMPTY_STATE_VECTOR));
        List<AwarenessEntry> states = awareness.snapshot();
        if (!states.isEmpty()) {
            send(client, YjsMessageCodec.awareness(YjsMessageCodec.encodeAwarenessUpdate(states)));
        }
    }

    /**
     * Removes a connection and tells the others its awareness states are gone.
     */
    public void leave(RoomClient client) {
        if (!clients.remove(client)) {
            return;
        }
        List<AwarenessEntry> removals = awareness.removeConnection(client.id());
        if (!removals.isEmpty()) {
            broadcast(client, YjsMessageCodec.awareness(YjsMessageCodec.encodeAwarenessUpdate(removals)));
        }
        log.info("Client {} left room '{}' ({} connected)", client.id(), name, clients.size());
    }

    /**
     * Handles one binary frame from a joined connection. Undecodable frames are dropped.
     */
    public void handleMessage(RoomClient sender, byte[] frame) {
        YjsMessage message;
        try {
            message = YjsMessageCodec.decode(frame);
        } catch (IllegalArgumentException e) {
            log.warn("Room '{}': dropping malformed frame from {}: {}", name, sender.id(), e.getMessage());
            return;
        }
        switch (message.type()) {
            case YjsMessageCodec.MESSAGE_SYNC -> handleSync(sender, message);
            case YjsMessageCodec.MESSAGE_AWARENESS -> handleAwareness(sender, message.payload(), frame);
            case YjsMessageCodec.MESSAGE_QUERY_AWARENESS -> send(sender,
                    YjsMessageCodec.awareness(YjsMessageCodec.encodeAwarenessUpdate(awareness.snapshot())));
            default -> log.debug("Room '{}': ignoring message type {} from {}", name, message.type(), sender.id());
        }
    }

    private void handleSync(RoomClient sender, YjsMessage message) {
        if (message.syncStep() == YjsMessageCodec.SYNC_STEP1) {
            List<byte[]> updates = document.snapshot();
            for (int i = 0; i < updates.size() - 1; i++) {
                send(sender, YjsMessageCodec.syncUpdate(updates.get(i)));
            }
            byte[] last = updates.isEmpty() ? YjsMessageCodec.EMPTY_UPDATE : updates.get(updates.size() - 1);
            send(sender, YjsMessageCodec.syncStep2(last));
            return;
        }
        byte[] update = message.payload();
        if (Arrays.equals(update, YjsMessageCodec.EMPTY_UPDATE)) {
            return;
        }
        synchronized (updateLock) {
            if (!document.applyUpdate(update)) {
                log.debug("Room '{}': update from {} is already known", name, sender.id());
                return;
            }
            persist(update);
        }
        broadcast(sender, YjsMessageCodec.syncUpdate(update));
    }

    private void handleAwareness(RoomClient sender, byte[] payload, byte[] frame) {
        try {
            awareness.apply(sender.id(), YjsMessageCodec.decodeAwarenessUpdate(payload));
        } catch (IllegalArgumentException e) {
            log.warn("Room '{}': dropping malformed awareness update from {}: {}", name, sender.id(), e.getMessage());
            return;
        }
        broadcast(sender, frame);
    }

    private void persist(byte[] update) {
        ExecutorService current;
        synchronized (lifecycleLock) {
            current = writer;
        }
        if (current == null || current.isShutdown()) {
            appendToStore(update);
            return;
        }
        try {
            current.execute(() -> appendToStore(update));
        } catch (RejectedExecutionException e) {
            appendToStore(update);
        }
    }

    private void appendToStore(byte[] update) {
        try {
            store.append(update);
        } catch (IOException e) {
            log.error("Room '{}': failed to persist an update of {} bytes", name, update.length, e);
        }
    }

    private void broadcast(RoomClient sender, byte[] frame) {
        for (RoomClient client : clients) {
            if (client != sender) {
                send(client, frame);
            }
        }
    }

    private void send(RoomClient client, byte[] frame) {
        if (!client.isOpen()) {
            return;
        }
        try {
            client.send(frame);
        } catch (IOException e) {
            log.warn("Room '{}': failed to send to {}: {}", name, client.id(), e.getMessage());
        }
    }
}

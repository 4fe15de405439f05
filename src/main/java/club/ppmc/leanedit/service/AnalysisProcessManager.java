/**
 * AnalysisProcessManager.java
 *
 * Owns the language server processes ({@code lake serve} by default), one per
 * session id. Spawning reuses a live process, replaces a dead one and never starts
 * two processes for the same id. Killing is graceful first and forceful after the
 * configured grace period. All processes are killed when the application stops.
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.exception.SpawnException;
import club.ppmc.leanedit.model.AnalysisProcess;
import jakarta.annotation.PreDestroy;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class AnalysisProcessManager {

    private final SettingsService settingsService;
    private final Map<String, AnalysisProcess> processes = new ConcurrentHashMap<>();

    public AnalysisProcessManager(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * Returns the live process of a session, starting one if there is none.
     * Calls for the same id are serialized by the map's per-key compute.
     *
     * @param sessionId client-supplied session id.
     * @return the session's process.
     * @throws SpawnException if the process cannot be started.
     */
    public AnalysisProcess spawn(String sessionId) {
        var failure = new AtomicReference<SpawnException>();
        AnalysisProcess result = processes.compute(sessionId, (id, existing) -> {
            if (existing != null) {
                if (existing.isAlive()) {
                    return existing;
                }
                log.info("Analysis process for session {} (pid={}) has exited with code {}; replacing it.",
                        id, existing.pid(), existing.process().exitValue());
                closeStreams(existing);
            }
            try {
                return start(id);
            } catch (IOException e) {
                failure.set(new SpawnException(id, e));
                return null;
            }
        });
        if (result == null) {
            log.error("Failed to spawn analysis process for session {}", sessionId, failure.get());
            throw failure.get();
        }
        return result;
    }

    private AnalysisProcess start(String sessionId) throws IOException {
        List<String> command = settingsService.getAnalysisCommand();
        Process process = new ProcessBuilder(command)
                .directory(settingsService.getProjectDir().toFile())
                .start();
        log.info("Spawned '{}' for session {} (pid={})", String.join(" ", command), sessionId, process.pid());
        return new AnalysisProcess(sessionId, process, Instant.now());
    }

    /**
     * Terminates a session's process and forgets it. Unknown ids and dead processes
     * are a no-op apart from removing the entry.
     *
     * @param sessionId session to kill.
     */
    public void kill(String sessionId) {
        AnalysisProcess entry = processes.remove(sessionId);
        if (entry == null) {
            return;
        }
        terminate(entry);
        closeStreams(entry);
    }

    /**
     * Kills every tracked process. Used at application shutdown.
     */
    @PreDestroy
    public void killAll() {
        var sessionIds = new ArrayList<>(processes.keySet());
        if (!sessionIds.isEmpty()) {
            log.info("Shutting down {} analysis process(es).", sessionIds.size());
        }
        sessionIds.forEach(this::kill);
    }

    public Optional<AnalysisProcess> find(String sessionId) {
        return Optional.ofNullable(processes.get(sessionId));
    }

    public List<AnalysisProcess> activeProcesses() {
        return processes.values().stream()
                .sorted(Comparator.comparing(AnalysisProcess::startedAt))
                .toList();
    }

    private void terminate(AnalysisProcess entry) {
        Process process = entry.process();
        if (!process.isAlive()) {
            return;
        }
        // lake serve starts worker processes of its own; take them down with it.
        List<ProcessHandle> descendants = process.descendants().toList();
        Duration grace = settingsService.getShutdownGrace();

        descendants.forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Analysis process for session {} (pid={}) did not exit within {} ms; force-killing.",
                        entry.sessionId(), entry.pid(), grace.toMillis());
                forceKill(process, descendants);
            }
        } catch (InterruptedException e) {
            forceKill(process, descendants);
            Thread.currentThread().interrupt();
        }
        log.info("Killed analysis process for session {} (pid={})", entry.sessionId(), entry.pid());
    }

    private static void forceKill(Process process, List<ProcessHandle> descendants) {
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void closeStreams(AnalysisProcess entry) {
        closeQuietly(entry.sessionId(), entry.stdin());
        closeQuietly(entry.sessionId(), entry.stdout());
        closeQuietly(entry.sessionId(), entry.stderr());
    }

    private static void closeQuietly(String sessionId, Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Error closing a stream of session {}: {}", sessionId, e.getMessage());
        }
    }
}

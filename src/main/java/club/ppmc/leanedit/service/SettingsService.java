/**
 * SettingsService.java
 *
 * Configuration hub of the server. Every other component asks this service for
 * paths, the analysis command line and timeouts instead of injecting @Value itself.
 * Paths are resolved to absolute form once, the required directories are created
 * at startup and the document URIs exposed by the metadata endpoint are computed
 * here and never change afterwards.
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.model.DocumentUris;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String ROOM_LOG_SUFFIX = ".ystore";

    private final Path projectDir;
    private final Path documentPath;
    private final List<String> analysisCommand;
    private final Duration shutdownGrace;
    private final Duration cancelTimeout;
    private final Path dataDir;
    private final int maxMessageBytes;
    private final int sendTimeLimitMillis;
    private final DocumentUris documentUris;

    public SettingsService(
            @Value("${app.lean.project-dir:./lean-project}") String projectDir,
            @Value("${app.lean.document-file:src/Scratch.lean}") String documentFile,
            @Value("${app.lean.command:lake,serve}") String[] analysisCommand,
            @Value("${app.lean.shutdown-grace-seconds:5}") long shutdownGraceSeconds,
            @Value("${app.session.cancel-timeout-millis:2000}") long cancelTimeoutMillis,
            @Value("${app.rooms.data-dir:./data}") String dataDir,
            @Value("${app.websocket.max-message-bytes:8388608}") int maxMessageBytes,
            @Value("${app.websocket.send-time-limit-millis:10000}") int sendTimeLimitMillis) {

        if (analysisCommand == null || analysisCommand.length == 0) {
            throw new IllegalArgumentException("app.lean.command must name an executable");
        }
        this.projectDir = Paths.get(projectDir).toAbsolutePath().normalize();
        this.documentPath = this.projectDir.resolve(documentFile).normalize();
        this.analysisCommand = List.of(analysisCommand);
        this.shutdownGrace = Duration.ofSeconds(shutdownGraceSeconds);
        this.cancelTimeout = Duration.ofMillis(cancelTimeoutMillis);
        this.dataDir = Paths.get(dataDir).toAbsolutePath().normalize();
        this.maxMessageBytes = maxMessageBytes;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.documentUris = new DocumentUris(toFileUri(documentPath), toFileUri(this.projectDir));
    }

    @PostConstruct
    public void init() {
        createDirectory(dataDir);
        createDirectory(documentPath.getParent());
        if (!Files.isDirectory(projectDir)) {
            LOGGER.warn("Lean project directory {} does not exist; analysis processes will fail to start.", projectDir);
        }
        LOGGER.info("Lean project dir: {}", projectDir);
        LOGGER.info("Mirrored document: {}", documentPath);
        LOGGER.info("Room update logs: {}", dataDir);
        LOGGER.info("Analysis command: {}", String.join(" ", analysisCommand));
    }

    private void createDirectory(Path dir) {
        if (Files.isDirectory(dir)) {
            return;
        }
        try {
            Files.createDirectories(dir);
            LOGGER.info("Created directory {}", dir);
        } catch (IOException e) {
            LOGGER.error("Could not create directory {}", dir, e);
        }
    }

    public Path getProjectDir() {
        return projectDir;
    }

    public Path getDocumentPath() {
        return documentPath;
    }

    public List<String> getAnalysisCommand() {
        return analysisCommand;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public Duration getCancelTimeout() {
        return cancelTimeout;
    }

    public Path getDataDir() {
        return dataDir;
    }

    /** Container buffer limit for one WebSocket message, text or binary. */
    public int getMaxMessageBytes() {
        return maxMessageBytes;
    }

    public int getSendTimeLimitMillis() {
        return sendTimeLimitMillis;
    }

    public DocumentUris getDocumentUris() {
        return documentUris;
    }

    /**
     * Location of the append-only update log of a room.
     *
     * @param roomName an already validated room name.
     * @return {@code <data-dir>/<roomName>.ystore}
     */
    public Path resolveRoomLog(String roomName) {
        return dataDir.resolve(roomName + ROOM_LOG_SUFFIX);
    }

    /**
     * Builds {@code file:///absolute/path} with percent-encoding where needed.
     * {@link Path#toUri()} is avoided because it appends a slash to existing directories.
     */
    static String toFileUri(Path absolutePath) {
        String path = absolutePath.toString().replace('\\', '/');
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        try {
            return new URI("file", "", path, null, null).toString();
        } catch (URISyntaxException e) {
            return absolutePath.toUri().toString();
        }
    }
}

package club.ppmc.leanedit.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.leanedit.model.AnalysisProcess;
import club.ppmc.leanedit.model.BridgeState;
import club.ppmc.leanedit.util.LspMessageFramer;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.socket.CloseStatus;

class SessionBridgeTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    private ExecutorService executor;
    private AnalysisProcessManager manager;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.killAll();
        }
        executor.shutdownNow();
    }

    /** `cat` echoes every framed message back, which stands in for a language server. */
    private SessionBridge echoBridge(String sessionId, FakeConnection connection) {
        return bridge(TestSettings.withCommand(tempDir, "cat"), sessionId, connection);
    }

    private SessionBridge bridge(SettingsService settings, String sessionId, FakeConnection connection) {
        manager = new AnalysisProcessManager(settings);
        return new SessionBridge(
                sessionId,
                connection,
                manager,
                new ProtocolMessageValidator(),
                new DocumentMirrorService(settings),
                new LspMessageFramer(gson),
                executor,
                settings.getCancelTimeout());
    }

    private String documentUri() {
        return SettingsService.toFileUri(tempDir.resolve(TestSettings.DOCUMENT_FILE));
    }

    @Test
    void fullDocumentChangeIsMirroredAndForwarded() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = echoBridge("alpha", connection);
        executor.execute(bridge);

        String change = "{\"jsonrpc\":\"2.0\",\"method\":\"textDocument/didChange\",\"params\":{"
                + "\"textDocument\":{\"uri\":\"" + documentUri() + "\",\"version\":2},"
                + "\"contentChanges\":[{\"text\":\"theorem t : True := trivial\"}]}}";
        connection.deliver(change);

        String echoed = connection.sent.poll(WAIT.toSeconds(), TimeUnit.SECONDS);
        assertThat(echoed).isNotNull();
        assertThat(JsonParser.parseString(echoed)).isEqualTo(JsonParser.parseString(change));
        assertThat(Files.readString(tempDir.resolve(TestSettings.DOCUMENT_FILE), StandardCharsets.UTF_8))
                .isEqualTo("theorem t : True := trivial");

        connection.complete();
        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(bridge.getState()).isEqualTo(BridgeState.CLOSED);
        assertThat(connection.closedWith.getCode()).isEqualTo(CloseStatus.NORMAL.getCode());
    }

    @Test
    void rangedChangeIsForwardedButNotMirrored() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = echoBridge("alpha", connection);
        executor.execute(bridge);

        connection.deliver("{\"jsonrpc\":\"2.0\",\"method\":\"textDocument/didChange\",\"params\":{"
                + "\"textDocument\":{\"uri\":\"" + documentUri() + "\",\"version\":3},"
                + "\"contentChanges\":[{\"range\":{\"start\":{\"line\":0,\"character\":0},"
                + "\"end\":{\"line\":0,\"character\":0}},\"text\":\"x\"}]}}");

        assertThat(connection.sent.poll(WAIT.toSeconds(), TimeUnit.SECONDS)).isNotNull();
        assertThat(tempDir.resolve(TestSettings.DOCUMENT_FILE)).doesNotExist();

        connection.complete();
        assertThat(bridge.awaitClosed(WAIT)).isTrue();
    }

    @Test
    void invalidDocumentUriClosesWithPolicyViolationAndKillsProcess() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = echoBridge("beta", connection);
        executor.execute(bridge);
        AnalysisProcess process = awaitProcess("beta");

        connection.deliver("{\"jsonrpc\":\"2.0\",\"method\":\"textDocument/didOpen\",\"params\":{"
                + "\"textDocument\":{\"uri\":\"not-a-uri\",\"languageId\":\"lean4\",\"version\":1,\"text\":\"x\"}}}");

        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(connection.closedWith.getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
        assertThat(connection.closedWith.getReason()).isEqualTo(ProtocolMessageValidator.INVALID_DOCUMENT_URI);
        assertThat(process.process().waitFor(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.find("beta")).isEmpty();
        assertThat(connection.sent).isEmpty();
        assertThat(tempDir.resolve(TestSettings.DOCUMENT_FILE)).doesNotExist();
    }

    @Test
    void malformedJsonClosesWithPolicyViolation() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = echoBridge("gamma", connection);
        executor.execute(bridge);

        connection.deliver("{not json");

        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(connection.closedWith.getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
        assertThat(connection.closedWith.getReason()).isEqualTo("malformed-message");
    }

    @Test
    void disconnectKillsProcessAndNextSessionGetsAFreshOne() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = echoBridge("delta", connection);
        executor.execute(bridge);
        AnalysisProcess first = awaitProcess("delta");

        connection.complete();

        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(first.process().waitFor(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.find("delta")).isEmpty();

        AnalysisProcess second = manager.spawn("delta");
        assertThat(second.pid()).isNotEqualTo(first.pid());
    }

    @Test
    void disconnectDoesNotWaitForLoopsBlockedOnProcessOutput() throws Exception {
        var connection = new FakeConnection();
        // sleep never writes or closes its output, so only killing it unblocks the readers
        SessionBridge bridge = bridge(
                TestSettings.withCancelTimeout(tempDir, 8_000, "sleep", "60"), "eta", connection);
        executor.execute(bridge);
        AnalysisProcess process = awaitProcess("eta");

        long started = System.nanoTime();
        connection.complete();

        assertThat(bridge.awaitClosed(Duration.ofSeconds(5))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        assertThat(process.process().isAlive()).isFalse();
        assertThat(connection.closedWith.getCode()).isEqualTo(CloseStatus.NORMAL.getCode());
    }

    @Test
    void messageWithoutMethodOrIdIsRejected() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = echoBridge("theta", connection);
        executor.execute(bridge);

        connection.deliver("{\"jsonrpc\":\"2.0\",\"params\":{}}");

        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(connection.closedWith.getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
        assertThat(connection.closedWith.getReason()).isEqualTo("malformed-message");
        assertThat(connection.sent).isEmpty();
    }

    @Test
    void processExitClosesTheSession() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = bridge(TestSettings.withCommand(tempDir, "true"), "epsilon", connection);
        executor.execute(bridge);

        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(bridge.getState()).isEqualTo(BridgeState.CLOSED);
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void spawnFailureClosesWithServerError() throws Exception {
        var connection = new FakeConnection();
        SessionBridge bridge = bridge(
                TestSettings.withCommand(tempDir, "definitely-not-an-installed-program-4711"), "zeta", connection);
        executor.execute(bridge);

        assertThat(bridge.awaitClosed(WAIT)).isTrue();
        assertThat(connection.closedWith.getCode()).isEqualTo(CloseStatus.SERVER_ERROR.getCode());
        assertThat(connection.closedWith.getReason()).startsWith("spawn-failed");
        assertThat(connection.closedWith.getReason().getBytes(StandardCharsets.UTF_8).length)
                .isLessThanOrEqualTo(SessionBridge.MAX_CLOSE_REASON_BYTES);
    }

    @Test
    void closeReasonsAreCutOnCodePointBoundaries() {
        String reason = "é".repeat(100);

        String truncated = SessionBridge.truncateReason(reason);

        assertThat(truncated).isEqualTo("é".repeat(61));
        assertThat(SessionBridge.truncateReason(null)).isEmpty();
    }

    private AnalysisProcess awaitProcess(String sessionId) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            Optional<AnalysisProcess> process = manager.find(sessionId);
            if (process.isPresent()) {
                return process.get();
            }
            Thread.sleep(20);
        }
        throw new AssertionError("No process was spawned for " + sessionId);
    }

    private static final class FakeConnection implements ClientConnection {

        private final BlockingQueue<Optional<String>> inbox = new LinkedBlockingQueue<>();
        final BlockingQueue<String> sent = new LinkedBlockingQueue<>();
        volatile boolean open = true;
        volatile CloseStatus closedWith;

        void deliver(String text) {
            inbox.add(Optional.of(text));
        }

        void complete() {
            inbox.add(Optional.empty());
        }

        @Override
        public String id() {
            return "fake";
        }

        @Override
        public String receive() throws InterruptedException {
            Optional<String> next = inbox.take();
            if (next.isEmpty()) {
                inbox.add(next);
                return null;
            }
            return next.get();
        }

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close(CloseStatus status) {
            closedWith = status;
            open = false;
        }
    }
}

/**
 * SessionBridge.java
 *
 * Connects one session client to its language server process and runs until
 * either side goes away. Three loops run concurrently while the bridge is active:
 *
 * <ol>
 *   <li>inbound: client frames are validated, document text is mirrored to disk,
 *       and the message is framed onto the process's stdin;</li>
 *   <li>outbound: framed messages from the process's stdout go to the client;</li>
 *   <li>diagnostic: the process's stderr is copied to the log.</li>
 * </ol>
 *
 * The first loop to finish, for whatever reason, tears the whole session down:
 * the other loops are cancelled, the process is killed and the connection closed.
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.exception.MirrorWriteException;
import club.ppmc.leanedit.exception.ProtocolValidationException;
import club.ppmc.leanedit.exception.SpawnException;
import club.ppmc.leanedit.model.AnalysisProcess;
import club.ppmc.leanedit.model.BridgeState;
import club.ppmc.leanedit.model.ProtocolMessage;
import club.ppmc.leanedit.util.LspMessageFramer;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.lsp4j.jsonrpc.messages.Message;
import org.springframework.web.socket.CloseStatus;

@Slf4j
public class SessionBridge implements Runnable {

    /** WebSocket close reasons are limited to 123 bytes of UTF-8. */
    static final int MAX_CLOSE_REASON_BYTES = 123;

    private final String sessionId;
    private final ClientConnection connection;
    private final AnalysisProcessManager processManager;
    private final ProtocolMessageValidator validator;
    private final DocumentMirrorService mirrorService;
    private final LspMessageFramer framer;
    private final ExecutorService executor;
    private final Duration cancelTimeout;

    private final AtomicReference<BridgeState> state = new AtomicReference<>(BridgeState.CONNECTING);
    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile CloseStatus closeStatus = CloseStatus.NORMAL;

    public SessionBridge(
            String sessionId,
            ClientConnection connection,
            AnalysisProcessManager processManager,
            ProtocolMessageValidator validator,
            DocumentMirrorService mirrorService,
            LspMessageFramer framer,
            ExecutorService executor,
            Duration cancelTimeout) {
        this.sessionId = sessionId;
        this.connection = connection;
        this.processManager = processManager;
        this.validator = validator;
        this.mirrorService = mirrorService;
        this.framer = framer;
        this.executor = executor;
        this.cancelTimeout = cancelTimeout;
    }

    public String getSessionId() {
        return sessionId;
    }

    public BridgeState getState() {
        return state.get();
    }

    /** Status the connection was (or will be) closed with. */
    public CloseStatus getCloseStatus() {
        return closeStatus;
    }

    /**
     * Blocks until the bridge has reached {@link BridgeState#CLOSED}.
     *
     * @return {@code false} if the timeout elapsed first.
     */
    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void run() {
        AnalysisProcess process;
        try {
            process = processManager.spawn(sessionId);
        } catch (SpawnException e) {
            closeStatus = CloseStatus.SERVER_ERROR.withReason(truncateReason("spawn-failed: " + e.getCause().getMessage()));
            closeConnection();
            state.set(BridgeState.CLOSED);
            closed.countDown();
            return;
        }

        state.set(BridgeState.ACTIVE);
        log.info("Session {} active on connection {} (pid={})", sessionId, connection.id(), process.pid());

        var finished = new CountDownLatch(3);
        var completion = new ExecutorCompletionService<LoopExit>(executor);
        List<Future<LoopExit>> loops = List.of(
                completion.submit(loop("inbound", () -> forwardInbound(process), finished)),
                completion.submit(loop("outbound", () -> forwardOutbound(process), finished)),
                completion.submit(loop("diagnostic", () -> logDiagnostics(process), finished)));

        LoopExit trigger = null;
        try {
            trigger = completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Session {}: could not determine which loop ended first", sessionId, e);
        }
        teardown(trigger, loops, finished);
    }

    private void teardown(LoopExit trigger, List<Future<LoopExit>> loops, CountDownLatch finished) {
        if (!state.compareAndSet(BridgeState.ACTIVE, BridgeState.CLOSING)) {
            return;
        }
        if (trigger == null) {
            log.info("Session {}: bridge interrupted, tearing down", sessionId);
        } else if (trigger.error() == null) {
            log.info("Session {}: {} loop finished, tearing down", sessionId, trigger.loop());
        } else {
            log.warn("Session {}: {} loop failed, tearing down: {}", sessionId, trigger.loop(), trigger.error().toString());
        }

        loops.forEach(future -> future.cancel(true));
        // Loops blocked on process pipes only return once the process is gone.
        processManager.kill(sessionId);
        if (!awaitLoops(finished)) {
            log.warn("Session {}: {} forwarding loop(s) still running after kill", sessionId, finished.getCount());
        }

        closeConnection();
        state.set(BridgeState.CLOSED);
        closed.countDown();
        log.info("Session {} closed ({})", sessionId, closeStatus);
    }

    private boolean awaitLoops(CountDownLatch finished) {
        try {
            return finished.await(cancelTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finished.getCount() == 0;
        }
    }

    private void forwardInbound(AnalysisProcess process) throws IOException, InterruptedException {
        OutputStream stdin = process.stdin();
        String frame;
        while ((frame = connection.receive()) != null) {
            ProtocolMessage message;
            Message outgoing;
            try {
                message = ProtocolMessage.parse(frame);
                validator.validate(message);
                outgoing = framer.toMessage(message.json());
            } catch (ProtocolValidationException e) {
                log.warn("Session {}: rejected client message, closing session: {}", sessionId, e.getMessage());
                closeStatus = CloseStatus.POLICY_VIOLATION.withReason(truncateReason(e.getReason()));
                return;
            }
            message.documentText().ifPresent(this::mirror);
            framer.write(stdin, outgoing);
            log.debug("Session {}: -> {}", sessionId, message);
        }
        log.info("Session {}: client disconnected", sessionId);
    }

    private void mirror(String text) {
        try {
            mirrorService.write(text);
        } catch (MirrorWriteException e) {
            log.error("Session {}: {}", sessionId, e.getMessage(), e);
        }
    }

    private void forwardOutbound(AnalysisProcess process) throws IOException {
        framer.read(process.stdout(), message -> {
            if (!connection.isOpen()) {
                throw new IOException("client connection closed, dropping server message");
            }
            connection.send(framer.toJson(message));
        });
        log.info("Session {}: analysis process closed its output", sessionId);
    }

    private void logDiagnostics(AnalysisProcess process) throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(process.stderr(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[lake-{}] {}", sessionId, line);
            }
        }
    }

    private void closeConnection() {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close(closeStatus);
        } catch (IOException e) {
            log.debug("Session {}: error closing connection: {}", sessionId, e.getMessage());
        }
    }

    private static Callable<LoopExit> loop(String name, ForwardingLoop body, CountDownLatch finished) {
        return () -> {
            try {
                body.run();
                return new LoopExit(name, null);
            } catch (Exception e) {
                return new LoopExit(name, e);
            } finally {
                finished.countDown();
            }
        };
    }

    static String truncateReason(String reason) {
        if (reason == null) {
            return "";
        }
        var builder = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < reason.length(); ) {
            int codePoint = reason.codePointAt(i);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > MAX_CLOSE_REASON_BYTES) {
                break;
            }
            builder.appendCodePoint(codePoint);
            bytes += size;
            i += Character.charCount(codePoint);
        }
        return builder.toString();
    }

    @FunctionalInterface
    private interface ForwardingLoop {
        void run() throws Exception;
    }

    private record LoopExit(String loop, Exception error) {}
}

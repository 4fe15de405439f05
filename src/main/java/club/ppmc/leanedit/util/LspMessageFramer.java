/**
 * LspMessageFramer.java
 *
 * Reads and writes JSON-RPC messages with the base-protocol framing used on a
 * language server's standard streams:
 *
 * <pre>
 * Content-Length: 52\r\n
 * \r\n
 * {"jsonrpc":"2.0","method":"initialized","params":{}}
 * </pre>
 *
 * The stream work is done by LSP4J's {@link StreamMessageProducer} and
 * {@link StreamMessageConsumer}. No request methods are registered with the JSON
 * handler, so params and results stay untyped {@code JsonElement}s and pass
 * through unchanged. The reader is stricter than LSP4J's default: instead of
 * logging a broken message and carrying on, it stops at the first one and
 * reports it as a {@link FramingException}.
 *
 * Framing is only used on the process side; browser clients exchange one JSON
 * message per WebSocket text frame.
 */
package club.ppmc.leanedit.util;

import club.ppmc.leanedit.exception.FramingException;
import club.ppmc.leanedit.exception.ProtocolValidationException;
import club.ppmc.leanedit.model.ProtocolMessage;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;
import org.eclipse.lsp4j.jsonrpc.JsonRpcException;
import org.eclipse.lsp4j.jsonrpc.MessageIssueException;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.eclipse.lsp4j.jsonrpc.json.StreamMessageConsumer;
import org.eclipse.lsp4j.jsonrpc.json.StreamMessageProducer;
import org.eclipse.lsp4j.jsonrpc.messages.Message;
import org.springframework.stereotype.Component;

@Component
public class LspMessageFramer {

    public static final String CONTENT_LENGTH_HEADER = "Content-Length";

    static final int MAX_HEADER_LINE_BYTES = 8192;

    private final Gson gson;
    private final MessageJsonHandler jsonHandler;

    public LspMessageFramer(Gson gson) {
        this.gson = gson;
        // null members such as "result": null or "processId": null are significant
        this.jsonHandler = new MessageJsonHandler(
                Collections.emptyMap(), builder -> builder.serializeNulls().disableHtmlEscaping());
    }

    /**
     * Converts a client message into a JSON-RPC message.
     *
     * @throws ProtocolValidationException if the object is neither a request, a notification nor a response.
     */
    public Message toMessage(JsonObject json) throws ProtocolValidationException {
        try {
            return jsonHandler.parseMessage(gson.toJson(json));
        } catch (MessageIssueException | JsonParseException e) {
            throw new ProtocolValidationException(ProtocolMessage.MALFORMED_MESSAGE, e.getMessage());
        }
    }

    /** Serializes a message as the JSON text of one WebSocket frame. */
    public String toJson(Message message) {
        return jsonHandler.serialize(message);
    }

    /**
     * Serializes a message and prefixes it with its Content-Length header.
     *
     * @return header, blank line and UTF-8 body.
     */
    public byte[] encode(Message message) {
        var out = new ByteArrayOutputStream();
        new StreamMessageConsumer(out, jsonHandler).consume(message);
        return out.toByteArray();
    }

    /**
     * Writes one framed message and flushes the stream.
     */
    public void write(OutputStream out, Message message) throws IOException {
        try {
            new StreamMessageConsumer(out, jsonHandler).consume(message);
        } catch (JsonRpcException e) {
            throw unwrap(e);
        }
    }

    /**
     * Reads framed messages and hands each to the sink until the stream ends.
     * Returns normally only when the stream ends between two messages.
     *
     * @throws FramingException at the first malformed or truncated message.
     * @throws IOException if reading the stream fails or the sink fails.
     */
    public void read(InputStream in, MessageSink sink) throws IOException {
        var tracked = new TrackingInputStream(new BufferedInputStream(in));
        try {
            new StrictMessageReader(tracked).listen(message -> {
                try {
                    sink.accept(message);
                } catch (IOException e) {
                    throw new StopReading(e);
                }
            });
        } catch (StopReading e) {
            throw e.failure;
        } catch (JsonRpcException e) {
            throw unwrap(e);
        }
        if (tracked.pending > 0) {
            throw new FramingException("Stream ended inside a message after " + tracked.pending + " bytes");
        }
    }

    private static IOException unwrap(JsonRpcException e) {
        if (e.getCause() instanceof IOException) {
            return (IOException) e.getCause();
        }
        return new IOException(e.getMessage(), e);
    }

    /** Receives decoded messages in stream order. */
    @FunctionalInterface
    public interface MessageSink {
        void accept(Message message) throws IOException;
    }

    /**
     * Stops at the first problem instead of skipping the broken message, and
     * matches the Content-Length header name case-insensitively.
     */
    private final class StrictMessageReader extends StreamMessageProducer {

        private final TrackingInputStream tracked;

        StrictMessageReader(TrackingInputStream input) {
            super(input, LspMessageFramer.this.jsonHandler);
            this.tracked = input;
        }

        @Override
        protected void parseHeader(String line, Headers headers) {
            int colon = line.indexOf(':');
            if (colon > 0 && CONTENT_LENGTH_HEADER.equalsIgnoreCase(line.substring(0, colon).trim())) {
                String value = line.substring(colon + 1).trim();
                try {
                    headers.contentLength = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new StopReading(new FramingException("Invalid " + CONTENT_LENGTH_HEADER + ": " + value, e));
                }
                if (headers.contentLength < 0) {
                    throw new StopReading(new FramingException("Negative " + CONTENT_LENGTH_HEADER + ": " + value));
                }
                return;
            }
            super.parseHeader(line, headers);
        }

        @Override
        protected boolean handleMessage(InputStream input, Headers headers) throws IOException {
            tracked.inBody = true;
            try {
                if (!super.handleMessage(input, headers)) {
                    throw new StopReading(new FramingException(
                            "Truncated message body: expected " + headers.contentLength + " bytes"));
                }
            } finally {
                tracked.inBody = false;
            }
            tracked.messageComplete();
            return true;
        }

        @Override
        protected void fireError(Throwable error) {
            if (error instanceof StopReading) {
                throw (StopReading) error;
            }
            String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            throw new StopReading(new FramingException("Malformed message: " + detail, error));
        }
    }

    /** Counts bytes of the message being read and bounds header lines. */
    private static final class TrackingInputStream extends FilterInputStream {

        private long pending;
        private int lineLength;
        private boolean inBody;

        TrackingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b == -1) {
                return b;
            }
            pending++;
            if (!inBody) {
                if (b == '\n') {
                    lineLength = 0;
                } else if (++lineLength > MAX_HEADER_LINE_BYTES) {
                    throw new FramingException("Header line exceeds " + MAX_HEADER_LINE_BYTES + " bytes");
                }
            }
            return b;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            int count = super.read(buffer, offset, length);
            if (count > 0) {
                pending += count;
            }
            return count;
        }

        void messageComplete() {
            pending = 0;
            lineLength = 0;
        }
    }

    /** Carries a checked failure out of the producer's callbacks. */
    private static final class StopReading extends RuntimeException {

        private final IOException failure;

        StopReading(IOException failure) {
            super(failure.getMessage(), failure, false, false);
            this.failure = failure;
        }
    }
}

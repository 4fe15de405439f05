/**
 * YjsMessageCodec.java
 *
 * Encoder and decoder for the y-websocket sub-protocol spoken on room connections.
 * Every frame starts with a variable-length unsigned message type:
 *
 * <pre>
 * sync            = 0, varuint step (0 = step 1, 1 = step 2, 2 = update), varbytes payload
 * awareness       = 1, varbytes awareness-update
 * query-awareness = 3
 * </pre>
 *
 * Variable-length integers use 7 bits per byte, least significant group first,
 * with the high bit set on every byte but the last. Update payloads are opaque;
 * only awareness updates are looked into, to track which client ids a connection owns.
 */
package club.ppmc.leanedit.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class YjsMessageCodec {

    public static final int MESSAGE_SYNC = 0;
    public static final int MESSAGE_AWARENESS = 1;
    public static final int MESSAGE_AUTH = 2;
    public static final int MESSAGE_QUERY_AWARENESS = 3;

    public static final int SYNC_STEP1 = 0;
    public static final int SYNC_STEP2 = 1;
    public static final int SYNC_UPDATE = 2;

    /** A state vector that claims nothing; the peer answers with its whole state. */
    public static final byte[] EMPTY_STATE_VECTOR = {0};

    /** An update with no structs and an empty delete set. */
    public static final byte[] EMPTY_UPDATE = {0, 0};

    private static final int MAX_VAR_UINT_BYTES = 8;

    private YjsMessageCodec() {}

    /**
     * A decoded frame.
     *
     * @param type     message type.
     * @param syncStep sync sub-type, or -1 for non-sync messages.
     * @param payload  varbytes content, empty for query-awareness.
     */
    public record YjsMessage(int type, int syncStep, byte[] payload) {}

    /**
     * One client's entry in an awareness update.
     *
     * @param clientId  Yjs client id.
     * @param clock     monotonically increasing per client.
     * @param stateJson JSON text of the state, {@code "null"} when the client went away.
     */
    public record AwarenessEntry(long clientId, long clock, String stateJson) {

        public boolean isRemoval() {
            return "null".equals(stateJson);
        }
    }

    public static byte[] syncStep1(byte[] stateVector) {
        return sync(SYNC_STEP1, stateVector);
    }

    public static byte[] syncStep2(byte[] update) {
        return sync(SYNC_STEP2, update);
    }

    public static byte[] syncUpdate(byte[] update) {
        return sync(SYNC_UPDATE, update);
    }

    private static byte[] sync(int step, byte[] payload) {
        var out = new ByteArrayOutputStream(payload.length + 8);
        writeVarUint(out, MESSAGE_SYNC);
        writeVarUint(out, step);
        writeVarBytes(out, payload);
        return out.toByteArray();
    }

    public static byte[] awareness(byte[] awarenessUpdate) {
        var out = new ByteArrayOutputStream(awarenessUpdate.length + 4);
        writeVarUint(out, MESSAGE_AWARENESS);
        writeVarBytes(out, awarenessUpdate);
        return out.toByteArray();
    }

    /**
     * Decodes one frame.
     *
     * @throws IllegalArgumentException if the frame is truncated or malformed.
     */
    public static YjsMessage decode(byte[] frame) {
        var reader = new Reader(frame);
        int type = (int) reader.readVarUint();
        return switch (type) {
            case MESSAGE_SYNC -> {
                int step = (int) reader.readVarUint();
                if (step != SYNC_STEP1 && step != SYNC_STEP2 && step != SYNC_UPDATE) {
                    throw new IllegalArgumentException("Unknown sync step " + step);
                }
                yield new YjsMessage(type, step, reader.readVarBytes());
            }
            case MESSAGE_AWARENESS -> new YjsMessage(type, -1, reader.readVarBytes());
            case MESSAGE_QUERY_AWARENESS -> new YjsMessage(type, -1, new byte[0]);
            default -> new YjsMessage(type, -1, reader.remaining());
        };
    }

    public static List<AwarenessEntry> decodeAwarenessUpdate(byte[] update) {
        var reader = new Reader(update);
        long count = reader.readVarUint();
        var entries = new ArrayList<AwarenessEntry>();
        for (long i = 0; i < count; i++) {
            long clientId = reader.readVarUint();
            long clock = reader.readVarUint();
            String state = new String(reader.readVarBytes(), StandardCharsets.UTF_8);
            entries.add(new AwarenessEntry(clientId, clock, state));
        }
        return entries;
    }

    public static byte[] encodeAwarenessUpdate(List<AwarenessEntry> entries) {
        var out = new ByteArrayOutputStream();
        writeVarUint(out, entries.size());
        for (AwarenessEntry entry : entries) {
            writeVarUint(out, entry.clientId());
            writeVarUint(out, entry.clock());
            writeVarBytes(out, entry.stateJson().getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }

    static void writeVarUint(ByteArrayOutputStream out, long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative varuint " + value);
        }
        while (value > 0x7F) {
            out.write((int) (0x80 | (value & 0x7F)));
            value >>>= 7;
        }
        out.write((int) value);
    }

    static void writeVarBytes(ByteArrayOutputStream out, byte[] bytes) {
        writeVarUint(out, bytes.length);
        out.write(bytes, 0, bytes.length);
    }

    private static final class Reader {
        private final byte[] data;
        private int position;

        Reader(byte[] data) {
            this.data = data;
        }

        long readVarUint() {
            long value = 0;
            for (int i = 0; i < MAX_VAR_UINT_BYTES; i++) {
                if (position >= data.length) {
                    throw new IllegalArgumentException("Truncated varuint at offset " + position);
                }
                int b = data[position++] & 0xFF;
                value |= (long) (b & 0x7F) << (7 * i);
                if ((b & 0x80) == 0) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Varuint longer than " + MAX_VAR_UINT_BYTES + " bytes");
        }

        byte[] readVarBytes() {
            long length = readVarUint();
            if (length > data.length - position) {
                throw new IllegalArgumentException(
                        "Declared length " + length + " exceeds the " + (data.length - position) + " remaining bytes");
            }
            byte[] bytes = new byte[(int) length];
            System.arraycopy(data, position, bytes, 0, bytes.length);
            position += bytes.length;
            return bytes;
        }

        byte[] remaining() {
            byte[] rest = new byte[data.length - position];
            System.arraycopy(data, position, rest, 0, rest.length);
            position = data.length;
            return rest;
        }
    }
}

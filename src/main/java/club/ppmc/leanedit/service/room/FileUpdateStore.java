/**
 * FileUpdateStore.java
 *
 * UpdateStore backed by one append-only file per room.
 *
 * <p>Layout:
 * <pre>
 * "LYU1"                       4-byte magic
 * { int32 length, byte[length] update }*   big-endian length prefix per record
 * </pre>
 *
 * A record cut short by a crash is reported when replaying, after every complete
 * record before it has been applied. The damaged tail is cut off at the end of the
 * last complete record so later appends stay readable. A failed append rolls the
 * file back to its previous size for the same reason.
 */
package club.ppmc.leanedit.service.room;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

public class FileUpdateStore implements UpdateStore {

    static final byte[] MAGIC = "LYU1".getBytes(StandardCharsets.US_ASCII);
    static final int MAX_UPDATE_BYTES = 64 * 1024 * 1024;

    private final Path path;

    public FileUpdateStore(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void replay(ReplicatedDocument document) throws IOException {
        if (Files.notExists(path) || Files.size(path) == 0) {
            throw new MissingHistoryException("No update log at " + path);
        }
        IOException damage;
        long validEnd;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] magic = in.readNBytes(MAGIC.length);
            if (magic.length < MAGIC.length && Arrays.equals(magic, Arrays.copyOf(MAGIC, magic.length))) {
                // crashed while writing the header of a new log
                damage = new MissingHistoryException("Update log " + path + " ends inside its header");
                validEnd = 0;
            } else if (!Arrays.equals(magic, MAGIC)) {
                throw new IOException(path + " is not an update log");
            } else {
                RecordDamage recordDamage = readRecords(in, document);
                damage = recordDamage;
                validEnd = recordDamage == null ? 0 : recordDamage.validEnd;
            }
        }
        if (damage != null) {
            cutTail(validEnd);
            throw damage;
        }
    }

    private RecordDamage readRecords(InputStream in, ReplicatedDocument document) throws IOException {
        long offset = MAGIC.length;
        int record = 0;
        while (true) {
            byte[] prefix = in.readNBytes(Integer.BYTES);
            if (prefix.length == 0) {
                return null;
            }
            if (prefix.length < Integer.BYTES) {
                return new RecordDamage("Truncated length prefix of record " + record + " in " + path, offset);
            }
            int length = ByteBuffer.wrap(prefix).getInt();
            if (length < 0 || length > MAX_UPDATE_BYTES) {
                return new RecordDamage("Corrupt length " + length + " of record " + record + " in " + path, offset);
            }
            byte[] update = in.readNBytes(length);
            if (update.length < length) {
                return new RecordDamage("Truncated record " + record + " in " + path, offset);
            }
            document.applyUpdate(update);
            offset += Integer.BYTES + length;
            record++;
        }
    }

    private void cutTail(long validEnd) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.truncate(validEnd);
            channel.force(false);
        }
    }

    @Override
    public synchronized void append(byte[] update) throws IOException {
        try (FileChannel channel = FileChannel.open(
                path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            long previousSize = channel.size();
            try {
                if (previousSize == 0) {
                    writeFully(channel, ByteBuffer.wrap(MAGIC));
                }
                ByteBuffer record = ByteBuffer.allocate(Integer.BYTES + update.length);
                record.putInt(update.length).put(update).flip();
                writeFully(channel, record);
                channel.force(false);
            } catch (IOException e) {
                try {
                    channel.truncate(previousSize);
                } catch (IOException rollback) {
                    e.addSuppressed(rollback);
                }
                throw e;
            }
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /** A damaged record, with the file offset where the intact prefix ends. */
    private static final class RecordDamage extends IOException {

        private final long validEnd;

        RecordDamage(String message, long validEnd) {
            super(message);
            this.validEnd = validEnd;
        }
    }
}

/**
 * MirrorWriteException.java
 *
 * Writing the latest document text to the mirror file failed. Only ever logged;
 * a session keeps running when the mirror cannot be updated.
 */
package club.ppmc.leanedit.exception;

import java.nio.file.Path;
import lombok.Getter;

@Getter
public class MirrorWriteException extends RuntimeException {

    private final Path path;

    public MirrorWriteException(Path path, Throwable cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }
}

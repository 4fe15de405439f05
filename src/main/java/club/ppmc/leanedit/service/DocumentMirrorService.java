/**
 * DocumentMirrorService.java
 *
 * Keeps the mirror file (the Lean source the language server reads from disk) in
 * sync with the latest full document text accepted from any session.
 * Writes overwrite the whole file; the last writer wins and nothing is locked.
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.exception.MirrorWriteException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DocumentMirrorService {

    private final Path documentPath;

    public DocumentMirrorService(SettingsService settingsService) {
        this.documentPath = settingsService.getDocumentPath();
    }

    public Path getDocumentPath() {
        return documentPath;
    }

    /**
     * Replaces the mirror file's content.
     *
     * @param text full document text.
     * @throws MirrorWriteException if the file cannot be written.
     */
    public void write(String text) {
        try {
            Path parent = documentPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(documentPath, text, StandardCharsets.UTF_8);
            log.debug("Mirrored {} characters to {}", text.length(), documentPath);
        } catch (IOException e) {
            throw new MirrorWriteException(documentPath, e);
        }
    }
}

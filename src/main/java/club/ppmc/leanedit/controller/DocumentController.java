/**
 * DocumentController.java
 *
 * Tells the editor which file URI and workspace root to use in its LSP
 * initialize / didOpen messages, so that the language server resolves the
 * mirrored document inside the Lean project.
 */
package club.ppmc.leanedit.controller;

import club.ppmc.leanedit.model.DocumentUris;
import club.ppmc.leanedit.service.SettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DocumentController {

    private final SettingsService settingsService;

    public DocumentController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * @return {@code fileUri} of the mirrored document and {@code rootUri} of the project.
     */
    @GetMapping("/file-uri")
    public ResponseEntity<DocumentUris> getFileUri() {
        return ResponseEntity.ok(settingsService.getDocumentUris());
    }
}

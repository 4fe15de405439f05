package club.ppmc.leanedit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void fileUrisAreAbsoluteAndPercentEncoded() {
        assertThat(SettingsService.toFileUri(Path.of("/work/lean project/src/Scratch.lean")))
                .isEqualTo("file:///work/lean%20project/src/Scratch.lean");
        assertThat(SettingsService.toFileUri(Path.of("/work/lean-project")))
                .isEqualTo("file:///work/lean-project");
    }

    @Test
    void initCreatesDataAndDocumentDirectories() {
        SettingsService settings = TestSettings.withCommand(tempDir, "lake", "serve");

        assertThat(Files.isDirectory(settings.getDataDir())).isTrue();
        assertThat(Files.isDirectory(settings.getDocumentPath().getParent())).isTrue();
        assertThat(settings.getDocumentPath()).isEqualTo(tempDir.resolve("src/Scratch.lean").toAbsolutePath());
        assertThat(settings.getAnalysisCommand()).containsExactly("lake", "serve");
        assertThat(settings.resolveRoomLog("main")).isEqualTo(settings.getDataDir().resolve("main.ystore"));
        assertThat(ProtocolMessageValidator.isFileUri(settings.getDocumentUris().fileUri())).isTrue();
    }

    @Test
    void emptyCommandIsRejected() {
        assertThatThrownBy(() -> new SettingsService(
                        tempDir.toString(), "a.lean", new String[0], 5, 2000, tempDir.toString(), 1024, 1000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

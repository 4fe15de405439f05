package club.ppmc.leanedit.service;

import java.nio.file.Path;

/** SettingsService instances rooted in a temporary directory. */
final class TestSettings {

    static final String DOCUMENT_FILE = "src/Scratch.lean";

    private TestSettings() {}

    static SettingsService withCommand(Path root, String... command) {
        return withCancelTimeout(root, 300, command);
    }

    static SettingsService withCancelTimeout(Path root, long cancelTimeoutMillis, String... command) {
        var settings = new SettingsService(
                root.toString(),
                DOCUMENT_FILE,
                command,
                1,
                cancelTimeoutMillis,
                root.resolve("data").toString(),
                8 * 1024 * 1024,
                10_000);
        settings.init();
        return settings;
    }
}

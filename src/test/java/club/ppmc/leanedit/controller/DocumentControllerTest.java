package club.ppmc.leanedit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.leanedit.service.SettingsService;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DocumentControllerTest {

    @TempDir
    Path tempDir;

    private MockMvc mockMvc;
    private SettingsService settings;

    @BeforeEach
    void setUp() {
        settings = new SettingsService(
                tempDir.resolve("lean-project").toString(),
                "src/Scratch.lean",
                new String[] {"lake", "serve"},
                5,
                2000,
                tempDir.resolve("data").toString(),
                8 * 1024 * 1024,
                10_000);
        mockMvc = MockMvcBuilders.standaloneSetup(new DocumentController(settings)).build();
    }

    @Test
    void fileUriPointsAtMirroredDocumentInsideProject() throws Exception {
        String root = settings.getDocumentUris().rootUri();

        mockMvc.perform(get("/file-uri"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rootUri").value(root))
                .andExpect(jsonPath("$.fileUri").value(root + "/src/Scratch.lean"));
    }
}

package dev.pekelund.wastelog.analyzer;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.wastelog.analyzer.config.RequestIdFilter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("local")
class WasteAnalyzerApplicationTests {

    @TempDir
    static Path dataDir;

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void wasteLogProperties(DynamicPropertyRegistry registry) {
        registry.add("waste-log.store.data-file", () -> dataDir.resolve("waste.json").toString());
        registry.add("waste-log.uploads.directory", () -> dataDir.resolve("uploads").toString());
    }

    @Test
    void sameImageTwiceYieldsConsistentEntries() throws Exception {
        byte[] photo = "identical-photo-bytes".getBytes();

        mockMvc.perform(multipart("/api/analyze-waste")
                .file(new MockMultipartFile("image", "plate.jpg", "image/jpeg", photo))
                .header(RequestIdFilter.REQUEST_ID_HEADER, "first-upload"))
            .andExpect(status().isOk())
            .andExpect(header().string(RequestIdFilter.REQUEST_ID_HEADER, "first-upload"))
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.wasteEntry.id").value(1))
            .andExpect(jsonPath("$.wasteEntry.totalEstimatedValue").value(7.0))
            .andExpect(jsonPath("$.wasteEntry.consistencyNote").value(""));

        mockMvc.perform(multipart("/api/analyze-waste")
                .file(new MockMultipartFile("image", "plate.jpg", "image/jpeg", photo)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.wasteEntry.id").value(2))
            .andExpect(jsonPath("$.wasteEntry.totalEstimatedValue").value(7.0))
            .andExpect(jsonPath("$.wasteEntry.duplicateOfEntryId").value(1))
            .andExpect(jsonPath("$.wasteEntry.consistencyNote")
                .value("Values aligned with duplicate of entry #1 for consistency."));

        mockMvc.perform(get("/api/waste-history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].id").value(2))
            .andExpect(jsonPath("$[0].items.length()").value(3));

        mockMvc.perform(get("/api/waste-stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.overall.total_entries").value(2))
            .andExpect(jsonPath("$.overall.total_value").value(14.0));

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.entries").value(2));
    }
}

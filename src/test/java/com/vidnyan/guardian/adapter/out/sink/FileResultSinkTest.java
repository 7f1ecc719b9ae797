package com.vidnyan.guardian.adapter.out.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.error.SinkException;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GenOpsPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static com.vidnyan.guardian.TestReports.sampleReport;
import static org.junit.jupiter.api.Assertions.*;

class FileResultSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void publish_ShouldWriteArtifactsAndArchive() throws Exception {
        Path out = tempDir.resolve("analysis_results");
        FileResultSink sink = new FileResultSink(objectMapper, out, true);

        sink.publish(sampleReport(), RunMode.MANUAL);

        assertEquals("Risk score 11 (low).\n\nRepository health: low risk\n",
                Files.readString(out.resolve(FileResultSink.NARRATIVE_FILE)));

        JsonNode payload = objectMapper.readTree(out.resolve(GenOpsPayload.FILE_NAME).toFile());
        assertEquals(11, payload.get("risk_score").asInt());
        assertEquals("completed_with_skips", payload.get("status").asText());
        assertEquals("ruff", payload.get("skipped_tools").get(0).asText());

        JsonNode results = objectMapper.readTree(out.resolve(FileResultSink.RESULTS_JSON).toFile());
        assertEquals(2, results.get("bandit").get("findings").size());
        assertEquals(0, results.get("ruff").get("findings").size());

        String markdown = Files.readString(out.resolve(FileResultSink.RESULTS_MARKDOWN));
        assertTrue(markdown.startsWith("# Analyzer Results\n"));
        assertTrue(markdown.contains("- **bandit**:"));

        assertEquals(List.of(FileResultSink.NARRATIVE_FILE, GenOpsPayload.FILE_NAME,
                FileResultSink.RESULTS_JSON, FileResultSink.RESULTS_MARKDOWN), zipEntries(out.resolve(FileResultSink.ARCHIVE)));
    }

    @Test
    void publish_ShouldSkipArchiveWhenDisabled() {
        Path out = tempDir.resolve("out");

        new FileResultSink(objectMapper, out, false).publish(sampleReport(), RunMode.PR);

        assertTrue(Files.exists(out.resolve(GenOpsPayload.FILE_NAME)));
        assertFalse(Files.exists(out.resolve(FileResultSink.ARCHIVE)));
    }

    @Test
    void publish_ShouldWrapIoFailures() throws Exception {
        Path blocker = tempDir.resolve("not-a-directory");
        Files.writeString(blocker, "x");
        FileResultSink sink = new FileResultSink(objectMapper, blocker, true);

        SinkException error = assertThrows(SinkException.class, () -> sink.publish(sampleReport(), RunMode.MANUAL));
        assertEquals("files", error.getSink());
    }

    private static List<String> zipEntries(Path zip) throws Exception {
        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(zip); ZipInputStream zipIn = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zipIn.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}

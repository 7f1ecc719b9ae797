package com.vidnyan.guardian.adapter.out.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.guardian.application.port.out.ResultSink;
import com.vidnyan.guardian.config.GuardianProperties;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.error.SinkException;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GenOpsPayload;
import com.vidnyan.guardian.domain.report.GuardianReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Persists the report as workflow artifacts in the output directory and bundles them
 * into {@value #ARCHIVE}. Used in every mode.
 */
@Slf4j
@Component
@Order(1)
public class FileResultSink implements ResultSink {

    public static final String NARRATIVE_FILE = "universal_agent.txt";
    public static final String RESULTS_JSON = "analyzer_results.json";
    public static final String RESULTS_MARKDOWN = "analyzer_results.md";
    public static final String ARCHIVE = "guardian-artifacts.zip";

    private final ObjectMapper objectMapper;
    private final Path outputDir;
    private final boolean archive;

    @Autowired
    public FileResultSink(ObjectMapper objectMapper, GuardianProperties properties) {
        this(objectMapper, Path.of(properties.getSink().getOutputDir()), properties.getSink().isArchive());
    }

    public FileResultSink(ObjectMapper objectMapper, Path outputDir, boolean archive) {
        this.objectMapper = objectMapper;
        this.outputDir = outputDir;
        this.archive = archive;
    }

    @Override
    public String name() {
        return "files";
    }

    @Override
    public boolean supports(RunMode mode) {
        return true;
    }

    @Override
    public void publish(GuardianReport report, RunMode mode) {
        try {
            Files.createDirectories(outputDir);

            Path narrative = write(NARRATIVE_FILE, narrativeText(report));
            Path payload = write(GenOpsPayload.FILE_NAME,
                    objectMapper.writeValueAsString(GenOpsPayload.from(report)));
            ObjectNode results = analyzerResults(report);
            Path resultsJson = write(RESULTS_JSON, objectMapper.writeValueAsString(results));
            Path resultsMd = write(RESULTS_MARKDOWN,
                    MarkdownRenderer.document("Analyzer Results", RESULTS_JSON, results));

            if (archive) {
                bundle(List.of(narrative, payload, resultsJson, resultsMd));
            }
            log.info("Wrote analysis artifacts to {}", outputDir.toAbsolutePath());
        } catch (IOException e) {
            throw new SinkException(name(), "Failed to write artifacts to " + outputDir + ": " + e.getMessage(), e);
        }
    }

    private Path write(String fileName, String content) throws IOException {
        Path target = outputDir.resolve(fileName);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }

    private static String narrativeText(GuardianReport report) {
        return report.narrative().summary() + "\n\n" + report.narrative().detail();
    }

    /**
     * Per-tool view: execution record plus the findings attributed to the tool.
     */
    ObjectNode analyzerResults(GuardianReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        for (ToolExecution execution : report.detail().executions()) {
            ObjectNode tool = objectMapper.valueToTree(execution);
            List<Finding> findings = report.detail().findings().stream()
                    .filter(f -> f.tool().equals(execution.toolId()))
                    .toList();
            tool.set("findings", objectMapper.valueToTree(findings));
            root.set(execution.toolId(), tool);
        }
        return root;
    }

    private void bundle(List<Path> files) throws IOException {
        Path zip = outputDir.resolve(ARCHIVE);
        try (OutputStream out = Files.newOutputStream(zip);
             ZipOutputStream zipOut = new ZipOutputStream(out)) {
            for (Path file : files) {
                zipOut.putNextEntry(new ZipEntry(file.getFileName().toString()));
                Files.copy(file, zipOut);
                zipOut.closeEntry();
            }
        }
    }
}

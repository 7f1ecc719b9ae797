package com.vidnyan.guardian;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.Severity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for analyzer specs, invocations and findings.
 */
public final class TestSpecs {

    private TestSpecs() {
    }

    public static AnalyzerSpec spec(String id, String ecosystem, OutputFormat format, String... command) {
        return new AnalyzerSpec(id, id, ecosystem, List.of(command), Duration.ofSeconds(30), format,
                Map.of("high", Severity.HIGH, "medium", Severity.MEDIUM, "low", Severity.LOW,
                        "error", Severity.HIGH, "warning", Severity.MEDIUM, "note", Severity.LOW),
                List.of(), null);
    }

    public static AnalyzerSpec fileSpec(String id, String ecosystem, List<String> extensions) {
        return new AnalyzerSpec(id, id, ecosystem, List.of(id, "--json", AnalyzerSpec.FILES_PLACEHOLDER),
                Duration.ofSeconds(30), OutputFormat.GENERIC_JSON, Map.of(), extensions, null);
    }

    public static Invocation invocation(AnalyzerSpec spec, Path root) {
        return new Invocation(spec.id() + "#1", spec, root, List.of(), spec.command());
    }

    public static Finding finding(String tool, Severity severity, String file, Integer line, String message) {
        return Finding.builder()
                .tool(tool)
                .severity(severity)
                .file(file)
                .line(line)
                .message(message)
                .ruleId(tool + "-rule")
                .build();
    }
}

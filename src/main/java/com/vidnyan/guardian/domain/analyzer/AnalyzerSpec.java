package com.vidnyan.guardian.domain.analyzer;

import com.vidnyan.guardian.domain.model.Severity;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of one analyzer: how to invoke it and how to read its output.
 * Loaded once from the analyzer catalog and never mutated.
 *
 * <p>The command template may contain {@code {root}} (absolute repository root) and
 * {@code {files}} (the file subset, expanded to one argument per file).
 */
public record AnalyzerSpec(
    String id,
    String name,
    String ecosystem,
    List<String> command,
    Duration timeout,
    OutputFormat format,
    Map<String, Severity> severities,
    List<String> extensions,
    String requiresPath
) {

    public static final String UNIVERSAL = "*";
    public static final String ROOT_PLACEHOLDER = "{root}";
    public static final String FILES_PLACEHOLDER = "{files}";

    public AnalyzerSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(format, "format");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Analyzer " + id + " has no command");
        }
        name = name != null ? name : id;
        ecosystem = ecosystem != null ? ecosystem : UNIVERSAL;
        command = List.copyOf(command);
        extensions = extensions != null ? List.copyOf(extensions) : List.of();
        Map<String, Severity> normalized = new LinkedHashMap<>();
        if (severities != null) {
            severities.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        severities = Map.copyOf(normalized);
    }

    public String executable() {
        return command.get(0);
    }

    public boolean isUniversal() {
        return UNIVERSAL.equals(ecosystem);
    }

    public boolean targetsFiles() {
        return command.contains(FILES_PLACEHOLDER);
    }

    /**
     * Map a tool-native level to the unified severity. Unmapped levels are {@code info}.
     */
    public Severity severityFor(String nativeLevel) {
        if (nativeLevel == null) {
            return Severity.INFO;
        }
        return severities.getOrDefault(nativeLevel.trim().toLowerCase(Locale.ROOT), Severity.INFO);
    }

    /**
     * Whether the file falls in this analyzer's extension scope. No scope means every file.
     */
    public boolean appliesTo(String file) {
        if (extensions.isEmpty()) {
            return true;
        }
        String lower = file.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }
}

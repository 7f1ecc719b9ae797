package com.vidnyan.guardian.domain.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.ExecutionStatus;
import com.vidnyan.guardian.domain.analyzer.InvocationResult;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.analyzer.RawOutput;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.normalize.parser.BanditJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.EslintJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.GenericJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.LineOutputParser;
import com.vidnyan.guardian.domain.normalize.parser.PhpcsJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.PipAuditJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.PmdJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.RubocopJsonParser;
import com.vidnyan.guardian.domain.normalize.parser.SarifParser;
import com.vidnyan.guardian.domain.normalize.parser.SemgrepJsonParser;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns captured analyzer output into findings plus one execution record.
 *
 * <p>Output that fails to parse is kept verbatim as a single raw finding when the tool
 * exited cleanly. With a nonzero exit the tool is considered crashed and its output is
 * dropped; only a short stderr excerpt survives in the execution detail. A structured
 * format with a nonzero exit and nothing on stdout is a crash as well.
 *
 * <p>Only completed invocations are parsed. Whatever a timed-out or failed process left
 * behind contributes no findings.
 *
 * <p>Output cut at the capture limit is never taken as complete: truncated JSON or SARIF
 * is dropped, truncated line output keeps the findings read before the cut.
 */
@Slf4j
public class FindingNormalizer {

    static final int DETAIL_LIMIT = 1500;
    static final String TRUNCATED_DETAIL = "output exceeded the capture limit";

    private final Map<OutputFormat, OutputParser> parsers;

    public FindingNormalizer(List<OutputParser> parsers) {
        this.parsers = new EnumMap<>(OutputFormat.class);
        parsers.forEach(p -> this.parsers.put(p.format(), p));
        for (OutputFormat format : OutputFormat.values()) {
            if (!this.parsers.containsKey(format)) {
                throw new IllegalArgumentException("No parser registered for " + format);
            }
        }
    }

    public static FindingNormalizer standard(ObjectMapper objectMapper) {
        return new FindingNormalizer(List.of(
                new SarifParser(objectMapper),
                new BanditJsonParser(objectMapper),
                new EslintJsonParser(objectMapper),
                new SemgrepJsonParser(objectMapper),
                new PipAuditJsonParser(objectMapper),
                new PmdJsonParser(objectMapper),
                new RubocopJsonParser(objectMapper),
                new PhpcsJsonParser(objectMapper),
                new GenericJsonParser(objectMapper),
                new LineOutputParser()));
    }

    public Normalized normalize(InvocationResult result) {
        AnalyzerSpec spec = result.invocation().spec();
        long durationMs = result.duration().toMillis();

        if (!result.hasOutput() || result.status() != ExecutionStatus.SUCCESS) {
            return Normalized.withoutFindings(switch (result.status()) {
                case TIMEOUT -> ToolExecution.timeout(spec, durationMs, result.detail());
                case SKIPPED -> ToolExecution.skipped(spec, result.detail());
                default -> ToolExecution.crashed(spec, null, durationMs, result.detail());
            });
        }

        RawOutput output = result.output();
        Path root = result.invocation().workingDirectory();

        if (output.primaryText().isBlank()) {
            if (output.exitCode() == 0) {
                return new Normalized(List.of(), ToolExecution.success(spec, 0, durationMs, 0));
            }
            return Normalized.withoutFindings(ToolExecution.crashed(spec, output.exitCode(), durationMs,
                    "exited with " + output.exitCode() + " and no output"));
        }

        boolean structured = spec.format() != OutputFormat.LINE;
        if (structured && output.exitCode() != 0 && output.stdout().isBlank()) {
            log.warn("{} exited with {} and reported only on stderr", spec.id(), output.exitCode());
            return Normalized.withoutFindings(ToolExecution.crashed(spec, output.exitCode(), durationMs,
                    "exited with " + output.exitCode() + ": " + excerpt(output.stderr())));
        }
        if (structured && output.truncated()) {
            log.warn("{} output hit the capture limit; discarding incomplete {}", spec.id(), spec.format());
            return Normalized.withoutFindings(ToolExecution.truncated(spec, output.exitCode(), durationMs,
                    TRUNCATED_DETAIL + "; " + spec.format() + " document discarded"));
        }

        try {
            List<ParsedIssue> issues = parsers.get(spec.format()).parse(output, spec);
            List<Finding> findings = new ArrayList<>(issues.size());
            for (ParsedIssue issue : issues) {
                findings.add(toFinding(spec, issue, root));
            }
            log.debug("{} produced {} findings", spec.id(), findings.size());
            if (output.truncated()) {
                log.warn("{} output hit the capture limit; keeping {} findings read before the cut",
                        spec.id(), findings.size());
                return new Normalized(findings, ToolExecution.partial(spec, output.exitCode(), durationMs,
                        findings.size(), TRUNCATED_DETAIL + "; findings may be incomplete"));
            }
            return new Normalized(findings, ToolExecution.success(spec, output.exitCode(), durationMs, findings.size()));
        } catch (RuntimeException e) {
            return parseFailed(spec, output, durationMs, e);
        }
    }

    private Normalized parseFailed(AnalyzerSpec spec, RawOutput output, long durationMs, RuntimeException e) {
        if (output.exitCode() != 0) {
            log.warn("{} exited with {} and unparseable output: {}", spec.id(), output.exitCode(), e.getMessage());
            String detail = "exited with " + output.exitCode() + ": " + excerpt(output.stderr().isBlank()
                    ? e.getMessage() : output.stderr());
            return Normalized.withoutFindings(ToolExecution.crashed(spec, output.exitCode(), durationMs, detail));
        }
        log.warn("{} output could not be parsed as {}; keeping it as a raw finding: {}",
                spec.id(), spec.format(), e.getMessage());
        return new Normalized(List.of(Finding.raw(spec.id(), output.primaryText())),
                ToolExecution.unparsed(spec, output.exitCode(), durationMs, excerpt(e.getMessage())));
    }

    private Finding toFinding(AnalyzerSpec spec, ParsedIssue issue, Path root) {
        Integer line = issue.line() != null && issue.line() > 0 ? issue.line() : null;
        return Finding.builder()
                .tool(spec.id())
                .severity(spec.severityFor(issue.level()))
                .file(normalizePath(issue.file(), root))
                .line(line)
                .message(issue.message() != null ? issue.message().strip() : "")
                .ruleId(issue.ruleId())
                .build();
    }

    /**
     * Repository-relative, '/'-separated path without a leading "./".
     */
    static String normalizePath(String file, Path root) {
        if (file == null || file.isBlank()) {
            return null;
        }
        String path = file.replace('\\', '/');
        if (root != null) {
            String prefix = root.toAbsolutePath().normalize().toString().replace('\\', '/');
            if (!prefix.endsWith("/")) {
                prefix = prefix + "/";
            }
            if (path.startsWith(prefix)) {
                path = path.substring(prefix.length());
            }
        }
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        return path;
    }

    static String excerpt(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        return trimmed.length() <= DETAIL_LIMIT ? trimmed : trimmed.substring(0, DETAIL_LIMIT) + "...";
    }

    /**
     * Findings of one invocation plus its execution record.
     */
    public record Normalized(List<Finding> findings, ToolExecution execution) {

        public Normalized {
            findings = List.copyOf(findings);
        }

        static Normalized withoutFindings(ToolExecution execution) {
            return new Normalized(List.of(), execution);
        }

        public boolean succeeded() {
            return execution.status() == ExecutionStatus.SUCCESS;
        }
    }
}

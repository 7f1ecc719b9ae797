package com.vidnyan.guardian.domain.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.ExecutionStatus;
import com.vidnyan.guardian.domain.analyzer.FailureKind;
import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.analyzer.InvocationResult;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.analyzer.RawOutput;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static com.vidnyan.guardian.TestSpecs.invocation;
import static com.vidnyan.guardian.TestSpecs.spec;
import static org.junit.jupiter.api.Assertions.*;

class FindingNormalizerTest {

    private static final Path ROOT = Path.of("/work/repo");
    private static final AnalyzerSpec SEMGREP = spec("semgrep", "*", OutputFormat.SEMGREP_JSON, "semgrep");

    private final FindingNormalizer normalizer = FindingNormalizer.standard(new ObjectMapper());

    private InvocationResult completed(AnalyzerSpec spec, int exitCode, String stdout, String stderr) {
        Invocation invocation = invocation(spec, ROOT);
        return InvocationResult.completed(invocation, new RawOutput(exitCode, stdout, stderr, false),
                Duration.ofMillis(120));
    }

    @Test
    void normalize_ShouldMapSeverityAndRelativizePaths() {
        String stdout = """
                {"results": [
                  {"check_id": "python.lang.security.eval", "path": "/work/repo/app/main.py",
                   "start": {"line": 14}, "extra": {"severity": "ERROR", "message": " Avoid eval "}},
                  {"check_id": "generic.secrets", "path": "./config/settings.py",
                   "start": {"line": 0}, "extra": {"severity": "INFO", "message": "Possible secret"}}
                ], "errors": []}
                """;

        FindingNormalizer.Normalized normalized = normalizer.normalize(completed(SEMGREP, 1, stdout, ""));

        assertTrue(normalized.succeeded());
        assertEquals(2, normalized.execution().findingCount());
        Finding first = normalized.findings().get(0);
        assertEquals("semgrep", first.tool());
        assertEquals(Severity.HIGH, first.severity());
        assertEquals("app/main.py", first.file());
        assertEquals(14, first.line());
        assertEquals("Avoid eval", first.message());

        Finding second = normalized.findings().get(1);
        assertEquals("config/settings.py", second.file());
        assertNull(second.line(), "non-positive lines are dropped");
        assertEquals(Severity.INFO, second.severity());
    }

    @Test
    void normalize_ShouldKeepUnparseableOutputAsRawFindingWhenExitIsClean() {
        FindingNormalizer.Normalized normalized =
                normalizer.normalize(completed(SEMGREP, 0, "{\"results\": [", ""));

        assertEquals(1, normalized.findings().size());
        Finding raw = normalized.findings().get(0);
        assertTrue(raw.raw());
        assertEquals(Severity.INFO, raw.severity());
        assertEquals("{\"results\": [", raw.message());
        assertEquals(ExecutionStatus.SUCCESS, normalized.execution().status());
        assertEquals(FailureKind.PARSE_ERROR, normalized.execution().failure());
    }

    @Test
    void normalize_ShouldTreatUnparseableOutputWithNonzeroExitAsCrash() {
        FindingNormalizer.Normalized normalized =
                normalizer.normalize(completed(SEMGREP, 2, "Traceback (most recent call last)", "boom"));

        assertTrue(normalized.findings().isEmpty());
        assertEquals(ExecutionStatus.ERROR, normalized.execution().status());
        assertEquals(FailureKind.TOOL_CRASH, normalized.execution().failure());
        assertEquals(2, normalized.execution().exitCode());
        assertEquals("exited with 2: boom", normalized.execution().detail());
    }

    @Test
    void normalize_ShouldTreatStderrOnlyFailureAsCrash() {
        AnalyzerSpec eslint = spec("eslint", "javascript", OutputFormat.ESLINT_JSON, "npx", "eslint");

        FindingNormalizer.Normalized normalized = normalizer.normalize(
                completed(eslint, 1, "", "npm ERR! could not determine executable to run"));

        assertTrue(normalized.findings().isEmpty());
        assertFalse(normalized.succeeded());
        assertEquals(ExecutionStatus.ERROR, normalized.execution().status());
        assertEquals(FailureKind.TOOL_CRASH, normalized.execution().failure());
        assertEquals("exited with 1: npm ERR! could not determine executable to run",
                normalized.execution().detail());
    }

    @Test
    void normalize_ShouldKeepLineFindingsReadBeforeCaptureLimit() {
        AnalyzerSpec vet = spec("govet", "go", OutputFormat.LINE, "go", "vet");
        Invocation invocation = invocation(vet, ROOT);
        RawOutput cut = new RawOutput(1, "main.go:4: unreachable code\nmain.go:9: result of fmt.Sprin", "", true);

        FindingNormalizer.Normalized normalized = normalizer.normalize(
                InvocationResult.completed(invocation, cut, Duration.ofMillis(80)));

        assertEquals(2, normalized.findings().size());
        assertEquals(ExecutionStatus.SUCCESS, normalized.execution().status());
        assertEquals(FailureKind.OUTPUT_TRUNCATED, normalized.execution().failure());
        assertTrue(normalized.execution().isTruncated());
        assertTrue(normalized.execution().detail().contains("capture limit"));
    }

    @Test
    void normalize_ShouldDiscardTruncatedStructuredOutput() {
        Invocation invocation = invocation(SEMGREP, ROOT);
        RawOutput cut = new RawOutput(1, """
                {"results": [
                  {"check_id": "eval", "path": "app.py", "start": {"line": 3},
                   "extra": {"severity": "ERROR", "message": "Avoid eval"}},
                  {"check_id": "exec", "path": "app.py", "start""", "", true);

        FindingNormalizer.Normalized normalized = normalizer.normalize(
                InvocationResult.completed(invocation, cut, Duration.ofMillis(80)));

        assertTrue(normalized.findings().isEmpty());
        assertEquals(ExecutionStatus.ERROR, normalized.execution().status());
        assertEquals(FailureKind.OUTPUT_TRUNCATED, normalized.execution().failure());
        assertEquals(0, normalized.execution().findingCount());
    }

    @Test
    void normalize_ShouldIgnoreOutputLeftByTimedOutProcess() {
        Invocation invocation = invocation(SEMGREP, ROOT);
        RawOutput partial = new RawOutput(0, """
                {"results": [{"check_id": "eval", "path": "app.py", "start": {"line": 3},
                  "extra": {"severity": "ERROR", "message": "Avoid eval"}}]}
                """, "", false);
        InvocationResult result = new InvocationResult(invocation, ExecutionStatus.TIMEOUT,
                FailureKind.TOOL_TIMEOUT, partial, Duration.ofSeconds(30), "exceeded 30s");

        FindingNormalizer.Normalized normalized = normalizer.normalize(result);

        assertTrue(normalized.findings().isEmpty());
        assertEquals(ExecutionStatus.TIMEOUT, normalized.execution().status());
        assertEquals(0, normalized.execution().findingCount());
    }

    @Test
    void normalize_ShouldHandleBlankOutput() {
        FindingNormalizer.Normalized clean = normalizer.normalize(completed(SEMGREP, 0, "", ""));
        FindingNormalizer.Normalized failed = normalizer.normalize(completed(SEMGREP, 3, " ", ""));

        assertTrue(clean.succeeded());
        assertEquals(0, clean.execution().findingCount());
        assertEquals(ExecutionStatus.ERROR, failed.execution().status());
        assertEquals("exited with 3 and no output", failed.execution().detail());
    }

    @Test
    void normalize_ShouldRecordTimeoutsAndUnavailableTools() {
        Invocation invocation = invocation(SEMGREP, ROOT);

        FindingNormalizer.Normalized timedOut = normalizer.normalize(
                InvocationResult.timedOut(invocation, Duration.ofSeconds(30), "exceeded 30s"));
        FindingNormalizer.Normalized unavailable = normalizer.normalize(
                InvocationResult.unavailable(invocation, "semgrep not found"));

        assertEquals(ExecutionStatus.TIMEOUT, timedOut.execution().status());
        assertEquals(30_000, timedOut.execution().durationMs());
        assertTrue(timedOut.findings().isEmpty());
        assertEquals(ExecutionStatus.SKIPPED, unavailable.execution().status());
        assertEquals(FailureKind.TOOL_UNAVAILABLE, unavailable.execution().failure());
    }

    @Test
    void constructor_ShouldRequireParserForEveryFormat() {
        assertThrows(IllegalArgumentException.class, () -> new FindingNormalizer(List.of()));
    }

    @Test
    void normalizePath_ShouldUseForwardSlashes() {
        assertEquals("src/App.cs", FindingNormalizer.normalizePath("src\\App.cs", ROOT));
        assertNull(FindingNormalizer.normalizePath(" ", ROOT));
        assertEquals("/elsewhere/x.py", FindingNormalizer.normalizePath("/elsewhere/x.py", ROOT));
    }

    @Test
    void excerpt_ShouldTruncateLongText() {
        String excerpt = FindingNormalizer.excerpt("x".repeat(2000));

        assertEquals(FindingNormalizer.DETAIL_LIMIT + 3, excerpt.length());
        assertTrue(excerpt.endsWith("..."));
    }
}

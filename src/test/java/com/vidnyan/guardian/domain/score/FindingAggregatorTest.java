package com.vidnyan.guardian.domain.score;

import com.vidnyan.guardian.domain.model.ContextSignals;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.guardian.TestSpecs.finding;
import static org.junit.jupiter.api.Assertions.*;

class FindingAggregatorTest {

    private final FindingAggregator aggregator = new FindingAggregator(2, 0.8);

    @Test
    void aggregate_ShouldMergeSameIssueFromTwoToolsKeepingHigherSeverity() {
        Finding fromBandit = finding("bandit", Severity.MEDIUM, "app.py", 10, "Use of eval detected");
        Finding fromSemgrep = finding("semgrep", Severity.HIGH, "app.py", 11, "use of EVAL detected!");

        List<Finding> result = aggregator.aggregate(List.of(fromBandit, fromSemgrep));

        assertEquals(1, result.size());
        Finding kept = result.get(0);
        assertEquals("semgrep", kept.tool());
        assertEquals(Severity.HIGH, kept.severity());
        assertEquals(List.of("bandit"), kept.corroboratedBy());
    }

    @Test
    void aggregate_ShouldKeepFindingsThatDifferInLocationOrMessage() {
        List<Finding> findings = List.of(
                finding("bandit", Severity.HIGH, "app.py", 10, "Use of eval detected"),
                finding("semgrep", Severity.HIGH, "app.py", 20, "Use of eval detected"),
                finding("ruff", Severity.HIGH, "other.py", 10, "Use of eval detected"),
                finding("pylint", Severity.HIGH, "app.py", 10, "Unused import os"));

        assertEquals(4, aggregator.aggregate(findings).size());
    }

    @Test
    void aggregate_ShouldKeepNeighbouringHitsOfTheSameTool() {
        List<Finding> findings = List.of(
                finding("bandit", Severity.HIGH, "app.py", 10, "Use of insecure MD5 hash function"),
                finding("bandit", Severity.HIGH, "app.py", 11, "Use of insecure MD5 hash function"),
                finding("bandit", Severity.HIGH, "app.py", 12, "Use of insecure MD5 hash function"));

        List<Finding> result = aggregator.aggregate(findings);

        assertEquals(3, result.size());
        assertEquals(List.of(10, 11, 12), result.stream().map(Finding::line).toList());
        assertTrue(result.stream().allMatch(f -> f.corroboratedBy().isEmpty()));

        AggregateResult scored = new RiskScorer(ScoringPolicy.defaults())
                .score(result, List.of(), ContextSignals.none());
        assertEquals(30, scored.riskScore());
    }

    @Test
    void aggregate_ShouldMergeRepeatedReportOfSameRuleAndLine() {
        Finding first = finding("bandit", Severity.HIGH, "app.py", 10, "Use of insecure MD5 hash function");
        Finding repeat = finding("bandit", Severity.HIGH, "app.py", 10, "Use of insecure MD5 hash function.");

        List<Finding> result = aggregator.aggregate(List.of(first, repeat));

        assertEquals(1, result.size());
        assertTrue(result.get(0).corroboratedBy().isEmpty());
    }

    @Test
    void isDuplicate_ShouldRequireSameRuleForOneTool() {
        Finding md5 = Finding.builder().tool("bandit").severity(Severity.HIGH).file("app.py").line(10)
                .message("Insecure hash").ruleId("B303").build();
        Finding sha1 = Finding.builder().tool("bandit").severity(Severity.HIGH).file("app.py").line(10)
                .message("Insecure hash").ruleId("B324").build();

        assertFalse(aggregator.isDuplicate(md5, sha1));
        assertTrue(aggregator.isDuplicate(md5, md5));
    }

    @Test
    void aggregate_ShouldNeverMergeRawFindings() {
        List<Finding> findings = List.of(Finding.raw("ruff", "garbled"), Finding.raw("ruff", "garbled"));

        assertEquals(2, aggregator.aggregate(findings).size());
    }

    @Test
    void aggregate_ShouldBeIdempotent() {
        List<Finding> findings = List.of(
                finding("bandit", Severity.MEDIUM, "app.py", 10, "Use of eval detected"),
                finding("semgrep", Severity.HIGH, "app.py", 10, "Use of eval detected"),
                finding("trivy", Severity.LOW, "Dockerfile", null, "Image runs as root"),
                finding("hadolint", Severity.LOW, "Dockerfile", null, "image runs as root"),
                finding("eslint", Severity.INFO, "web/index.js", 3, "Missing semicolon"));

        List<Finding> once = aggregator.aggregate(findings);
        List<Finding> twice = aggregator.aggregate(once);

        assertEquals(3, once.size());
        assertEquals(once, twice);
    }

    @Test
    void aggregate_ShouldSortByFileThenLineThenSeverity() {
        List<Finding> result = aggregator.aggregate(List.of(
                finding("b", Severity.LOW, "z.py", 1, "last file"),
                Finding.raw("c", "no file"),
                finding("a", Severity.LOW, "a.py", 5, "later line"),
                finding("a", Severity.CRITICAL, "a.py", 5, "different words entirely"),
                finding("a", Severity.HIGH, "a.py", 1, "first line")));

        assertEquals(List.of("first line", "different words entirely", "later line", "last file", "no file"),
                result.stream().map(Finding::message).toList());
    }

    @Test
    void isDuplicate_ShouldRequireBothLinesPresentOrBothAbsent() {
        Finding withLine = finding("a", Severity.LOW, "f.tf", 4, "bucket is public");
        Finding withoutLine = finding("b", Severity.LOW, "f.tf", null, "bucket is public");

        assertFalse(aggregator.isDuplicate(withLine, withoutLine));
        assertTrue(aggregator.isDuplicate(withoutLine, withoutLine));
    }

    @Test
    void similarity_ShouldIgnoreCaseAndPunctuation() {
        assertEquals(1.0, MessageSimilarity.similarity("Use of 'eval'", "use of eval!"));
        assertEquals(1.0, MessageSimilarity.similarity("", "..."));
        assertEquals(0.0, MessageSimilarity.similarity("alpha", "beta"));
        assertEquals(0.5, MessageSimilarity.similarity("alpha beta", "alpha"));
    }
}

package com.vidnyan.guardian.domain.report;

import com.vidnyan.guardian.domain.analyzer.ExecutionStatus;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.RepositoryContext;
import com.vidnyan.guardian.domain.model.Severity;
import com.vidnyan.guardian.domain.policy.ComplianceReport;
import com.vidnyan.guardian.domain.score.AggregateResult;
import com.vidnyan.guardian.domain.score.FindingAggregator;
import com.vidnyan.guardian.domain.score.RiskLevel;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the summary and detail views of a run.
 */
public class ReportBuilder {

    public static final int TOP_ISSUES = 5;

    private static final Comparator<Finding> BY_IMPORTANCE = Comparator
            .comparing(Finding::severity, Comparator.reverseOrder())
            .thenComparing(FindingAggregator.REPORT_ORDER);

    private final Clock clock;

    public ReportBuilder() {
        this(Clock.systemUTC());
    }

    public ReportBuilder(Clock clock) {
        this.clock = clock;
    }

    public GuardianReport build(RepositoryContext context, AggregateResult result, ComplianceReport compliance) {
        RunStatus status = result.hasIncompleteTools() ? RunStatus.COMPLETED_WITH_SKIPS : RunStatus.COMPLETED;

        ReportSummary summary = new ReportSummary(
                result.riskScore(),
                result.riskLevel(),
                status,
                counts(result),
                result.findings().stream().sorted(BY_IMPORTANCE).limit(TOP_ISSUES).toList(),
                toolIds(result.executions(), List.of(ExecutionStatus.SKIPPED)),
                toolIds(result.executions(), List.of(ExecutionStatus.TIMEOUT, ExecutionStatus.ERROR)),
                result.executions().stream().filter(ToolExecution::isTruncated)
                        .map(ToolExecution::toolId).distinct().sorted().toList());

        ReportDetail detail = new ReportDetail(result.findings(), result.breakdown(), result.executions(),
                context.ecosystems());

        return new GuardianReport(status, summary, detail, compliance, Narrative.placeholder(), result,
                Instant.now(clock));
    }

    /**
     * Report for a run that stopped during detection: no score, no findings.
     */
    public GuardianReport aborted(String reason) {
        ReportSummary summary = new ReportSummary(0, RiskLevel.LOW, RunStatus.ABORTED,
                counts(new AggregateResult(List.of(), List.of(), 0, RiskLevel.LOW, List.of())),
                List.of(), List.of(), List.of(), List.of());
        return new GuardianReport(RunStatus.ABORTED, summary, ReportDetail.empty(), ComplianceReport.passed(),
                new Narrative("Analysis aborted: " + reason, ""), null, Instant.now(clock));
    }

    private static Map<String, Integer> counts(AggregateResult result) {
        Map<Severity, Integer> bySeverity = result.countsBySeverity();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = Severity.values().length - 1; i >= 0; i--) {
            Severity severity = Severity.values()[i];
            counts.put(severity.id(), bySeverity.get(severity));
        }
        return counts;
    }

    private static List<String> toolIds(List<ToolExecution> executions, List<ExecutionStatus> statuses) {
        return executions.stream()
                .filter(e -> statuses.contains(e.status()))
                .map(ToolExecution::toolId)
                .distinct()
                .sorted()
                .toList();
    }
}

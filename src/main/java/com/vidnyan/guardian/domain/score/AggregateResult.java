package com.vidnyan.guardian.domain.score;

import com.vidnyan.guardian.domain.analyzer.ExecutionStatus;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated findings, per-tool execution records and the computed score of one run.
 */
public record AggregateResult(
    List<Finding> findings,
    List<ToolExecution> executions,
    int riskScore,
    RiskLevel riskLevel,
    List<ScoreFactor> breakdown
) {

    public AggregateResult {
        findings = List.copyOf(findings);
        executions = List.copyOf(executions);
        breakdown = List.copyOf(breakdown);
    }

    public Map<Severity, Integer> countsBySeverity() {
        return countBySeverity(findings);
    }

    /**
     * Finding count per severity, every severity present.
     */
    public static Map<Severity, Integer> countBySeverity(List<Finding> findings) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        findings.forEach(f -> counts.merge(f.severity(), 1, Integer::sum));
        return counts;
    }

    /**
     * Whether any tool was skipped, failed, timed out or had its output cut short.
     */
    public boolean hasIncompleteTools() {
        return executions.stream().anyMatch(e -> e.status() != ExecutionStatus.SUCCESS || e.isTruncated());
    }
}

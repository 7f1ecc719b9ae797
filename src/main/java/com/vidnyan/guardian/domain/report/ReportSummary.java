package com.vidnyan.guardian.domain.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.score.RiskLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short form of the report, suitable for a PR comment header.
 * Counts keep their order, most severe first.
 */
public record ReportSummary(
    @JsonProperty("risk_score") int riskScore,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("counts") Map<String, Integer> counts,
    @JsonProperty("top_issues") List<Finding> topIssues,
    @JsonProperty("skipped_tools") List<String> skippedTools,
    @JsonProperty("failed_tools") List<String> failedTools,
    @JsonProperty("truncated_tools") List<String> truncatedTools
) {

    public ReportSummary {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
        topIssues = List.copyOf(topIssues);
        skippedTools = List.copyOf(skippedTools);
        failedTools = List.copyOf(failedTools);
        truncatedTools = List.copyOf(truncatedTools);
    }

    public int totalFindings() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}

package com.vidnyan.guardian.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.policy.ComplianceReport;
import com.vidnyan.guardian.domain.score.RiskLevel;
import com.vidnyan.guardian.domain.score.ScoreFactor;

import java.util.ArrayList;
import java.util.List;

/**
 * The persisted {@code genops_guardian.json} document.
 * {@code skipped_tools} lists every analyzer that did not complete: skipped, timed out or crashed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenOpsPayload(
    @JsonProperty("risk_score") int riskScore,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("findings") List<Finding> findings,
    @JsonProperty("breakdown") List<ScoreFactor> breakdown,
    @JsonProperty("executions") List<ToolExecution> executions,
    @JsonProperty("skipped_tools") List<String> skippedTools,
    @JsonProperty("compliance") ComplianceReport compliance,
    @JsonProperty("summary") Narrative summary
) {

    public static final String FILE_NAME = "genops_guardian.json";

    public static GenOpsPayload from(GuardianReport report) {
        List<String> incomplete = new ArrayList<>(report.summary().skippedTools());
        report.summary().failedTools().stream().filter(t -> !incomplete.contains(t)).forEach(incomplete::add);
        return new GenOpsPayload(
                report.summary().riskScore(),
                report.summary().riskLevel(),
                report.status(),
                report.detail().findings(),
                report.detail().breakdown(),
                report.detail().executions(),
                List.copyOf(incomplete),
                report.compliance(),
                report.narrative());
    }
}

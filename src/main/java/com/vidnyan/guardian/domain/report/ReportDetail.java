package com.vidnyan.guardian.domain.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.Ecosystem;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.score.ScoreFactor;

import java.util.List;

public record ReportDetail(
    @JsonProperty("findings") List<Finding> findings,
    @JsonProperty("breakdown") List<ScoreFactor> breakdown,
    @JsonProperty("executions") List<ToolExecution> executions,
    @JsonProperty("ecosystems") List<Ecosystem> ecosystems
) {

    public ReportDetail {
        findings = List.copyOf(findings);
        breakdown = List.copyOf(breakdown);
        executions = List.copyOf(executions);
        ecosystems = List.copyOf(ecosystems);
    }

    public static ReportDetail empty() {
        return new ReportDetail(List.of(), List.of(), List.of(), List.of());
    }
}

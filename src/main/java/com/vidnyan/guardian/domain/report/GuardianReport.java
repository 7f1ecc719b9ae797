package com.vidnyan.guardian.domain.report;

import com.vidnyan.guardian.domain.policy.ComplianceReport;
import com.vidnyan.guardian.domain.score.AggregateResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Final artifact of a run: summary, detail, compliance verdict and narrative.
 * {@code aggregate} is {@code null} for aborted runs.
 */
public record GuardianReport(
    RunStatus status,
    ReportSummary summary,
    ReportDetail detail,
    ComplianceReport compliance,
    Narrative narrative,
    AggregateResult aggregate,
    Instant generatedAt
) {

    public GuardianReport {
        Objects.requireNonNull(status, "status");
        narrative = narrative != null ? narrative : Narrative.placeholder();
        compliance = compliance != null ? compliance : ComplianceReport.passed();
    }

    public GuardianReport withNarrative(Narrative text) {
        return new GuardianReport(status, summary, detail, compliance, text, aggregate, generatedAt);
    }

    public int riskScore() {
        return summary.riskScore();
    }
}

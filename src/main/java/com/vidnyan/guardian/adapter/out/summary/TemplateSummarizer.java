package com.vidnyan.guardian.adapter.out.summary;

import com.vidnyan.guardian.application.port.out.Summarizer;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.model.Severity;
import com.vidnyan.guardian.domain.report.GuardianReport;
import com.vidnyan.guardian.domain.report.Narrative;
import com.vidnyan.guardian.domain.report.ReportSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic summarizer built from the report itself, no model call.
 * Can be replaced with a language-model adapter behind the same port.
 */
@Slf4j
@Component
public class TemplateSummarizer implements Summarizer {

    private static final int ITEMS_PER_SEVERITY = 10;

    @Override
    public Narrative summarize(GuardianReport report, RunMode mode) {
        ReportSummary summary = report.summary();
        log.info("Summarizing {} findings for {} run", summary.totalFindings(), mode.id());
        return new Narrative(headline(summary), detail(report));
    }

    private String headline(ReportSummary summary) {
        StringBuilder text = new StringBuilder();
        text.append(String.format("Risk score %d (%s). ", summary.riskScore(), summary.riskLevel().id()));
        if (summary.totalFindings() == 0) {
            text.append("No findings were reported.");
        } else {
            List<String> parts = new ArrayList<>();
            summary.counts().forEach((severity, count) -> {
                if (count > 0) {
                    parts.add(count + " " + severity);
                }
            });
            text.append(summary.totalFindings()).append(" findings: ").append(String.join(", ", parts)).append('.');
        }
        if (!summary.skippedTools().isEmpty()) {
            text.append(" Skipped: ").append(String.join(", ", summary.skippedTools())).append('.');
        }
        if (!summary.failedTools().isEmpty()) {
            text.append(" Incomplete: ").append(String.join(", ", summary.failedTools())).append('.');
        }
        if (!summary.truncatedTools().isEmpty()) {
            text.append(" Output truncated: ").append(String.join(", ", summary.truncatedTools())).append('.');
        }
        return text.toString();
    }

    private String detail(GuardianReport report) {
        StringBuilder text = new StringBuilder();
        text.append("Repository health: ").append(report.summary().riskLevel().id()).append(" risk\n");
        for (int i = Severity.values().length - 1; i >= 0; i--) {
            Severity severity = Severity.values()[i];
            List<Finding> matching = report.detail().findings().stream()
                    .filter(f -> f.severity() == severity)
                    .toList();
            if (matching.isEmpty()) {
                continue;
            }
            text.append('\n').append(capitalize(severity.id())).append(" (").append(matching.size()).append(")\n");
            matching.stream().limit(ITEMS_PER_SEVERITY).forEach(f -> text
                    .append("- ").append(f.location()).append(": ").append(firstLine(f.message()))
                    .append(" [").append(f.tool()).append(f.ruleId() != null ? "/" + f.ruleId() : "").append("]\n"));
            if (matching.size() > ITEMS_PER_SEVERITY) {
                text.append("- ... and ").append(matching.size() - ITEMS_PER_SEVERITY).append(" more\n");
            }
        }
        return text.toString();
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline) + " ...";
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}

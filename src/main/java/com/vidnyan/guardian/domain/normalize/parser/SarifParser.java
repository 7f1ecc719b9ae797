package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SARIF 2.1 logs. The native level is the CVSS bucket of {@code security-severity}
 * when a result or its rule declares one, otherwise the SARIF {@code level}.
 */
public class SarifParser extends JsonOutputParser {

    private static final String DEFAULT_LEVEL = "warning";
    private static final String SECURITY_SEVERITY = "security-severity";

    public SarifParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.SARIF;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        for (JsonNode run : requireArray(root, "runs")) {
            Map<String, String> ruleSeverities = ruleSecuritySeverities(run);
            for (JsonNode result : run.path("results")) {
                String ruleId = text(result, "ruleId");
                JsonNode location = result.path("locations").path(0).path("physicalLocation");
                String uri = text(location.path("artifactLocation"), "uri");
                Integer line = intValue(location.path("region"), "startLine");

                String securitySeverity = text(result.path("properties"), SECURITY_SEVERITY);
                if (securitySeverity == null && ruleId != null) {
                    securitySeverity = ruleSeverities.get(ruleId);
                }
                String level = securitySeverity != null
                        ? cvssBucket(securitySeverity)
                        : firstNonNull(text(result, "level"), DEFAULT_LEVEL);

                issues.add(new ParsedIssue(stripScheme(uri), line, level,
                        text(result.path("message"), "text"), ruleId));
            }
        }
    }

    private Map<String, String> ruleSecuritySeverities(JsonNode run) {
        Map<String, String> severities = new HashMap<>();
        for (JsonNode rule : run.path("tool").path("driver").path("rules")) {
            String value = text(rule.path("properties"), SECURITY_SEVERITY);
            String id = text(rule, "id");
            if (id != null && value != null) {
                severities.put(id, value);
            }
        }
        return severities;
    }

    static String cvssBucket(String score) {
        double value;
        try {
            value = Double.parseDouble(score.trim());
        } catch (NumberFormatException e) {
            return score.trim();
        }
        if (value >= 9.0) {
            return "critical";
        }
        if (value >= 7.0) {
            return "high";
        }
        if (value >= 4.0) {
            return "medium";
        }
        return value > 0 ? "low" : "none";
    }

    static String stripScheme(String uri) {
        if (uri == null) {
            return null;
        }
        return uri.startsWith("file://") ? uri.substring("file://".length()) : uri;
    }

    private static String firstNonNull(String value, String fallback) {
        return value != null ? value : fallback;
    }
}

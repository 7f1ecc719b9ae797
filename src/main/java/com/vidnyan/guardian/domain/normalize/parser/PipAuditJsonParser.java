package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * pip-audit {@code -f json}. Every reported vulnerability has native level
 * {@code vulnerability} and is attributed to the audited manifest.
 */
public class PipAuditJsonParser extends JsonOutputParser {

    static final String LEVEL = "vulnerability";

    public PipAuditJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.PIP_AUDIT_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        // Older releases print the dependency array at the top level.
        JsonNode dependencies = root.isArray() ? root : requireArray(root, "dependencies");
        String manifest = spec.requiresPath();
        for (JsonNode dependency : dependencies) {
            String name = text(dependency, "name");
            String version = text(dependency, "version");
            for (JsonNode vuln : dependency.path("vulns")) {
                List<String> fixes = new ArrayList<>();
                vuln.path("fix_versions").forEach(v -> fixes.add(v.asText()));
                String message = "%s %s is vulnerable to %s%s".formatted(
                        name, version, text(vuln, "id"),
                        fixes.isEmpty() ? "" : " (fixed in " + String.join(", ", fixes) + ")");
                String description = text(vuln, "description");
                if (description != null && !description.isBlank()) {
                    message = message + ": " + description.strip();
                }
                issues.add(new ParsedIssue(manifest, null, LEVEL, message, text(vuln, "id")));
            }
        }
    }
}

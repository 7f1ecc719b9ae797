package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.List;

/**
 * PMD {@code -f json}. Native levels are the rule priorities 1 (highest) to 5.
 */
public class PmdJsonParser extends JsonOutputParser {

    public PmdJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.PMD_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        for (JsonNode file : requireArray(root, "files")) {
            String filename = text(file, "filename");
            for (JsonNode violation : file.path("violations")) {
                issues.add(new ParsedIssue(filename, intValue(violation, "beginline"),
                        text(violation, "priority"), text(violation, "description"), text(violation, "rule")));
            }
        }
    }
}

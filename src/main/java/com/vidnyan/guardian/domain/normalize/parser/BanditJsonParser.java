package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.List;

public class BanditJsonParser extends JsonOutputParser {

    public BanditJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.BANDIT_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        for (JsonNode result : requireArray(root, "results")) {
            issues.add(new ParsedIssue(
                    text(result, "filename"),
                    intValue(result, "line_number"),
                    text(result, "issue_severity"),
                    text(result, "issue_text"),
                    text(result, "test_id")));
        }
    }
}

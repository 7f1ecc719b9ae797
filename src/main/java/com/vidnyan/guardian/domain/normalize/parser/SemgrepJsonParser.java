package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.List;

public class SemgrepJsonParser extends JsonOutputParser {

    public SemgrepJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.SEMGREP_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        for (JsonNode result : requireArray(root, "results")) {
            JsonNode extra = result.path("extra");
            issues.add(new ParsedIssue(
                    text(result, "path"),
                    intValue(result.path("start"), "line"),
                    text(extra, "severity"),
                    text(extra, "message"),
                    text(result, "check_id")));
        }
    }
}

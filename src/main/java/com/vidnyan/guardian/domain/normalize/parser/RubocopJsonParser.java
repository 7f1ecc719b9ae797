package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.List;

public class RubocopJsonParser extends JsonOutputParser {

    public RubocopJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.RUBOCOP_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        for (JsonNode file : requireArray(root, "files")) {
            String path = text(file, "path");
            for (JsonNode offense : file.path("offenses")) {
                JsonNode location = offense.path("location");
                Integer line = intValue(location, "start_line");
                if (line == null) {
                    line = intValue(location, "line");
                }
                issues.add(new ParsedIssue(path, line, text(offense, "severity"),
                        text(offense, "message"), text(offense, "cop_name")));
            }
        }
    }
}

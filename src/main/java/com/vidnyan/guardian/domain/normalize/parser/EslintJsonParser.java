package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.error.OutputParseException;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.List;

/**
 * ESLint {@code -f json}: one entry per file. Native levels are {@code 1} (warn),
 * {@code 2} (error) and {@code fatal} for files ESLint could not parse.
 */
public class EslintJsonParser extends JsonOutputParser {

    public EslintJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.ESLINT_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        if (!root.isArray()) {
            throw new OutputParseException("ESLINT_JSON: expected a top-level array");
        }
        for (JsonNode file : root) {
            String path = text(file, "filePath");
            for (JsonNode message : file.path("messages")) {
                String level = message.path("fatal").asBoolean(false) ? "fatal" : text(message, "severity");
                issues.add(new ParsedIssue(path, intValue(message, "line"), level,
                        text(message, "message"), text(message, "ruleId")));
            }
        }
    }
}

package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.error.OutputParseException;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * PHP_CodeSniffer {@code --report=json}: files keyed by path. Native level is the
 * message type, {@code ERROR} or {@code WARNING}.
 */
public class PhpcsJsonParser extends JsonOutputParser {

    public PhpcsJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.PHPCS_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        JsonNode files = root.path("files");
        if (!files.isObject()) {
            throw new OutputParseException("PHPCS_JSON: expected object 'files'");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = files.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            for (JsonNode message : entry.getValue().path("messages")) {
                issues.add(new ParsedIssue(entry.getKey(), intValue(message, "line"), text(message, "type"),
                        text(message, "message"), text(message, "source")));
            }
        }
    }
}

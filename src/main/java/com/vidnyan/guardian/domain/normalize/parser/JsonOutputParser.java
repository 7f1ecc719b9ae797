package com.vidnyan.guardian.domain.normalize.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.RawOutput;
import com.vidnyan.guardian.domain.error.OutputParseException;
import com.vidnyan.guardian.domain.normalize.OutputParser;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for parsers of JSON documents printed on stdout.
 */
public abstract class JsonOutputParser implements OutputParser {

    protected final ObjectMapper objectMapper;

    protected JsonOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public final List<ParsedIssue> parse(RawOutput output, AnalyzerSpec spec) {
        String text = output.stdout().trim();
        if (text.isEmpty()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new OutputParseException(format() + ": not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new OutputParseException(format() + ": empty document");
        }
        List<ParsedIssue> issues = new ArrayList<>();
        read(root, spec, issues);
        return issues;
    }

    /**
     * Read issues from a parsed document into {@code issues}.
     */
    protected abstract void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues);

    protected JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isArray()) {
            throw new OutputParseException(format() + ": expected array '" + field + "'");
        }
        return value;
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    protected static Integer intValue(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isInt() || value.isLong()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

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
import java.util.Set;

/**
 * Best-effort parser for JSON reports without a dedicated parser.
 *
 * <p>Walks the document and treats every object carrying a message-like field plus a
 * file, line or rule field as one issue. Containers of passed or skipped checks are
 * not descended into.
 */
public class GenericJsonParser extends JsonOutputParser {

    private static final List<String> MESSAGE_FIELDS =
            List.of("message", "description", "check_name", "title", "summary", "text", "issue_text");
    private static final List<String> FILE_FIELDS =
            List.of("file", "filename", "file_path", "filePath", "path", "sourcepath", "target");
    private static final List<String> LINE_FIELDS =
            List.of("line", "line_number", "lineNumber", "beginline", "start_line", "startLine");
    private static final List<String> RULE_FIELDS =
            List.of("rule_id", "ruleId", "check_id", "rule", "code", "id");
    private static final List<String> LEVEL_FIELDS =
            List.of("severity", "level", "priority", "rank", "issue_severity");
    private static final Set<String> IGNORED_CONTAINERS =
            Set.of("passed_checks", "skipped_checks", "passed", "skipped", "summary", "parsing_errors", "metadata");

    public GenericJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.GENERIC_JSON;
    }

    @Override
    protected void read(JsonNode root, AnalyzerSpec spec, List<ParsedIssue> issues) {
        if (!root.isContainerNode()) {
            throw new OutputParseException("GENERIC_JSON: expected an object or array");
        }
        walk(root, issues);
    }

    private void walk(JsonNode node, List<ParsedIssue> issues) {
        if (node.isArray()) {
            node.forEach(child -> walk(child, issues));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (looksLikeIssue(node)) {
            issues.add(toIssue(node));
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!IGNORED_CONTAINERS.contains(field.getKey()) && field.getValue().isContainerNode()) {
                walk(field.getValue(), issues);
            }
        }
    }

    private boolean looksLikeIssue(JsonNode node) {
        boolean hasMessage = first(node, MESSAGE_FIELDS) != null;
        return hasMessage && (first(node, FILE_FIELDS) != null
                || line(node) != null
                || first(node, RULE_FIELDS) != null);
    }

    private ParsedIssue toIssue(JsonNode node) {
        return new ParsedIssue(first(node, FILE_FIELDS), line(node), first(node, LEVEL_FIELDS),
                first(node, MESSAGE_FIELDS), first(node, RULE_FIELDS));
    }

    private static Integer line(JsonNode node) {
        for (String field : LINE_FIELDS) {
            Integer value = intValue(node, field);
            if (value != null) {
                return value;
            }
        }
        Integer nested = intValue(node.path("start"), "line");
        if (nested != null) {
            return nested;
        }
        JsonNode range = node.path("file_line_range");
        return range.isArray() && range.size() > 0 && range.get(0).canConvertToInt() ? range.get(0).asInt() : null;
    }

    private static String first(JsonNode node, List<String> fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
            if (value.isNumber()) {
                return value.asText();
            }
        }
        return null;
    }
}

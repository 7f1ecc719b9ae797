package com.vidnyan.guardian.adapter.out.sink;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders any JSON document as a nested Markdown bullet list.
 */
public final class MarkdownRenderer {

    private MarkdownRenderer() {
    }

    public static String document(String title, String sourceName, JsonNode root) {
        List<String> lines = new ArrayList<>();
        lines.add("# " + title);
        lines.add("");
        lines.add("**Source file:** `" + sourceName + "`");
        lines.add("");
        lines.add("---");
        lines.add("");
        render(root, 0, lines);
        return String.join("\n", lines) + "\n";
    }

    static void render(JsonNode value, int indent, List<String> lines) {
        String pad = "  ".repeat(indent);
        if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                lines.add(pad + "- **" + field.getKey() + "**:");
                render(field.getValue(), indent + 1, lines);
            }
        } else if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                lines.add(pad + "- item " + (i + 1) + ":");
                render(value.get(i), indent + 1, lines);
            }
        } else {
            lines.add(pad + "- " + (value.isNull() ? "null" : value.asText()));
        }
    }
}

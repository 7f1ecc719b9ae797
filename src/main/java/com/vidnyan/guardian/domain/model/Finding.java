package com.vidnyan.guardian.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A single normalized issue reported by an analyzer.
 * Immutable value object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
    @JsonProperty("tool") String tool,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("file") String file,
    @JsonProperty("line") Integer line,
    @JsonProperty("message") String message,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("raw") boolean raw,
    @JsonProperty("corroborated_by") List<String> corroboratedBy
) {

    public static final String RAW_RULE_ID = "raw";

    public Finding {
        Objects.requireNonNull(tool, "tool");
        severity = severity != null ? severity : Severity.INFO;
        message = message != null ? message : "";
        corroboratedBy = corroboratedBy != null ? List.copyOf(new TreeSet<>(corroboratedBy)) : List.of();
    }

    /**
     * Verbatim tool output preserved when it could not be parsed.
     */
    public static Finding raw(String tool, String output) {
        return new Finding(tool, Severity.INFO, null, null, output, RAW_RULE_ID, true, List.of());
    }

    public Finding withCorroboratedBy(List<String> tools) {
        return new Finding(tool, severity, file, line, message, ruleId, raw, tools);
    }

    @JsonIgnore
    public String location() {
        if (file == null) {
            return "<" + tool + " output>";
        }
        return line == null ? file : file + ":" + line;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String tool;
        private Severity severity = Severity.INFO;
        private String file;
        private Integer line;
        private String message;
        private String ruleId;
        private List<String> corroboratedBy = List.of();

        public Builder tool(String tool) { this.tool = tool; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder ruleId(String ruleId) { this.ruleId = ruleId; return this; }
        public Builder corroboratedBy(List<String> tools) { this.corroboratedBy = tools; return this; }

        public Finding build() {
            return new Finding(tool, severity, file, line, message, ruleId, false, corroboratedBy);
        }
    }
}

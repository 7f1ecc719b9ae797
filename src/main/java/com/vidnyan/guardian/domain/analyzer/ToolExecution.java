package com.vidnyan.guardian.domain.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution status record for one analyzer in a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolExecution(
    @JsonProperty("tool") String toolId,
    @JsonProperty("name") String toolName,
    @JsonProperty("ecosystem") String ecosystem,
    @JsonProperty("status") ExecutionStatus status,
    @JsonProperty("failure") FailureKind failure,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("finding_count") int findingCount,
    @JsonProperty("detail") String detail
) {

    public static ToolExecution success(AnalyzerSpec spec, int exitCode, long durationMs, int findings) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.SUCCESS,
                null, exitCode, durationMs, findings, null);
    }

    public static ToolExecution unparsed(AnalyzerSpec spec, int exitCode, long durationMs, String reason) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.SUCCESS,
                FailureKind.PARSE_ERROR, exitCode, durationMs, 1, reason);
    }

    public static ToolExecution skipped(AnalyzerSpec spec, String reason) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.SKIPPED,
                FailureKind.TOOL_UNAVAILABLE, null, 0, 0, reason);
    }

    public static ToolExecution timeout(AnalyzerSpec spec, long durationMs, String reason) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.TIMEOUT,
                FailureKind.TOOL_TIMEOUT, null, durationMs, 0, reason);
    }

    public static ToolExecution crashed(AnalyzerSpec spec, Integer exitCode, long durationMs, String reason) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.ERROR,
                FailureKind.TOOL_CRASH, exitCode, durationMs, 0, reason);
    }

    /**
     * Line output cut at the capture limit: the findings read before the cut are kept.
     */
    public static ToolExecution partial(AnalyzerSpec spec, int exitCode, long durationMs, int findings, String reason) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.SUCCESS,
                FailureKind.OUTPUT_TRUNCATED, exitCode, durationMs, findings, reason);
    }

    /**
     * Structured output cut at the capture limit; nothing in it can be trusted.
     */
    public static ToolExecution truncated(AnalyzerSpec spec, int exitCode, long durationMs, String reason) {
        return new ToolExecution(spec.id(), spec.name(), spec.ecosystem(), ExecutionStatus.ERROR,
                FailureKind.OUTPUT_TRUNCATED, exitCode, durationMs, 0, reason);
    }

    @JsonIgnore
    public boolean isTruncated() {
        return failure == FailureKind.OUTPUT_TRUNCATED;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}

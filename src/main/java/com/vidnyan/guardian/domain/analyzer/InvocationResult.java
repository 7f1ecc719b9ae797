package com.vidnyan.guardian.domain.analyzer;

import java.time.Duration;

/**
 * What the runner observed for one invocation. Output is present only for
 * processes that completed within their timeout.
 */
public record InvocationResult(
    Invocation invocation,
    ExecutionStatus status,
    FailureKind failure,
    RawOutput output,
    Duration duration,
    String detail
) {

    public static InvocationResult completed(Invocation invocation, RawOutput output, Duration duration) {
        return new InvocationResult(invocation, ExecutionStatus.SUCCESS, null, output, duration, null);
    }

    public static InvocationResult timedOut(Invocation invocation, Duration duration, String detail) {
        return new InvocationResult(invocation, ExecutionStatus.TIMEOUT, FailureKind.TOOL_TIMEOUT,
                null, duration, detail);
    }

    public static InvocationResult unavailable(Invocation invocation, String detail) {
        return new InvocationResult(invocation, ExecutionStatus.SKIPPED, FailureKind.TOOL_UNAVAILABLE,
                null, Duration.ZERO, detail);
    }

    public static InvocationResult error(Invocation invocation, Duration duration, String detail) {
        return new InvocationResult(invocation, ExecutionStatus.ERROR, FailureKind.TOOL_CRASH,
                null, duration, detail);
    }

    public boolean hasOutput() {
        return output != null;
    }
}

package com.vidnyan.guardian.domain.analyzer;

/**
 * Why an invocation did not produce a clean set of findings.
 */
public enum FailureKind {
    /** Binary not installed, or the process could not be spawned. */
    TOOL_UNAVAILABLE,
    /** Invocation or run deadline elapsed; output discarded. */
    TOOL_TIMEOUT,
    /** Nonzero exit without parseable output; output discarded. */
    TOOL_CRASH,
    /** Output kept verbatim as a raw finding. */
    PARSE_ERROR,
    /** Output hit the capture limit; findings are partial or, for structured formats, dropped. */
    OUTPUT_TRUNCATED
}

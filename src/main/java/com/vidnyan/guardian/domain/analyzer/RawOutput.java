package com.vidnyan.guardian.domain.analyzer;

/**
 * Captured output of a process that ran to completion.
 */
public record RawOutput(
    int exitCode,
    String stdout,
    String stderr,
    boolean truncated
) {

    public RawOutput {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    /**
     * Stdout, or stderr when stdout is blank. Some tools report on stderr only.
     */
    public String primaryText() {
        return stdout.isBlank() ? stderr : stdout;
    }
}

package com.vidnyan.guardian.domain.runner;

import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.error.ToolUnavailableException;

import java.time.Duration;

/**
 * Runs one invocation as an external process.
 * Implementations must destroy the process when the calling thread is interrupted.
 */
public interface CommandExecutor {

    /**
     * Execute and wait for the process, at most {@code timeout}.
     *
     * @throws ToolUnavailableException if the process cannot be spawned
     */
    CommandResult execute(Invocation invocation, Duration timeout);

    /**
     * Outcome of one process. Output is empty when the process timed out or was cancelled.
     */
    record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean cancelled,
        boolean truncated,
        Duration elapsed
    ) {

        public static CommandResult finished(int exitCode, String stdout, String stderr,
                                             boolean truncated, Duration elapsed) {
            return new CommandResult(exitCode, stdout, stderr, false, false, truncated, elapsed);
        }

        public static CommandResult timedOut(Duration elapsed) {
            return new CommandResult(-1, "", "", true, false, false, elapsed);
        }

        public static CommandResult cancelled(Duration elapsed) {
            return new CommandResult(-1, "", "", false, true, false, elapsed);
        }
    }
}

package com.vidnyan.guardian.domain.error;

/**
 * An analyzer binary is missing or could not be spawned.
 */
public class ToolUnavailableException extends GuardianException {

    private final String executable;

    public ToolUnavailableException(String executable, Throwable cause) {
        super("Cannot start '" + executable + "': " + (cause != null ? cause.getMessage() : "not found"), cause);
        this.executable = executable;
    }

    public String getExecutable() {
        return executable;
    }
}

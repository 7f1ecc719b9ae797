package com.vidnyan.guardian.domain.error;

/**
 * A result sink failed to deliver the report. Surfaced to the caller; the analysis itself
 * still counts as completed.
 */
public class SinkException extends GuardianException {

    private final String sink;

    public SinkException(String sink, String message, Throwable cause) {
        super(message, cause);
        this.sink = sink;
    }

    public String getSink() {
        return sink;
    }
}

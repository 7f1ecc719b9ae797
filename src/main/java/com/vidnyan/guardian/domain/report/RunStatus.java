package com.vidnyan.guardian.domain.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall outcome of a run.
 */
public enum RunStatus {
    COMPLETED,
    COMPLETED_WITH_SKIPS,
    ABORTED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}

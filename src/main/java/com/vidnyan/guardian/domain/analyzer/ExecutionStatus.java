package com.vidnyan.guardian.domain.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStatus {
    SUCCESS,
    TIMEOUT,
    ERROR,
    SKIPPED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.vidnyan.guardian.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a run was triggered: against a pull request diff, or a manual full scan.
 */
public enum RunMode {
    PR,
    MANUAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunMode fromId(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pr", "pull_request", "pull-request" -> PR;
            case "manual", "scan" -> MANUAL;
            default -> throw new IllegalArgumentException("Unknown run mode: " + value);
        };
    }
}

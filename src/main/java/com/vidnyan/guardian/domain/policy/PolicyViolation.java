package com.vidnyan.guardian.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One exceeded limit: what was measured and the limit it broke.
 */
public record PolicyViolation(
    @JsonProperty("subject") String subject,
    @JsonProperty("observed") String observed,
    @JsonProperty("threshold") String threshold
) {

    public static final String RISK_SCORE = "risk_score";
    public static final String RISK_LEVEL = "risk_level";
}

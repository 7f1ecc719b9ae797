package com.vidnyan.guardian.domain.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Free text attached by the summarizer.
 */
public record Narrative(
    @JsonProperty("summary") String summary,
    @JsonProperty("detail") String detail
) {

    public static final String PLACEHOLDER = "Summary unavailable; see the structured findings.";

    public static Narrative placeholder() {
        return new Narrative(PLACEHOLDER, "");
    }
}

package com.vidnyan.guardian.domain.score;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.guardian.domain.model.Severity;

/**
 * One line of the score breakdown. The points of all factors add up to the score.
 */
public record ScoreFactor(
    @JsonProperty("factor") String factor,
    @JsonProperty("count") long count,
    @JsonProperty("points") long points
) {

    public static final String SEVERITY_CAP = "severity_cap";
    public static final String CI_CONFIG_CHANGED = "ci_config_changed";
    public static final String DEPENDENCY_MANIFEST_CHANGED = "dependency_manifest_changed";
    public static final String LARGE_DIFF = "large_diff";
    public static final String CLEAN_WITH_TESTS = "clean_with_tests";
    public static final String CLAMP = "clamp";
    public static final String TOOLS_SKIPPED = "tools_skipped";
    public static final String TOOLS_TIMED_OUT = "tools_timed_out";
    public static final String TOOLS_FAILED = "tools_failed";
    public static final String UNPARSED_OUTPUTS = "unparsed_outputs";

    public static String severityFactor(Severity severity) {
        return severity.id() + "_findings";
    }
}

package com.vidnyan.guardian.domain.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Gate applied to a finished run. Every limit is optional.
 *
 * @param maxRiskScore    highest acceptable score, {@code null} for no limit
 * @param blockOnHighRisk fail whenever the risk level is high
 * @param tools           per-tool finding thresholds keyed by tool id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompliancePolicy(
    Integer maxRiskScore,
    boolean blockOnHighRisk,
    Map<String, ToolThreshold> tools
) {

    public CompliancePolicy {
        tools = tools != null ? Map.copyOf(tools) : Map.of();
    }

    /**
     * Policy with no limits; every run passes.
     */
    public static CompliancePolicy permissive() {
        return new CompliancePolicy(null, false, Map.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToolThreshold(int threshold) {
    }
}

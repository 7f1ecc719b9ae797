package com.vidnyan.guardian.domain.score;

import com.vidnyan.guardian.domain.model.Severity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable numbers behind deduplication and scoring.
 */
public record ScoringPolicy(
    Map<Severity, Integer> weights,
    int severityCap,
    int ciChangePoints,
    int dependencyChangePoints,
    int largeDiffLines,
    int largeDiffPoints,
    int cleanWithTestsPoints,
    int lineTolerance,
    double similarityThreshold,
    int lowMax,
    int mediumMax
) {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public ScoringPolicy {
        EnumMap<Severity, Integer> complete = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            int weight = weights != null ? weights.getOrDefault(severity, 0) : 0;
            if (weight < 0) {
                throw new IllegalArgumentException("Severity weight must not be negative: " + severity);
            }
            complete.put(severity, weight);
        }
        weights = Map.copyOf(complete);
        if (similarityThreshold < 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("similarityThreshold must be within [0,1]");
        }
        if (lowMax >= mediumMax) {
            throw new IllegalArgumentException("lowMax must be below mediumMax");
        }
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(
                Map.of(Severity.CRITICAL, 25, Severity.HIGH, 10, Severity.MEDIUM, 3, Severity.LOW, 1, Severity.INFO, 0),
                100, 5, 5, 500, 5, -5, 2, 0.8, 29, 59);
    }

    public int weight(Severity severity) {
        return weights.get(severity);
    }

    public RiskLevel levelFor(int score) {
        if (score <= lowMax) {
            return RiskLevel.LOW;
        }
        return score <= mediumMax ? RiskLevel.MEDIUM : RiskLevel.HIGH;
    }
}

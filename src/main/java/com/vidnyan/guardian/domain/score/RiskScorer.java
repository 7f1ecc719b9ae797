package com.vidnyan.guardian.domain.score;

import com.vidnyan.guardian.domain.analyzer.ExecutionStatus;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.ContextSignals;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Computes the 0–100 risk score with a breakdown that accounts for every point.
 *
 * <p>Base score is the weighted severity sum capped at {@link ScoringPolicy#severityCap()}.
 * Contextual modifiers are added on top and the total is clamped to [0,100]. Cap and clamp
 * appear as factors of their own, so the points of the breakdown always sum to the score.
 */
@Slf4j
public class RiskScorer {

    private final ScoringPolicy policy;

    public RiskScorer(ScoringPolicy policy) {
        this.policy = policy;
    }

    public AggregateResult score(List<Finding> findings, List<ToolExecution> executions, ContextSignals signals) {
        List<ScoreFactor> breakdown = new ArrayList<>();

        long base = 0;
        Map<Severity, Integer> counts = AggregateResult.countBySeverity(findings);
        for (Severity severity : descending()) {
            int count = counts.get(severity);
            if (count > 0) {
                long points = (long) count * policy.weight(severity);
                breakdown.add(new ScoreFactor(ScoreFactor.severityFactor(severity), count, points));
                base += points;
            }
        }
        if (base > policy.severityCap()) {
            breakdown.add(new ScoreFactor(ScoreFactor.SEVERITY_CAP, 1, policy.severityCap() - base));
            base = policy.severityCap();
        }

        long total = base + modifiers(findings, signals, breakdown);

        long clamped = Math.max(ScoringPolicy.MIN_SCORE, Math.min(ScoringPolicy.MAX_SCORE, total));
        if (clamped != total) {
            breakdown.add(new ScoreFactor(ScoreFactor.CLAMP, 1, clamped - total));
        }

        breakdown.add(statusFactor(ScoreFactor.TOOLS_SKIPPED, executions, ExecutionStatus.SKIPPED));
        breakdown.add(statusFactor(ScoreFactor.TOOLS_TIMED_OUT, executions, ExecutionStatus.TIMEOUT));
        breakdown.add(statusFactor(ScoreFactor.TOOLS_FAILED, executions, ExecutionStatus.ERROR));
        breakdown.add(new ScoreFactor(ScoreFactor.UNPARSED_OUTPUTS, findings.stream().filter(Finding::raw).count(), 0));

        int score = (int) clamped;
        RiskLevel level = policy.levelFor(score);
        log.info("Risk score {} ({}) from {} findings", score, level.id(), findings.size());
        return new AggregateResult(findings, executions, score, level, breakdown);
    }

    private long modifiers(List<Finding> findings, ContextSignals signals, List<ScoreFactor> breakdown) {
        if (!signals.analyzed()) {
            return 0;
        }
        long delta = 0;
        if (signals.ciConfigChanged()) {
            breakdown.add(new ScoreFactor(ScoreFactor.CI_CONFIG_CHANGED, 1, policy.ciChangePoints()));
            delta += policy.ciChangePoints();
        }
        if (signals.dependencyManifestChanged()) {
            breakdown.add(new ScoreFactor(ScoreFactor.DEPENDENCY_MANIFEST_CHANGED, 1, policy.dependencyChangePoints()));
            delta += policy.dependencyChangePoints();
        }
        if (policy.largeDiffLines() > 0 && signals.diffLines() > policy.largeDiffLines()) {
            breakdown.add(new ScoreFactor(ScoreFactor.LARGE_DIFF, signals.diffLines(), policy.largeDiffPoints()));
            delta += policy.largeDiffPoints();
        }
        if (findings.isEmpty() && signals.testsPresent()) {
            breakdown.add(new ScoreFactor(ScoreFactor.CLEAN_WITH_TESTS, 1, policy.cleanWithTestsPoints()));
            delta += policy.cleanWithTestsPoints();
        }
        return delta;
    }

    private static ScoreFactor statusFactor(String factor, List<ToolExecution> executions, ExecutionStatus status) {
        return new ScoreFactor(factor, executions.stream().filter(e -> e.status() == status).count(), 0);
    }

    private static List<Severity> descending() {
        List<Severity> order = new ArrayList<>(List.of(Severity.values()));
        Collections.reverse(order);
        return order;
    }
}

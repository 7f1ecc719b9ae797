package com.vidnyan.guardian.domain.policy;

import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.score.AggregateResult;
import com.vidnyan.guardian.domain.score.RiskLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks an aggregate result against a {@link CompliancePolicy}.
 *
 * <p>A tool's finding count includes findings it corroborated, so merging duplicates does
 * not hide them from the tool's threshold.
 */
@Slf4j
public class PolicyEvaluator {

    public ComplianceReport evaluate(CompliancePolicy policy, AggregateResult result) {
        List<PolicyViolation> violations = new ArrayList<>();

        Map<String, Integer> perTool = findingsPerTool(result.findings());
        new TreeMap<>(policy.tools()).forEach((tool, limit) -> {
            int observed = perTool.getOrDefault(tool, 0);
            if (observed > limit.threshold()) {
                violations.add(new PolicyViolation(tool, String.valueOf(observed), String.valueOf(limit.threshold())));
            }
        });

        if (policy.maxRiskScore() != null && result.riskScore() > policy.maxRiskScore()) {
            violations.add(new PolicyViolation(PolicyViolation.RISK_SCORE,
                    String.valueOf(result.riskScore()), String.valueOf(policy.maxRiskScore())));
        }

        if (policy.blockOnHighRisk() && result.riskLevel() == RiskLevel.HIGH) {
            violations.add(new PolicyViolation(PolicyViolation.RISK_LEVEL,
                    result.riskLevel().id(), RiskLevel.MEDIUM.id()));
        }

        ComplianceReport report = ComplianceReport.of(violations);
        if (!report.isPassing()) {
            log.warn("Compliance check failed with {} violations", violations.size());
            violations.forEach(v -> log.warn("  - {}: {} (threshold {})", v.subject(), v.observed(), v.threshold()));
        }
        return report;
    }

    static Map<String, Integer> findingsPerTool(List<Finding> findings) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Finding finding : findings) {
            counts.merge(finding.tool(), 1, Integer::sum);
            finding.corroboratedBy().forEach(tool -> counts.merge(tool, 1, Integer::sum));
        }
        return counts;
    }
}

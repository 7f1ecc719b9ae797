package com.vidnyan.guardian.adapter.out.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.application.port.out.ResultSink;
import com.vidnyan.guardian.config.GuardianProperties;
import com.vidnyan.guardian.domain.error.SinkException;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.policy.PolicyViolation;
import com.vidnyan.guardian.domain.report.GuardianReport;
import com.vidnyan.guardian.domain.report.ReportSummary;
import com.vidnyan.guardian.domain.score.ScoreFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Posts two comments on the pull request: repository health (summary and detail) and
 * risk (score, breakdown, compliance). Active only in PR mode with a token, repository
 * and PR number configured.
 */
@Slf4j
@Component
@Order(2)
public class PullRequestCommentSink implements ResultSink {

    private final GitHubCommentClient client;
    private final Integer prNumber;

    @Autowired
    public PullRequestCommentSink(ObjectMapper objectMapper, GuardianProperties properties) {
        this(createClient(objectMapper, properties.getSink().getGithub()), properties.getSink().getGithub().getPrNumber());
    }

    public PullRequestCommentSink(GitHubCommentClient client, Integer prNumber) {
        this.client = client;
        this.prNumber = prNumber;
    }

    private static GitHubCommentClient createClient(ObjectMapper objectMapper, GuardianProperties.GitHub github) {
        if (github.getToken().isBlank() || github.getRepository().isBlank()) {
            return null;
        }
        return new GitHubCommentClient(GitHubCommentClient.defaultHttpClient(), objectMapper,
                github.getApiUrl(), github.getToken(), github.getRepository());
    }

    @Override
    public String name() {
        return "pull-request-comments";
    }

    @Override
    public boolean supports(RunMode mode) {
        return mode == RunMode.PR && client != null && prNumber != null;
    }

    @Override
    public void publish(GuardianReport report, RunMode mode) {
        try {
            client.postIssueComment(prNumber, healthComment(report));
            client.postIssueComment(prNumber, riskComment(report));
            log.info("Posted review comments on PR #{}", prNumber);
        } catch (IOException e) {
            throw new SinkException(name(), "Failed to comment on PR #" + prNumber + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkException(name(), "Interrupted while commenting on PR #" + prNumber, e);
        }
    }

    static String healthComment(GuardianReport report) {
        StringBuilder body = new StringBuilder();
        body.append("## Repository Health\n\n");
        body.append(report.narrative().summary()).append("\n\n");
        if (!report.narrative().detail().isBlank()) {
            body.append("<details><summary>Details</summary>\n\n")
                    .append(report.narrative().detail())
                    .append("\n</details>\n\n");
        }
        body.append("Full analysis available as workflow artifacts.\n");
        return body.toString();
    }

    static String riskComment(GuardianReport report) {
        ReportSummary summary = report.summary();
        StringBuilder body = new StringBuilder();
        body.append("## GenOps Guardian Risk\n\n");
        body.append("**Risk Score:** ").append(summary.riskScore())
                .append(" (").append(summary.riskLevel().id()).append(")\n");
        body.append("**Status:** ").append(summary.status().id()).append("\n");
        body.append("**Compliance:** ").append(report.compliance().status().id()).append("\n\n");

        body.append("### Top Issues\n");
        if (summary.topIssues().isEmpty()) {
            body.append("- None\n");
        }
        for (Finding finding : summary.topIssues()) {
            body.append("- **").append(finding.severity().id()).append("** `").append(finding.location())
                    .append("` ").append(finding.message().lines().findFirst().orElse(""))
                    .append(" (").append(finding.tool()).append(")\n");
        }

        body.append("\n### Score Breakdown\n\n| factor | count | points |\n|---|---|---|\n");
        for (ScoreFactor factor : report.detail().breakdown()) {
            body.append("| ").append(factor.factor()).append(" | ").append(factor.count())
                    .append(" | ").append(factor.points()).append(" |\n");
        }

        if (!report.compliance().violations().isEmpty()) {
            body.append("\n### Policy Violations\n");
            for (PolicyViolation violation : report.compliance().violations()) {
                body.append("- ").append(violation.subject()).append(": ").append(violation.observed())
                        .append(" (threshold ").append(violation.threshold()).append(")\n");
            }
        }
        return body.toString();
    }
}

package com.vidnyan.guardian.adapter.in.cli;

import com.vidnyan.guardian.application.port.in.AnalyzeRepositoryUseCase;
import com.vidnyan.guardian.application.port.in.AnalyzeRepositoryUseCase.AnalysisOutcome;
import com.vidnyan.guardian.application.port.in.AnalyzeRepositoryUseCase.AnalysisRequest;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GuardianReport;
import com.vidnyan.guardian.domain.report.ReportSummary;
import com.vidnyan.guardian.domain.report.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * CLI Runner for a one-shot analysis.
 * Runs when {@code guardian.run.repository} is set and maps the run status to the exit code:
 * 0 completed, 1 compliance failure, 2 aborted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_POLICY_FAILED = 1;
    static final int EXIT_ABORTED = 2;

    private final AnalyzeRepositoryUseCase analyzeRepositoryUseCase;
    private final ConfigurableApplicationContext context;

    @Value("${guardian.run.repository:}")
    private String repository;

    @Value("${guardian.run.mode:manual}")
    private String mode;

    @Value("${guardian.run.diff-file:}")
    private String diffFile;

    @Value("${guardian.run.changed-files:}")
    private String changedFiles;

    @Value("${guardian.run.exit-on-complete:true}")
    private boolean exitOnComplete;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) throws Exception {
        if (repository == null || repository.isBlank()) {
            log.info("No repository specified. Set guardian.run.repository to analyze one.");
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           GenOps Guardian - Static Analysis Risk              ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Analyzing: {} ({})", truncatePath(repository, 44), mode);
        log.info("╚══════════════════════════════════════════════════════════════╝");

        AnalysisRequest request = new AnalysisRequest(Path.of(repository), RunMode.fromId(mode),
                parseList(changedFiles), readPatch());
        AnalysisOutcome outcome = analyzeRepositoryUseCase.analyze(request);

        printResults(outcome);
        exitCode = exitCodeFor(outcome);

        if (exitOnComplete) {
            System.exit(SpringApplication.exit(context, this));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(AnalysisOutcome outcome) {
        if (outcome.status() == RunStatus.ABORTED) {
            return EXIT_ABORTED;
        }
        return outcome.report().compliance().isPassing() ? EXIT_OK : EXIT_POLICY_FAILED;
    }

    private String readPatch() {
        if (diffFile == null || diffFile.isBlank()) {
            return "";
        }
        try {
            return Files.readString(Path.of(diffFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read diff file " + diffFile, e);
        }
    }

    static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split("[,\\n]"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private void printResults(AnalysisOutcome outcome) {
        GuardianReport report = outcome.report();
        ReportSummary summary = report.summary();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Status:      {}", summary.status().id());
        log.info(" Risk score:  {} ({})", summary.riskScore(), summary.riskLevel().id());
        log.info(" Compliance:  {}", report.compliance().status().id());
        log.info("───────────────────────────────────────────────────────────────");
        summary.counts().forEach((severity, count) -> log.info("   {}: {}", severity, count));
        log.info("═══════════════════════════════════════════════════════════════");

        if (outcome.isAborted()) {
            log.error(" {}", report.narrative().summary());
            return;
        }

        for (ToolExecution execution : report.detail().executions()) {
            if (!execution.isSuccess()) {
                log.warn(" {} {}: {}", execution.status().id().toUpperCase(), execution.toolId(), execution.detail());
            }
        }

        if (!summary.topIssues().isEmpty()) {
            log.info("");
            log.info(" TOP ISSUES:");
            for (Finding finding : summary.topIssues()) {
                log.info("   [{}] {} {} ({})", finding.severity().id(), finding.location(),
                        finding.message().lines().findFirst().orElse(""), finding.tool());
            }
        }

        log.info("");
        log.info(" {}", report.narrative().summary());
        outcome.warnings().forEach(w -> log.warn(" Warning: {}", w));
        outcome.sinkErrors().forEach(e -> log.error(" Sink error: {}", e));
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}

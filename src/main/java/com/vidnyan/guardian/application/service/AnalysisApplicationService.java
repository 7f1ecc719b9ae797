package com.vidnyan.guardian.application.service;

import com.vidnyan.guardian.application.port.in.AnalyzeRepositoryUseCase;
import com.vidnyan.guardian.application.port.out.PolicyRepository;
import com.vidnyan.guardian.application.port.out.ResultSink;
import com.vidnyan.guardian.application.port.out.Summarizer;
import com.vidnyan.guardian.application.port.out.ToolLocator;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.InvocationResult;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.detect.ContextSignalExtractor;
import com.vidnyan.guardian.domain.detect.EcosystemDetector;
import com.vidnyan.guardian.domain.detect.RepositoryScanner;
import com.vidnyan.guardian.domain.error.DetectionException;
import com.vidnyan.guardian.domain.error.SinkException;
import com.vidnyan.guardian.domain.model.ContextSignals;
import com.vidnyan.guardian.domain.model.Ecosystem;
import com.vidnyan.guardian.domain.model.Finding;
import com.vidnyan.guardian.domain.model.RepositoryContext;
import com.vidnyan.guardian.domain.normalize.FindingNormalizer;
import com.vidnyan.guardian.domain.policy.CompliancePolicy;
import com.vidnyan.guardian.domain.policy.ComplianceReport;
import com.vidnyan.guardian.domain.policy.PolicyEvaluator;
import com.vidnyan.guardian.domain.registry.ToolRegistry;
import com.vidnyan.guardian.domain.report.GuardianReport;
import com.vidnyan.guardian.domain.report.Narrative;
import com.vidnyan.guardian.domain.report.ReportBuilder;
import com.vidnyan.guardian.domain.report.RunProgress;
import com.vidnyan.guardian.domain.report.RunStage;
import com.vidnyan.guardian.domain.runner.AnalyzerRunner;
import com.vidnyan.guardian.domain.runner.InvocationPlanner;
import com.vidnyan.guardian.domain.score.AggregateResult;
import com.vidnyan.guardian.domain.score.FindingAggregator;
import com.vidnyan.guardian.domain.score.RiskScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application service that orchestrates a run.
 *
 * <p>Stages: detect, schedule, run, normalize, aggregate, report. Only detection can abort.
 * The summarizer and each supporting sink are called once, after the core has finished.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeRepositoryUseCase {

    public static final String SUMMARIZER_UNAVAILABLE = "SUMMARIZER_UNAVAILABLE";
    public static final String POLICY_UNAVAILABLE = "POLICY_UNAVAILABLE";
    public static final String OUTPUT_TRUNCATED = "OUTPUT_TRUNCATED";

    private final RepositoryScanner repositoryScanner;
    private final EcosystemDetector ecosystemDetector;
    private final ContextSignalExtractor contextSignalExtractor;
    private final ToolRegistry toolRegistry;
    private final ToolLocator toolLocator;
    private final InvocationPlanner invocationPlanner;
    private final AnalyzerRunner analyzerRunner;
    private final FindingNormalizer findingNormalizer;
    private final FindingAggregator findingAggregator;
    private final RiskScorer riskScorer;
    private final PolicyRepository policyRepository;
    private final PolicyEvaluator policyEvaluator;
    private final ReportBuilder reportBuilder;
    private final Summarizer summarizer;
    private final List<ResultSink> resultSinks;

    @Override
    public AnalysisOutcome analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        RunProgress progress = new RunProgress();
        List<String> warnings = new ArrayList<>();
        log.info("Starting {} analysis of: {}", request.mode().id(), request.repository());

        // Step 1: Detect
        RepositoryContext context;
        try {
            context = detect(request);
        } catch (DetectionException e) {
            progress.abort(e.getMessage());
            GuardianReport aborted = reportBuilder.aborted(e.getMessage());
            List<String> sinkErrors = publish(aborted, request);
            return new AnalysisOutcome(aborted, progress.history(), warnings, sinkErrors);
        }

        // Step 2: Schedule
        progress.advanceTo(RunStage.SCHEDULING);
        List<AnalyzerSpec> selected = toolRegistry.select(context.ecosystems());
        log.info("Selected {} analyzers for {}", selected.size(), context.ecosystemTags());
        InvocationPlanner.Schedule schedule = invocationPlanner.plan(context, selected, toolLocator::isAvailable);

        // Step 3: Run
        progress.advanceTo(RunStage.RUNNING);
        List<InvocationResult> results = analyzerRunner.run(schedule.invocations());

        // Step 4: Normalize
        progress.advanceTo(RunStage.NORMALIZING);
        List<Finding> findings = new ArrayList<>();
        List<ToolExecution> executions = new ArrayList<>(schedule.skipped());
        for (InvocationResult result : results) {
            FindingNormalizer.Normalized normalized = findingNormalizer.normalize(result);
            findings.addAll(normalized.findings());
            executions.add(normalized.execution());
            if (normalized.execution().isTruncated()) {
                warnings.add(OUTPUT_TRUNCATED + ": " + normalized.execution().toolId());
            }
        }

        // Step 5: Aggregate and score
        progress.advanceTo(RunStage.AGGREGATING);
        List<Finding> deduplicated = findingAggregator.aggregate(findings);
        ContextSignals signals = contextSignalExtractor.extract(context);
        AggregateResult aggregate = riskScorer.score(deduplicated, executions, signals);
        ComplianceReport compliance = policyEvaluator.evaluate(loadPolicy(warnings), aggregate);

        // Step 6: Report
        progress.advanceTo(RunStage.REPORTING);
        GuardianReport report = reportBuilder.build(context, aggregate, compliance);
        report = report.withNarrative(summarize(report, request, warnings));
        List<String> sinkErrors = publish(report, request);

        progress.advanceTo(RunStage.DONE);
        log.info("Analysis complete: status {}, risk {} ({}), {} findings in {}ms",
                report.status().id(), aggregate.riskScore(), aggregate.riskLevel().id(),
                aggregate.findings().size(), Duration.between(startTime, Instant.now()).toMillis());
        return new AnalysisOutcome(report, progress.history(), warnings, sinkErrors);
    }

    private RepositoryContext detect(AnalysisRequest request) {
        List<String> files = repositoryScanner.scan(request.repository());
        RepositoryContext context = RepositoryContext.of(request.repository(), request.mode(),
                request.changedFiles(), files, request.patch());
        List<Ecosystem> ecosystems = ecosystemDetector.detect(request.repository(), files);
        log.info("Detected ecosystems: {}", ecosystems.stream().map(Ecosystem::tag).toList());
        return context.withEcosystems(ecosystems);
    }

    private CompliancePolicy loadPolicy(List<String> warnings) {
        try {
            return policyRepository.load();
        } catch (RuntimeException e) {
            log.warn("Compliance policy could not be loaded, evaluating without limits: {}", e.getMessage());
            warnings.add(POLICY_UNAVAILABLE + ": " + e.getMessage());
            return CompliancePolicy.permissive();
        }
    }

    private Narrative summarize(GuardianReport report, AnalysisRequest request, List<String> warnings) {
        try {
            Narrative narrative = summarizer.summarize(report, request.mode());
            if (narrative == null || narrative.summary() == null || narrative.summary().isBlank()) {
                throw new IllegalStateException("summarizer returned no text");
            }
            return narrative;
        } catch (RuntimeException e) {
            log.warn("Summarizer unavailable, using placeholder text: {}", e.getMessage());
            warnings.add(SUMMARIZER_UNAVAILABLE + ": " + e.getMessage());
            return Narrative.placeholder();
        }
    }

    private List<String> publish(GuardianReport report, AnalysisRequest request) {
        List<String> errors = new ArrayList<>();
        for (ResultSink sink : resultSinks) {
            if (!sink.supports(request.mode())) {
                continue;
            }
            try {
                sink.publish(report, request.mode());
                log.info("Published report via {}", sink.name());
            } catch (SinkException e) {
                log.error("Sink {} failed: {}", e.getSink(), e.getMessage(), e);
                errors.add(e.getSink() + ": " + e.getMessage());
            }
        }
        return errors;
    }
}

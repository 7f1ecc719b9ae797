package com.vidnyan.guardian.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.guardian.application.port.out.AnalyzerCatalog;
import com.vidnyan.guardian.domain.detect.ContextSignalExtractor;
import com.vidnyan.guardian.domain.detect.EcosystemDetector;
import com.vidnyan.guardian.domain.detect.RepositoryScanner;
import com.vidnyan.guardian.domain.model.Severity;
import com.vidnyan.guardian.domain.normalize.FindingNormalizer;
import com.vidnyan.guardian.domain.policy.PolicyEvaluator;
import com.vidnyan.guardian.domain.registry.ToolRegistry;
import com.vidnyan.guardian.domain.report.ReportBuilder;
import com.vidnyan.guardian.domain.runner.AnalyzerRunner;
import com.vidnyan.guardian.domain.runner.CommandExecutor;
import com.vidnyan.guardian.domain.runner.InvocationPlanner;
import com.vidnyan.guardian.domain.score.FindingAggregator;
import com.vidnyan.guardian.domain.score.RiskScorer;
import com.vidnyan.guardian.domain.score.ScoringPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Spring configuration for Guardian components.
 * Domain services are plain classes; they are wired here from {@link GuardianProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GuardianProperties.class)
public class GuardianConfiguration {

    /**
     * ObjectMapper for analyzer output, catalogs and persisted reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public RepositoryScanner repositoryScanner(GuardianProperties properties) {
        return new RepositoryScanner(properties.getDetector().getMaxDepth(),
                properties.getDetector().getExcludedDirectories());
    }

    @Bean
    public EcosystemDetector ecosystemDetector() {
        return new EcosystemDetector();
    }

    @Bean
    public ContextSignalExtractor contextSignalExtractor() {
        return new ContextSignalExtractor();
    }

    /**
     * Registry built from the catalog. Logs the registered analyzers on startup.
     */
    @Bean
    public ToolRegistry toolRegistry(AnalyzerCatalog catalog, GuardianProperties properties) {
        ToolRegistry.Builder builder = ToolRegistry.builder()
                .disabledTools(properties.getRegistry().getDisabledTools())
                .universalEnabled(properties.getRegistry().isUniversalEnabled());
        catalog.loadAll().forEach(builder::register);
        ToolRegistry registry = builder.build();
        log.info("Registered {} analyzers for ecosystems {}", registry.size(), registry.ecosystems());
        if (!properties.getRegistry().getDisabledTools().isEmpty()) {
            log.info("  Disabled: {}", properties.getRegistry().getDisabledTools());
        }
        return registry;
    }

    @Bean
    public InvocationPlanner invocationPlanner() {
        return new InvocationPlanner();
    }

    @Bean
    public AnalyzerRunner analyzerRunner(CommandExecutor commandExecutor, GuardianProperties properties) {
        return new AnalyzerRunner(commandExecutor, properties.getRunner().getMaxConcurrency(),
                properties.getRunner().getRunDeadline());
    }

    @Bean
    public FindingNormalizer findingNormalizer(ObjectMapper objectMapper) {
        return FindingNormalizer.standard(objectMapper);
    }

    @Bean
    public ScoringPolicy scoringPolicy(GuardianProperties properties) {
        GuardianProperties.Scoring scoring = properties.getScoring();
        Map<Severity, Integer> weights = new EnumMap<>(Severity.class);
        scoring.getWeights().forEach((name, weight) -> weights.put(
                Severity.parse(name).orElseThrow(() -> new IllegalArgumentException("Unknown severity weight: " + name)),
                weight));
        return new ScoringPolicy(weights, scoring.getSeverityCap(), scoring.getCiChangePoints(),
                scoring.getDependencyChangePoints(), scoring.getLargeDiffLines(), scoring.getLargeDiffPoints(),
                scoring.getCleanWithTestsPoints(), scoring.getLineTolerance(), scoring.getSimilarityThreshold(),
                scoring.getLowMax(), scoring.getMediumMax());
    }

    @Bean
    public FindingAggregator findingAggregator(ScoringPolicy scoringPolicy) {
        return new FindingAggregator(scoringPolicy.lineTolerance(), scoringPolicy.similarityThreshold());
    }

    @Bean
    public RiskScorer riskScorer(ScoringPolicy scoringPolicy) {
        return new RiskScorer(scoringPolicy);
    }

    @Bean
    public PolicyEvaluator policyEvaluator() {
        return new PolicyEvaluator();
    }

    @Bean
    public ReportBuilder reportBuilder() {
        return new ReportBuilder();
    }
}

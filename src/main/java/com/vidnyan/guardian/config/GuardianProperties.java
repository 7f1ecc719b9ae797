package com.vidnyan.guardian.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.yml or {@code --guardian.*} arguments.
 */
@Data
@ConfigurationProperties(prefix = "guardian")
public class GuardianProperties {

    private Runner runner = new Runner();
    private Registry registry = new Registry();
    private Detector detector = new Detector();
    private Scoring scoring = new Scoring();
    private Policy policy = new Policy();
    private Sink sink = new Sink();

    @Data
    public static class Runner {
        /**
         * Upper bound on analyzers running at the same time.
         */
        private int maxConcurrency = 4;

        /**
         * Global deadline for the whole run; running analyzers are killed when it passes.
         */
        private Duration runDeadline = Duration.ofMinutes(20);

        /**
         * Per-stream capture limit for analyzer output.
         */
        private int maxOutputBytes = 8 * 1024 * 1024;

        /**
         * Parent of the per-invocation scratch directories. Empty means the system temp dir.
         */
        private String scratchRoot = "";
    }

    @Data
    public static class Registry {
        private String catalogLocation = "classpath*:analyzers/*.json";
        private Set<String> disabledTools = new LinkedHashSet<>();
        private boolean universalEnabled = true;
    }

    @Data
    public static class Detector {
        private int maxDepth = 12;
        private Set<String> excludedDirectories = new LinkedHashSet<>(List.of(
                ".git", "node_modules", "target", "build", "dist", ".venv", "venv",
                "__pycache__", "vendor", ".gradle", ".idea", "bin", "obj", ".terraform"));
    }

    @Data
    public static class Scoring {
        private Map<String, Integer> weights = new LinkedHashMap<>(Map.of(
                "critical", 25, "high", 10, "medium", 3, "low", 1, "info", 0));
        private int severityCap = 100;
        private int ciChangePoints = 5;
        private int dependencyChangePoints = 5;
        private int largeDiffLines = 500;
        private int largeDiffPoints = 5;
        private int cleanWithTestsPoints = -5;
        private int lineTolerance = 2;
        private double similarityThreshold = 0.8;

        /**
         * Highest score still reported as low risk.
         */
        private int lowMax = 29;

        /**
         * Highest score still reported as medium risk.
         */
        private int mediumMax = 59;
    }

    @Data
    public static class Policy {
        /**
         * JSON or YAML policy file. Missing file means no limits.
         */
        private String path = "guardian-policy.json";
        private boolean blockOnHighRisk = false;
    }

    @Data
    public static class Sink {
        private String outputDir = "analysis_results";
        private boolean archive = true;
        private GitHub github = new GitHub();
    }

    @Data
    public static class GitHub {
        private String apiUrl = "https://api.github.com";
        private String token = "";
        private String repository = "";
        private Integer prNumber;
    }
}

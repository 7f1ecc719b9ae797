package com.vidnyan.guardian.domain.detect;

import com.vidnyan.guardian.domain.model.Ecosystem;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides which ecosystems a repository contains from its characteristic manifest
 * and configuration files. Several tags may apply at once.
 * Never touches the network or spawns processes.
 */
@Slf4j
public class EcosystemDetector {

    private static final int YAML_PROBE_BYTES = 4096;
    private static final Set<String> CI_DIRECTORIES = Set.of(".github", ".gitlab", ".circleci", ".buildkite");

    private final List<ManifestRule> rules;

    public EcosystemDetector() {
        this(defaultRules());
    }

    public EcosystemDetector(List<ManifestRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Detect ecosystems from a repository listing. Tags come out in rule order,
     * each with every matching file as evidence.
     */
    public List<Ecosystem> detect(Path root, List<String> files) {
        Map<String, List<String>> evidence = new LinkedHashMap<>();
        for (ManifestRule rule : rules) {
            for (String file : files) {
                if (rule.matches(root, file)) {
                    evidence.computeIfAbsent(rule.tag(), k -> new ArrayList<>()).add(file);
                }
            }
        }

        List<Ecosystem> detected = new ArrayList<>();
        evidence.forEach((tag, matched) -> detected.add(new Ecosystem(tag, matched)));
        detected.forEach(e -> log.info("Detected ecosystem '{}' (evidence: {})", e.tag(), e.primaryEvidence()));
        return detected;
    }

    /**
     * A tag together with the predicate recognizing its files.
     */
    public record ManifestRule(String tag, FileMatcher matcher) {

        boolean matches(Path root, String file) {
            return matcher.matches(root, file);
        }

        static ManifestRule byName(String tag, String... names) {
            Set<String> accepted = Set.of(names);
            return new ManifestRule(tag, (root, file) -> accepted.contains(fileName(file)));
        }

        static ManifestRule bySuffix(String tag, String... suffixes) {
            Predicate<String> predicate = name -> {
                String lower = name.toLowerCase(Locale.ROOT);
                for (String suffix : suffixes) {
                    if (lower.endsWith(suffix)) {
                        return true;
                    }
                }
                return false;
            };
            return new ManifestRule(tag, (root, file) -> predicate.test(fileName(file)));
        }
    }

    @FunctionalInterface
    public interface FileMatcher {
        boolean matches(Path root, String file);
    }

    public static List<ManifestRule> defaultRules() {
        return List.of(
                ManifestRule.byName("python", "requirements.txt", "pyproject.toml", "Pipfile", "setup.py"),
                ManifestRule.byName("javascript", "package.json"),
                ManifestRule.byName("java", "pom.xml", "build.gradle", "build.gradle.kts"),
                ManifestRule.byName("go", "go.mod"),
                ManifestRule.byName("ruby", "Gemfile"),
                ManifestRule.byName("php", "composer.json"),
                ManifestRule.bySuffix("dotnet", ".csproj", ".sln"),
                new ManifestRule("docker", (root, file) -> isDockerfile(fileName(file))),
                ManifestRule.bySuffix("terraform", ".tf"),
                new ManifestRule("kubernetes", EcosystemDetector::isKubernetesManifest));
    }

    static boolean isDockerfile(String name) {
        return name.equals("Dockerfile") || name.startsWith("Dockerfile.") || name.endsWith(".dockerfile");
    }

    static boolean isKubernetesManifest(Path root, String file) {
        String lower = file.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".yaml") && !lower.endsWith(".yml")) {
            return false;
        }
        String firstSegment = file.contains("/") ? file.substring(0, file.indexOf('/')) : "";
        if (CI_DIRECTORIES.contains(firstSegment)) {
            return false;
        }
        try (InputStream in = Files.newInputStream(root.resolve(file))) {
            String head = new String(in.readNBytes(YAML_PROBE_BYTES), StandardCharsets.UTF_8);
            return head.contains("apiVersion:") && head.contains("kind:");
        } catch (IOException e) {
            log.warn("Cannot probe {}: {}", file, e.getMessage());
            return false;
        }
    }

    static String fileName(String file) {
        int slash = file.lastIndexOf('/');
        return slash >= 0 ? file.substring(slash + 1) : file;
    }
}

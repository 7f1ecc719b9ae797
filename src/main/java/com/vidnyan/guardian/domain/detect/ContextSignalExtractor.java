package com.vidnyan.guardian.domain.detect;

import com.vidnyan.guardian.domain.model.ContextSignals;
import com.vidnyan.guardian.domain.model.RepositoryContext;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives contextual risk signals from the change set and the repository listing.
 */
public class ContextSignalExtractor {

    private static final List<String> CI_PREFIXES = List.of(
            ".github/workflows/", ".github/actions/", ".circleci/", ".buildkite/", ".gitlab/ci/");
    private static final Set<String> CI_FILES = Set.of(
            ".gitlab-ci.yml", "Jenkinsfile", "azure-pipelines.yml", ".travis.yml", "bitbucket-pipelines.yml");

    private static final Set<String> DEPENDENCY_MANIFESTS = Set.of(
            "requirements.txt", "Pipfile", "Pipfile.lock", "pyproject.toml", "poetry.lock", "setup.py",
            "package.json", "package-lock.json", "yarn.lock", "pnpm-lock.yaml",
            "pom.xml", "build.gradle", "build.gradle.kts", "gradle.lockfile",
            "go.mod", "go.sum", "Gemfile", "Gemfile.lock", "composer.json", "composer.lock",
            "packages.config", "Directory.Packages.props");

    private static final Pattern TEST_PATH = Pattern.compile(
            "(^|/)(tests?|__tests__|spec)/"
                    + "|(^|/)test_[^/]+\\.py$|_test\\.(py|go)$"
                    + "|(Test|Tests|IT)\\.(java|kt|cs)$"
                    + "|\\.(test|spec)\\.(js|jsx|ts|tsx)$|_spec\\.rb$");

    public ContextSignals extract(RepositoryContext context) {
        if (context.ecosystems().isEmpty()) {
            return ContextSignals.none();
        }
        List<String> changed = context.changedFiles();
        boolean ci = changed.stream().anyMatch(ContextSignalExtractor::isCiConfig);
        boolean deps = changed.stream().anyMatch(ContextSignalExtractor::isDependencyManifest);
        boolean tests = context.files().stream().anyMatch(ContextSignalExtractor::isTestFile);
        return new ContextSignals(ci, deps, DiffParser.changedLineCount(context.patch()), tests, true);
    }

    static boolean isCiConfig(String file) {
        return CI_PREFIXES.stream().anyMatch(file::startsWith)
                || CI_FILES.contains(EcosystemDetector.fileName(file));
    }

    static boolean isDependencyManifest(String file) {
        String name = EcosystemDetector.fileName(file);
        return DEPENDENCY_MANIFESTS.contains(name) || name.toLowerCase(Locale.ROOT).endsWith(".csproj");
    }

    static boolean isTestFile(String file) {
        return TEST_PATH.matcher(file).find();
    }
}

package com.vidnyan.guardian.application.port.in;

import com.vidnyan.guardian.domain.detect.DiffParser;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GuardianReport;
import com.vidnyan.guardian.domain.report.RunStage;
import com.vidnyan.guardian.domain.report.RunStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Primary use case: analyze a repository working tree and report its risk.
 * Never terminates the host process; the caller decides what the status means.
 */
public interface AnalyzeRepositoryUseCase {

    AnalysisOutcome analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     * When {@code changedFiles} is empty and a patch is present, the changed files are
     * taken from the patch headers.
     */
    record AnalysisRequest(
        Path repository,
        RunMode mode,
        List<String> changedFiles,
        String patch
    ) {
        public AnalysisRequest {
            Objects.requireNonNull(repository, "repository");
            mode = mode != null ? mode : RunMode.MANUAL;
            patch = patch != null ? patch : "";
            changedFiles = changedFiles != null && !changedFiles.isEmpty()
                    ? List.copyOf(changedFiles)
                    : DiffParser.changedFiles(patch);
        }

        public static AnalysisRequest manual(Path repository) {
            return new AnalysisRequest(repository, RunMode.MANUAL, List.of(), "");
        }

        public static AnalysisRequest pullRequest(Path repository, String patch) {
            return new AnalysisRequest(repository, RunMode.PR, List.of(), patch);
        }
    }

    /**
     * Analysis outcome.
     *
     * @param stages     stages the run went through, ending in DONE or ABORTED
     * @param warnings   non-fatal problems such as an unavailable summarizer
     * @param sinkErrors one message per result sink that failed
     */
    record AnalysisOutcome(
        GuardianReport report,
        List<RunStage> stages,
        List<String> warnings,
        List<String> sinkErrors
    ) {
        public AnalysisOutcome {
            stages = List.copyOf(stages);
            warnings = List.copyOf(warnings);
            sinkErrors = List.copyOf(sinkErrors);
        }

        public RunStatus status() {
            return report.status();
        }

        public boolean isAborted() {
            return report.status() == RunStatus.ABORTED;
        }
    }
}

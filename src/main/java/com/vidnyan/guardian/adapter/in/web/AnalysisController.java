package com.vidnyan.guardian.adapter.in.web;

import com.vidnyan.guardian.application.port.in.AnalyzeRepositoryUseCase;
import com.vidnyan.guardian.application.port.in.AnalyzeRepositoryUseCase.AnalysisOutcome;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GenOpsPayload;
import com.vidnyan.guardian.domain.report.RunStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST API for running an analysis.
 */
@Slf4j
@RestController
@RequestMapping("/api/analyses")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalyzeRepositoryUseCase analyzeRepositoryUseCase;

    @PostMapping
    public AnalysisResponse analyze(@RequestBody AnalysisRequestBody request) {
        if (request.repository() == null || request.repository().isBlank()) {
            throw new IllegalArgumentException("repository is required");
        }
        log.info("Received analysis request for {} ({})", request.repository(), request.mode());

        AnalysisOutcome outcome = analyzeRepositoryUseCase.analyze(new AnalyzeRepositoryUseCase.AnalysisRequest(
                Path.of(request.repository()),
                RunMode.fromId(request.mode()),
                request.changedFiles(),
                request.patch()));

        return new AnalysisResponse(
                GenOpsPayload.from(outcome.report()),
                outcome.stages(),
                outcome.warnings(),
                outcome.sinkErrors());
    }

    @GetMapping("/health")
    public String health() {
        return "OK - GenOps Guardian";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException e) {
        return Map.of("error", e.getMessage());
    }

    public record AnalysisRequestBody(
        String repository,
        String mode,
        List<String> changedFiles,
        String patch
    ) {}

    public record AnalysisResponse(
        GenOpsPayload result,
        List<RunStage> stages,
        List<String> warnings,
        List<String> sinkErrors
    ) {}
}

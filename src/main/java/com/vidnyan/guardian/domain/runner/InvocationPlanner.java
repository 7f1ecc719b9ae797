package com.vidnyan.guardian.domain.runner;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.analyzer.ToolExecution;
import com.vidnyan.guardian.domain.model.RepositoryContext;
import com.vidnyan.guardian.domain.model.RunMode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Binds selected analyzers to the repository: resolves command templates, picks the file
 * subset, and sets aside analyzers whose binary is not installed.
 */
@Slf4j
public class InvocationPlanner {

    private static final String WHOLE_TREE = ".";

    public Schedule plan(RepositoryContext context, List<AnalyzerSpec> specs, Predicate<String> toolAvailable) {
        List<Invocation> invocations = new ArrayList<>();
        List<ToolExecution> skipped = new ArrayList<>();

        for (AnalyzerSpec spec : specs) {
            if (spec.requiresPath() != null && !Files.exists(context.root().resolve(spec.requiresPath()))) {
                log.info("Not scheduling {}: required path '{}' is absent", spec.id(), spec.requiresPath());
                continue;
            }

            List<String> targets = targetsFor(context, spec);
            if (context.mode() == RunMode.PR && spec.targetsFiles() && targets.isEmpty()) {
                log.info("Not scheduling {}: no changed files in its scope", spec.id());
                continue;
            }

            if (!toolAvailable.test(spec.executable())) {
                log.warn("Skipping {}: '{}' is not installed", spec.id(), spec.executable());
                skipped.add(ToolExecution.skipped(spec, "'" + spec.executable() + "' not found on host"));
                continue;
            }

            String id = spec.id() + "#" + (invocations.size() + 1);
            invocations.add(new Invocation(id, spec, context.root(), targets, resolveCommand(context, spec, targets)));
        }

        log.info("Scheduled {} invocations, {} analyzers unavailable", invocations.size(), skipped.size());
        return new Schedule(invocations, skipped);
    }

    /**
     * Files handed to a file-targeting analyzer. Empty means the whole tree.
     */
    List<String> targetsFor(RepositoryContext context, AnalyzerSpec spec) {
        if (context.mode() != RunMode.PR || !spec.targetsFiles()) {
            return List.of();
        }
        return context.changedFiles().stream()
                .filter(spec::appliesTo)
                .filter(f -> Files.exists(context.root().resolve(f)))
                .toList();
    }

    static List<String> resolveCommand(RepositoryContext context, AnalyzerSpec spec, List<String> targets) {
        String root = context.root().toAbsolutePath().toString();
        List<String> resolved = new ArrayList<>();
        for (String arg : spec.command()) {
            if (AnalyzerSpec.FILES_PLACEHOLDER.equals(arg)) {
                if (targets.isEmpty()) {
                    resolved.add(WHOLE_TREE);
                } else {
                    resolved.addAll(targets);
                }
            } else {
                resolved.add(arg.replace(AnalyzerSpec.ROOT_PLACEHOLDER, root));
            }
        }
        return resolved;
    }

    /**
     * Invocations ready to run plus analyzers recorded as skipped.
     */
    public record Schedule(List<Invocation> invocations, List<ToolExecution> skipped) {

        public Schedule {
            invocations = List.copyOf(invocations);
            skipped = List.copyOf(skipped);
        }
    }
}

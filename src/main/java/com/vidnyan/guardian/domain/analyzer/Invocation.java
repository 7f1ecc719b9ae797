package com.vidnyan.guardian.domain.analyzer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * One analyzer bound to a working directory and a file subset, with its resolved command line.
 */
public record Invocation(
    String id,
    AnalyzerSpec spec,
    Path workingDirectory,
    List<String> targets,
    List<String> commandLine
) {

    public Invocation {
        targets = List.copyOf(targets);
        commandLine = List.copyOf(commandLine);
    }

    public String toolId() {
        return spec.id();
    }

    public Duration timeout() {
        return spec.timeout();
    }
}

package com.vidnyan.guardian.adapter.out.process;

import com.vidnyan.guardian.application.port.out.ToolLocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks analyzer binaries up on {@code PATH}. Results are cached per executable name.
 */
@Slf4j
@Component
public class PathToolLocator implements ToolLocator {

    private static final List<String> WINDOWS_SUFFIXES = List.of("", ".exe", ".cmd", ".bat");

    private final List<Path> searchPath;
    private final Map<String, Boolean> cache = new ConcurrentHashMap<>();

    public PathToolLocator() {
        this(System.getenv("PATH"));
    }

    PathToolLocator(String pathVariable) {
        this.searchPath = pathVariable == null ? List.of() : Arrays.stream(pathVariable.split(File.pathSeparator))
                .filter(entry -> !entry.isBlank())
                .map(Path::of)
                .toList();
    }

    @Override
    public boolean isAvailable(String executable) {
        return cache.computeIfAbsent(executable, this::lookup);
    }

    private boolean lookup(String executable) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        for (Path dir : searchPath) {
            for (String suffix : WINDOWS_SUFFIXES) {
                if (Files.isExecutable(dir.resolve(executable + suffix))) {
                    log.debug("Found {} in {}", executable, dir);
                    return true;
                }
            }
        }
        log.debug("{} not found on PATH", executable);
        return false;
    }
}

package com.vidnyan.guardian.domain.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Everything known about the repository under analysis.
 * Created once per run; the ecosystem list is fixed by {@link #withEcosystems(List)}
 * at the end of detection and never changes afterwards.
 */
public record RepositoryContext(
    Path root,
    RunMode mode,
    List<String> changedFiles,
    List<String> files,
    String patch,
    List<Ecosystem> ecosystems
) {

    public RepositoryContext {
        Objects.requireNonNull(root, "root");
        mode = mode != null ? mode : RunMode.MANUAL;
        changedFiles = changedFiles != null ? List.copyOf(new LinkedHashSet<>(changedFiles)) : List.of();
        files = files != null ? List.copyOf(files) : List.of();
        patch = patch != null ? patch : "";
        ecosystems = ecosystems != null ? List.copyOf(ecosystems) : List.of();
    }

    public static RepositoryContext of(Path root, RunMode mode, List<String> changedFiles,
                                       List<String> files, String patch) {
        return new RepositoryContext(root, mode, changedFiles, files, patch, List.of());
    }

    public RepositoryContext withEcosystems(List<Ecosystem> detected) {
        return new RepositoryContext(root, mode, changedFiles, files, patch, detected);
    }

    public List<String> ecosystemTags() {
        List<String> tags = new ArrayList<>();
        ecosystems.forEach(e -> tags.add(e.tag()));
        return tags;
    }
}

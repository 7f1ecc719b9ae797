package com.vidnyan.guardian.domain.detect;

import com.vidnyan.guardian.domain.error.DetectionException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Lists the files of a repository working tree.
 * Paths are repository-relative and '/'-separated, sorted for stable output.
 */
@Slf4j
public class RepositoryScanner {

    private final int maxDepth;
    private final Set<String> excludedDirectories;

    public RepositoryScanner(int maxDepth, Set<String> excludedDirectories) {
        this.maxDepth = maxDepth;
        this.excludedDirectories = Set.copyOf(excludedDirectories);
    }

    /**
     * Scan the tree below {@code root}.
     *
     * @throws DetectionException if the root itself is missing or unreadable
     */
    public List<String> scan(Path root) {
        if (!Files.isDirectory(root)) {
            throw new DetectionException(root, "Repository root is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new DetectionException(root, "Repository root is not readable: " + root);
        }

        List<String> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excludedDirectories.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(relativize(root, file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (file.equals(root)) {
                        throw new DetectionException(root, "Cannot read repository root: " + exc.getMessage(), exc);
                    }
                    log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new DetectionException(root, "Failed to scan repository: " + e.getMessage(), e);
        }

        Collections.sort(files);
        log.debug("Scanned {} files below {}", files.size(), root);
        return files;
    }

    static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}

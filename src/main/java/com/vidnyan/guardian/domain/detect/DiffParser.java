package com.vidnyan.guardian.domain.detect;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the bits of a unified diff the pipeline cares about.
 */
public final class DiffParser {

    private static final Pattern FILE_HEADER = Pattern.compile("^diff --git a/(.+?) b/(.+)$");
    private static final String DEV_NULL = "/dev/null";

    private DiffParser() {
    }

    /**
     * Changed file paths in diff order, taken from {@code diff --git} headers.
     * Deleted files keep their old path.
     */
    public static List<String> changedFiles(String patch) {
        Set<String> files = new LinkedHashSet<>();
        if (patch == null || patch.isBlank()) {
            return List.of();
        }
        for (String line : patch.split("\\R")) {
            Matcher m = FILE_HEADER.matcher(line);
            if (m.matches()) {
                String target = m.group(2);
                files.add(DEV_NULL.equals(target) ? m.group(1) : target);
            }
        }
        return new ArrayList<>(files);
    }

    /**
     * Number of added plus removed lines, excluding file headers.
     */
    public static int changedLineCount(String patch) {
        if (patch == null || patch.isBlank()) {
            return 0;
        }
        int count = 0;
        for (String line : patch.split("\\R")) {
            if (line.startsWith("+++") || line.startsWith("---")) {
                continue;
            }
            if (line.startsWith("+") || line.startsWith("-")) {
                count++;
            }
        }
        return count;
    }
}

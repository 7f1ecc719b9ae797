package com.vidnyan.guardian.domain.model;

/**
 * Contextual risk signals derived from the change set and the repository layout.
 */
public record ContextSignals(
    boolean ciConfigChanged,
    boolean dependencyManifestChanged,
    int diffLines,
    boolean testsPresent,
    boolean analyzed
) {

    /**
     * Signals for a run in which nothing was analyzed; no modifier applies.
     */
    public static ContextSignals none() {
        return new ContextSignals(false, false, 0, false, false);
    }
}

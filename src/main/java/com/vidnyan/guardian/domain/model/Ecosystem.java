package com.vidnyan.guardian.domain.model;

import java.util.List;

/**
 * A detected ecosystem tag together with the files that gave it away.
 */
public record Ecosystem(
    String tag,
    List<String> evidence
) {

    public Ecosystem {
        evidence = List.copyOf(evidence);
    }

    /**
     * The first matched manifest, used as primary evidence.
     */
    public String primaryEvidence() {
        return evidence.isEmpty() ? null : evidence.get(0);
    }
}

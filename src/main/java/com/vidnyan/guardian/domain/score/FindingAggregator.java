package com.vidnyan.guardian.domain.score;

import com.vidnyan.guardian.domain.model.Finding;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Merges findings reported by several tools for the same issue.
 *
 * <p>Findings from different tools are duplicates when they point at the same file, their
 * lines are both absent or within the line tolerance, and their messages are similar enough.
 * The more severe one is kept and the other tool is recorded as corroborating it. A tool's
 * own findings only merge when rule and line match exactly, so neighbouring hits of one
 * rule stay separate. Raw findings are never merged. Running the aggregator on its own output changes nothing.
 */
@Slf4j
public class FindingAggregator {

    /**
     * Stable output order: file, line (absent last), severity descending, tool.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::file, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Finding::line, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Finding::severity, Comparator.reverseOrder())
            .thenComparing(Finding::tool)
            .thenComparing(Finding::ruleId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Finding::message);

    private static final Comparator<Finding> MERGE_ORDER = Comparator
            .comparing(Finding::severity, Comparator.reverseOrder())
            .thenComparing(REPORT_ORDER);

    private final int lineTolerance;
    private final double similarityThreshold;

    public FindingAggregator(int lineTolerance, double similarityThreshold) {
        this.lineTolerance = lineTolerance;
        this.similarityThreshold = similarityThreshold;
    }

    public List<Finding> aggregate(List<Finding> findings) {
        List<Finding> candidates = new ArrayList<>(findings);
        candidates.sort(MERGE_ORDER);

        List<Finding> kept = new ArrayList<>();
        int merged = 0;
        for (Finding candidate : candidates) {
            int match = indexOfDuplicate(kept, candidate);
            if (match < 0) {
                kept.add(candidate);
            } else {
                kept.set(match, corroborate(kept.get(match), candidate));
                merged++;
            }
        }

        kept.sort(REPORT_ORDER);
        if (merged > 0) {
            log.info("Merged {} duplicate findings; {} remain", merged, kept.size());
        }
        return List.copyOf(kept);
    }

    private int indexOfDuplicate(List<Finding> kept, Finding candidate) {
        for (int i = 0; i < kept.size(); i++) {
            if (isDuplicate(kept.get(i), candidate)) {
                return i;
            }
        }
        return -1;
    }

    boolean isDuplicate(Finding a, Finding b) {
        if (a.raw() || b.raw() || a.file() == null || !Objects.equals(a.file(), b.file())) {
            return false;
        }
        if (a.tool().equals(b.tool())) {
            return Objects.equals(a.ruleId(), b.ruleId()) && Objects.equals(a.line(), b.line())
                    && MessageSimilarity.similarity(a.message(), b.message()) >= similarityThreshold;
        }
        if (a.line() == null || b.line() == null) {
            if (a.line() != null || b.line() != null) {
                return false;
            }
        } else if (Math.abs(a.line() - b.line()) > lineTolerance) {
            return false;
        }
        return MessageSimilarity.similarity(a.message(), b.message()) >= similarityThreshold;
    }

    private static Finding corroborate(Finding keeper, Finding duplicate) {
        TreeSet<String> tools = new TreeSet<>(keeper.corroboratedBy());
        tools.add(duplicate.tool());
        tools.addAll(duplicate.corroboratedBy());
        tools.remove(keeper.tool());
        return keeper.withCorroboratedBy(new ArrayList<>(tools));
    }
}

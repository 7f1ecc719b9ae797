package com.vidnyan.guardian.domain.score;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-set Jaccard similarity over normalized messages.
 */
public final class MessageSimilarity {

    private MessageSimilarity() {
    }

    public static double similarity(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    /**
     * Lower-cased alphanumeric tokens; quotes, punctuation and case do not matter.
     */
    static Set<String> tokens(String message) {
        if (message == null) {
            return Set.of();
        }
        String normalized = message.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").strip();
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }
}

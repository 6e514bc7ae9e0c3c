package com.thedigest.continuity.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the grouping key used to cluster articles that describe the same ongoing story.
 */
public final class ThreadKeys {

    private static final int MAX_TOKENS = 7;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "from", "that", "this", "into", "over", "after",
            "about", "are", "was", "were", "has", "have", "had", "its", "his", "her", "their",
            "will", "would", "could", "should", "says", "said", "new", "amid", "than", "then",
            "but", "not", "you", "your", "our", "who", "what", "when", "why", "how", "out"
    );

    private ThreadKeys() {
    }

    /**
     * Returns the explicit thread id when present, otherwise the normalized title,
     * otherwise the article id.
     */
    public static String resolve(String explicitThreadId, String title, String articleId) {
        if (explicitThreadId != null && !explicitThreadId.isBlank()) {
            return explicitThreadId.trim();
        }
        String normalized = normalizeTitle(title);
        return normalized.isEmpty() ? articleId : normalized;
    }

    /**
     * Lower-cases the title, strips punctuation, drops short tokens and stop words and
     * keeps up to seven distinct tokens in sorted order, so word order does not matter.
     */
    public static String normalizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String cleaned = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", " ");
        return Arrays.stream(cleaned.split("\\s+"))
                .filter(token -> token.length() > 2)
                .filter(token -> !STOP_WORDS.contains(token))
                .distinct()
                .sorted()
                .limit(MAX_TOKENS)
                .collect(Collectors.joining(" "));
    }
}

package com.thedigest.continuity.service.ranking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive watchlist matching. Terms shorter than four characters must match on
 * a word boundary so "AI" does not fire inside "said"; longer terms match as substrings.
 */
public final class WatchlistMatcher {

    static final int WORD_BOUNDARY_THRESHOLD = 4;

    private WatchlistMatcher() {
    }

    /**
     * @return the watchlist terms (original casing, watchlist order) found in the text
     */
    public static List<String> matches(String searchText, List<String> watchlistTerms) {
        if (searchText == null || watchlistTerms == null || watchlistTerms.isEmpty()) {
            return List.of();
        }
        String haystack = searchText.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (String term : watchlistTerms) {
            if (term == null) continue;
            String needle = term.trim().toLowerCase(Locale.ROOT);
            if (needle.isEmpty()) continue;

            if (needle.length() < WORD_BOUNDARY_THRESHOLD) {
                Pattern pattern = Pattern.compile("\\b" + Pattern.quote(needle) + "\\b", Pattern.CASE_INSENSITIVE);
                if (pattern.matcher(haystack).find()) {
                    matches.add(term);
                }
                continue;
            }

            if (haystack.contains(needle)) {
                matches.add(term);
            }
        }
        return matches;
    }
}

package com.thedigest.continuity.service.ranking;

import com.thedigest.continuity.model.Candidate;
import com.thedigest.continuity.model.RankedCandidate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores delta candidates on significance, recency, watchlist hits, topic engagement,
 * summary availability and reader reactions, then orders them best first.
 * Negative reactions can push a score below zero; nothing is dropped by score alone.
 */
@Service
public class RankingEngine {

    static final double SIGNIFICANCE_WEIGHT = 6.0;
    static final double WATCHLIST_PER_MATCH = 2.25;
    static final double WATCHLIST_CAP = 7.0;
    static final double TOPIC_WEIGHT = 2.5;
    static final double SUMMARY_BOOST = 0.6;

    static final Map<String, Double> REACTION_WEIGHTS = Map.of(
            "useful", 1.25,
            "surprising", 1.5,
            "already_knew", -0.4,
            "bad_connection", -1.0,
            "not_important", -2.0
    );

    private final Clock clock;

    public RankingEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Ranks the candidates. The sort is stable, so equal scores keep fetch order.
     *
     * @param candidates      delta candidates in fetch order
     * @param watchlistTerms  tracked terms, possibly empty
     * @param topicEngagement weighted engagement per topic, possibly empty
     * @return candidates with score, watchlist matches and reason, highest score first
     */
    public List<RankedCandidate> rank(List<Candidate> candidates,
                                      List<String> watchlistTerms,
                                      Map<String, Double> topicEngagement) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        double maxTopicEngagement = Math.max(1.0, topicEngagement.values().stream()
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0));

        List<RankedCandidate> ranked = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            List<String> watchlistMatches = WatchlistMatcher.matches(candidate.searchText(), watchlistTerms);
            double watchlistBoost = watchlistBoost(watchlistMatches.size());

            double topicScore = topicEngagement.getOrDefault(candidate.topic(), 0.0);
            double topicBoost = (topicScore / maxTopicEngagement) * TOPIC_WEIGHT;

            double significanceBoost = (candidate.significanceScore() / 10.0) * SIGNIFICANCE_WEIGHT;
            double recencyBoost = recencyBoost(candidate.publishedAt(), now);
            double summaryBoost = candidate.summaryText() != null && !candidate.summaryText().isEmpty() ? SUMMARY_BOOST : 0.0;
            double reactionBoost = reactionBoost(candidate.reactions());

            double score = significanceBoost + recencyBoost + watchlistBoost + topicBoost + summaryBoost + reactionBoost;
            String reason = pickReason(candidate, watchlistMatches, topicBoost, reactionBoost);
            ranked.add(new RankedCandidate(candidate, watchlistMatches, reason, score));
        }

        // List.sort is a stable merge sort
        ranked.sort(Comparator.comparingDouble(RankedCandidate::score).reversed());
        return ranked;
    }

    static double watchlistBoost(int matchCount) {
        return Math.min(matchCount * WATCHLIST_PER_MATCH, WATCHLIST_CAP);
    }

    /**
     * Step function over age in hours. Unknown publish time contributes nothing.
     */
    static double recencyBoost(OffsetDateTime publishedAt, OffsetDateTime now) {
        if (publishedAt == null) {
            return 0.0;
        }
        double ageHours = Duration.between(publishedAt, now).toMillis() / 3_600_000.0;
        if (ageHours <= 1) return 3.0;
        if (ageHours <= 6) return 2.4;
        if (ageHours <= 12) return 1.8;
        if (ageHours <= 24) return 1.2;
        if (ageHours <= 72) return 0.8;
        return 0.3;
    }

    static double reactionBoost(List<String> reactions) {
        double sum = 0.0;
        for (String reaction : reactions) {
            sum += REACTION_WEIGHTS.getOrDefault(normalizeReaction(reaction), 0.0);
        }
        return sum;
    }

    // "already knew" and "already_knew" are both in circulation
    private static String normalizeReaction(String reaction) {
        return reaction == null ? "" : reaction.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    static String pickReason(Candidate candidate, List<String> watchlistMatches, double topicBoost, double reactionBoost) {
        if (!watchlistMatches.isEmpty()) {
            return "Tracks your watchlist: " + watchlistMatches.get(0);
        }
        if (candidate.significanceScore() >= 8) {
            return "High-significance development";
        }
        if (reactionBoost >= 1) {
            return "Similar stories were marked useful";
        }
        if (topicBoost >= 1.2) {
            return "Aligned with your reading focus in " + candidate.topic();
        }
        return "Important recent update";
    }
}

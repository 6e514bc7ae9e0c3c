package com.thedigest.continuity.service;

import com.thedigest.continuity.model.ArticleRecord;
import com.thedigest.continuity.service.source.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds significant stories from before the delta window whose thread got no fresh
 * update, so the brief can say what is still unresolved without counting it as new.
 */
@Service
public class UnchangedContextBuilder {

    private static final Logger logger = LoggerFactory.getLogger(UnchangedContextBuilder.class);

    static final int MIN_SIGNIFICANCE = 7;
    static final int MAX_TITLES = 5;
    static final int SCAN_LIMIT = 80;
    static final Set<String> LIVE_STORY_TYPES = Set.of("developing", "breaking", "analysis", "update");

    private final ItemStore itemStore;
    private final Duration lookback;

    public UnchangedContextBuilder(ItemStore itemStore,
                                   @Value("${app.continuity.unchanged-lookback-hours:96}") long lookbackHours) {
        this.itemStore = itemStore;
        this.lookback = Duration.ofHours(Math.max(1, lookbackHours));
    }

    /**
     * @param sinceAt           start of the current delta window
     * @param changedThreadKeys thread keys present in the delta
     * @return up to five titles, de-duplicated case-insensitively, newest first
     */
    public List<String> unchangedTitles(OffsetDateTime sinceAt, Set<String> changedThreadKeys) {
        List<ArticleRecord> rows;
        try {
            rows = itemStore.findPublishedBetween(sinceAt.minus(lookback), sinceAt, SCAN_LIMIT);
        } catch (BadSqlGrammarException e) {
            logger.debug("Unchanged context unavailable, intelligence relations missing: {}", e.getMessage());
            return List.of();
        } catch (DataAccessException e) {
            logger.error("Failed to fetch unchanged context: {}", e.getMessage());
            return List.of();
        }
        return select(rows, changedThreadKeys);
    }

    static List<String> select(List<ArticleRecord> rows, Set<String> changedThreadKeys) {
        List<String> titles = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ArticleRecord row : rows) {
            int significance = row.significanceScore() == null ? 0 : row.significanceScore();
            if (significance < MIN_SIGNIFICANCE) continue;
            if (!LIVE_STORY_TYPES.contains(row.storyTypeOrDefault())) continue;

            String title = row.title() == null ? "" : row.title().trim();
            if (title.isEmpty()) continue;
            if (changedThreadKeys.contains(ThreadKeys.resolve(row.storyThreadId(), title, row.id()))) continue;

            String titleKey = ThreadKeys.normalizeTitle(title);
            if (!seen.add(titleKey.isEmpty() ? title.toLowerCase(Locale.ROOT) : titleKey)) continue;

            titles.add(title);
            if (titles.size() >= MAX_TITLES) break;
        }
        return titles;
    }
}

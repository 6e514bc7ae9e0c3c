package com.thedigest.continuity.service;

import com.thedigest.continuity.model.ArticleRecord;
import com.thedigest.continuity.model.ArticleRecord.ArticleSummary;
import com.thedigest.continuity.model.Candidate;
import com.thedigest.continuity.service.source.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns item-store rows from the delta window into {@link Candidate}s, attaching reactions
 * and deriving source, summary text, search text and thread key.
 */
@Service
public class CandidateFetcher {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFetcher.class);

    static final int DEFAULT_SIGNIFICANCE = 5;
    static final int SUMMARY_CONTENT_CHARS = 500;
    static final String UNKNOWN_SOURCE = "Unknown";

    private final ItemStore itemStore;
    private final Executor executor;
    private final int deltaLimit;
    private final long ioTimeoutMs;

    public CandidateFetcher(ItemStore itemStore,
                            @Qualifier("continuityExecutor") Executor executor,
                            @Value("${app.continuity.delta-limit:220}") int deltaLimit,
                            @Value("${app.continuity.io-timeout-ms:4000}") long ioTimeoutMs) {
        this.itemStore = itemStore;
        this.executor = executor;
        this.deltaLimit = Math.max(1, deltaLimit);
        this.ioTimeoutMs = Math.max(1, ioTimeoutMs);
    }

    /**
     * Fetches up to the delta limit of articles published since {@code sinceAt}, newest first.
     * Call it from outside the executor: the reaction lookup waits on a task submitted there.
     *
     * @throws CandidateStoreUnavailableException when the item store cannot be read at all
     */
    public List<Candidate> fetchDelta(OffsetDateTime sinceAt) {
        List<ArticleRecord> rows = itemStore.findPublishedSince(sinceAt, deltaLimit);
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<String, List<String>> reactions = fetchReactions(rows.stream().map(ArticleRecord::id).toList());
        return rows.stream()
                .map(row -> toCandidate(row, reactions.getOrDefault(row.id(), List.of())))
                .toList();
    }

    /**
     * Loads reactions for the given ids. Reactions are an optional signal, so failures
     * and slow reads yield none.
     */
    public Map<String, List<String>> fetchReactions(List<String> articleIds) {
        return CompletableFuture.supplyAsync(() -> itemStore.findReactions(articleIds), executor)
                .completeOnTimeout(Map.of(), ioTimeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    logger.warn("Failed to load reactions for {} articles, ranking without them: {}",
                            articleIds.size(), e.toString());
                    return Map.of();
                })
                .join();
    }

    static Candidate toCandidate(ArticleRecord row, List<String> reactions) {
        String title = row.title() == null ? "" : row.title();
        String source = extractSource(row.url());
        String summaryText = buildSummaryText(row.summary(), row.content());
        String searchText = buildSearchText(title, source, row.content(), row.summary());
        int significance = clamp(row.significanceScore() == null ? DEFAULT_SIGNIFICANCE : row.significanceScore(), 1, 10);

        return new Candidate(
                row.id(),
                title,
                row.url() == null ? "" : row.url(),
                source,
                row.topic(),
                row.publishedAt(),
                significance,
                blankToNull(row.watchForNext()),
                summaryText,
                searchText,
                reactions,
                ThreadKeys.resolve(row.storyThreadId(), title, row.id())
        );
    }

    static String extractSource(String url) {
        if (url == null || url.isBlank()) {
            return UNKNOWN_SOURCE;
        }
        try {
            String host = new URI(url.trim()).getHost();
            if (host == null || host.isBlank()) {
                return UNKNOWN_SOURCE;
            }
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return UNKNOWN_SOURCE;
        }
    }

    static String buildSummaryText(ArticleSummary summary, String content) {
        if (summary != null) {
            String joined = Stream.of(summary.brief(), summary.theNews(), summary.whyItMatters(), summary.theContext())
                    .filter(Objects::nonNull)
                    .filter(part -> !part.isEmpty())
                    .collect(Collectors.joining(" "));
            if (!joined.isEmpty()) {
                return joined;
            }
        }
        if (content == null) {
            return "";
        }
        return content.length() > SUMMARY_CONTENT_CHARS ? content.substring(0, SUMMARY_CONTENT_CHARS) : content;
    }

    static String buildSearchText(String title, String source, String content, ArticleSummary summary) {
        String entities = summary == null ? "" : String.join(" ", summary.keyEntities());
        return String.join(" ",
                        title,
                        source,
                        content == null ? "" : content,
                        buildSummaryText(summary, content),
                        entities)
                .toLowerCase(Locale.ROOT);
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(max, Math.max(min, value));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

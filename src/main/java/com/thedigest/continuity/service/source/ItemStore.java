package com.thedigest.continuity.service.source;

import com.thedigest.continuity.model.ArticleRecord;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read access to ingested articles and the reactions recorded against them.
 */
public interface ItemStore {

    /**
     * Loads articles published at or after {@code since}, newest first.
     * Implementations degrade to a plain query when enrichment joins are unavailable.
     *
     * @throws com.thedigest.continuity.service.CandidateStoreUnavailableException when nothing can be read
     */
    List<ArticleRecord> findPublishedSince(OffsetDateTime since, int limit);

    /**
     * Loads articles published in {@code [from, until)}, newest first, with intelligence fields.
     */
    List<ArticleRecord> findPublishedBetween(OffsetDateTime from, OffsetDateTime until, int limit);

    /**
     * Loads reaction labels grouped by article id.
     */
    Map<String, List<String>> findReactions(Collection<String> articleIds);
}

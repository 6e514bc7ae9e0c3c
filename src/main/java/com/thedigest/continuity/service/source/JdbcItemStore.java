package com.thedigest.continuity.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thedigest.continuity.model.ArticleRecord;
import com.thedigest.continuity.model.ArticleRecord.ArticleSummary;
import com.thedigest.continuity.service.CandidateStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL-backed {@link ItemStore}. The enriched query attaches at most one summary
 * and one intelligence row per article, so {@code limit} counts articles. When those
 * relations are missing it retries with the plain article columns so candidates still
 * arrive with best-effort fields.
 */
@Component
public class JdbcItemStore implements ItemStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcItemStore.class);

    static final int MAX_REACTIONS = 2000;

    private static final String ENRICHED_SELECT = """
            select a.id::text as id, a.title, a.url, a.topic, a.content, a.published_at,
                   s.brief, s.the_news, s.why_it_matters, s.the_context, s.key_entities::text as key_entities,
                   ai.significance_score, ai.story_type, ai.story_thread_id, ai.watch_for_next
            from articles a
            left join lateral (
                select brief, the_news, why_it_matters, the_context, key_entities
                from summaries
                where article_id = a.id
                limit 1
            ) s on true
            left join lateral (
                select significance_score, story_type, story_thread_id, watch_for_next
                from article_intelligence
                where article_id = a.id
                order by created_at desc
                limit 1
            ) ai on true
            """;

    private static final String PLAIN_SELECT = """
            select a.id::text as id, a.title, a.url, a.topic, a.content, a.published_at
            from articles a
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcItemStore(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ArticleRecord> findPublishedSince(OffsetDateTime since, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("since", since)
                .addValue("limit", limit);
        String window = " where a.published_at >= :since order by a.published_at desc limit :limit";

        try {
            return jdbcTemplate.query(ENRICHED_SELECT + window, params, this::mapEnriched);
        } catch (BadSqlGrammarException e) {
            logger.warn("Enriched article query failed ({}); retrying without summaries and intelligence.", e.getMessage());
        } catch (DataAccessException e) {
            throw new CandidateStoreUnavailableException("Failed to fetch delta articles", e);
        }

        try {
            return jdbcTemplate.query(PLAIN_SELECT + window, params, this::mapPlain);
        } catch (DataAccessException e) {
            throw new CandidateStoreUnavailableException("Failed to fetch delta articles", e);
        }
    }

    @Override
    public List<ArticleRecord> findPublishedBetween(OffsetDateTime from, OffsetDateTime until, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("from", from)
                .addValue("until", until)
                .addValue("limit", limit);
        return jdbcTemplate.query(
                ENRICHED_SELECT + " where a.published_at < :until and a.published_at >= :from"
                        + " order by a.published_at desc limit :limit",
                params,
                this::mapEnriched);
    }

    @Override
    public Map<String, List<String>> findReactions(Collection<String> articleIds) {
        if (articleIds == null || articleIds.isEmpty()) {
            return Map.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ids", articleIds)
                .addValue("limit", MAX_REACTIONS);
        Map<String, List<String>> reactionsByArticle = new HashMap<>();
        jdbcTemplate.query("""
                        select article_id::text as article_id, reaction
                        from article_reactions
                        where article_id::text in (:ids)
                        limit :limit
                        """,
                params,
                rs -> {
                    reactionsByArticle.computeIfAbsent(rs.getString("article_id"), k -> new ArrayList<>())
                            .add(rs.getString("reaction"));
                });
        return reactionsByArticle;
    }

    private ArticleRecord mapEnriched(ResultSet rs, int rowNum) throws SQLException {
        ArticleSummary summary = new ArticleSummary(
                rs.getString("brief"),
                rs.getString("the_news"),
                rs.getString("why_it_matters"),
                rs.getString("the_context"),
                parseEntityNames(rs.getString("key_entities"))
        );
        int significance = rs.getInt("significance_score");
        Integer significanceScore = rs.wasNull() ? null : significance;
        return new ArticleRecord(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("url"),
                rs.getString("topic"),
                rs.getString("content"),
                rs.getObject("published_at", OffsetDateTime.class),
                summary,
                significanceScore,
                rs.getString("story_type"),
                rs.getString("story_thread_id"),
                rs.getString("watch_for_next")
        );
    }

    private ArticleRecord mapPlain(ResultSet rs, int rowNum) throws SQLException {
        return new ArticleRecord(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("url"),
                rs.getString("topic"),
                rs.getString("content"),
                rs.getObject("published_at", OffsetDateTime.class),
                null,
                null,
                null,
                null,
                null
        );
    }

    /**
     * Reads {@code [{"name": "..."}]} into a list of names; malformed JSON yields no entities.
     */
    List<String> parseEntityNames(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isArray()) {
                return List.of();
            }
            List<String> names = new ArrayList<>();
            for (JsonNode entity : node) {
                String name = entity.path("name").asText("");
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
            return names;
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring malformed key_entities payload: {}", e.getMessage());
            return List.of();
        }
    }
}

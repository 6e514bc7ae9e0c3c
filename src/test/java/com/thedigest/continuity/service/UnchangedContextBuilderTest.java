package com.thedigest.continuity.service;

import com.thedigest.continuity.model.ArticleRecord;
import com.thedigest.continuity.service.source.ItemStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnchangedContextBuilderTest {

    private static final OffsetDateTime SINCE = OffsetDateTime.parse("2026-02-17T08:00:00Z");

    @Mock
    private ItemStore itemStore;

    @Test
    void keepsSignificantLiveStoriesWhoseThreadDidNotMove() {
        List<ArticleRecord> rows = List.of(
                row("1", "Ceasefire talks stall in Doha", 8, "developing", "t-ceasefire"),
                row("2", "Budget vote delayed again", 9, "breaking", "t-budget"),
                row("3", "Minor transfer rumour", 4, "update", null),
                row("4", "Long read on housing", 9, "feature", null),
                row("5", "Election recount ordered", 8, null, null),
                row("6", "Talks stall in Doha ceasefire", 8, "developing", null));

        List<String> titles = UnchangedContextBuilder.select(rows, Set.of("t-budget"));

        assertThat(titles).containsExactly("Ceasefire talks stall in Doha", "Election recount ordered");
    }

    @Test
    void duplicateTitlesCollapseAndListIsCapped() {
        List<ArticleRecord> rows = new ArrayList<>();
        rows.add(row("d1", "Rates decision looms", 8, "analysis", null));
        rows.add(row("d2", "RATES DECISION LOOMS!", 8, "analysis", null));
        for (int i = 0; i < 8; i++) {
            rows.add(row("r" + i, "Distinct story number " + (char) ('a' + i) + "lpha", 7, "update", "t" + i));
        }

        List<String> titles = UnchangedContextBuilder.select(rows, Set.of());

        assertThat(titles).hasSize(5).startsWith("Rates decision looms").doesNotContain("RATES DECISION LOOMS!");
    }

    @Test
    void queriesTheLookbackWindowBeforeTheDelta() {
        UnchangedContextBuilder builder = new UnchangedContextBuilder(itemStore, 96);
        when(itemStore.findPublishedBetween(SINCE.minusHours(96), SINCE, 80))
                .thenReturn(List.of(row("1", "Court ruling pending", 9, "developing", null)));

        assertThat(builder.unchangedTitles(SINCE, Set.of())).containsExactly("Court ruling pending");
    }

    @Test
    void missingIntelligenceRelationsYieldNothing() {
        UnchangedContextBuilder builder = new UnchangedContextBuilder(itemStore, 96);
        when(itemStore.findPublishedBetween(SINCE.minusHours(96), SINCE, 80))
                .thenThrow(new BadSqlGrammarException("query", "select ...", new SQLException("relation does not exist")));

        assertThat(builder.unchangedTitles(SINCE, Set.of())).isEmpty();
    }

    @Test
    void storeFailureYieldsNothing() {
        UnchangedContextBuilder builder = new UnchangedContextBuilder(itemStore, 96);
        when(itemStore.findPublishedBetween(SINCE.minusHours(96), SINCE, 80))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(builder.unchangedTitles(SINCE, Set.of())).isEmpty();
    }

    private static ArticleRecord row(String id, String title, int significance, String storyType, String threadId) {
        return new ArticleRecord(id, title, "https://example.com/" + id, "world", null, SINCE.minusHours(10),
                null, significance, storyType, threadId, null);
    }
}

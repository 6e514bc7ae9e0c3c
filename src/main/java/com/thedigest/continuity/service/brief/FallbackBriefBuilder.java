package com.thedigest.continuity.service.brief;

import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.dto.Highlight;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.model.DepthConfig;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a brief purely from ranked data. Costs nothing and cannot fail, so it is both
 * the default and the per-field fallback for model output.
 */
public final class FallbackBriefBuilder {

    static final int UNCHANGED_LIMIT = 3;

    private static final DateTimeFormatter SINCE_FORMAT =
            DateTimeFormatter.ofPattern("MMM d, h:mm a 'UTC'", Locale.US);

    private FallbackBriefBuilder() {
    }

    public static Brief build(List<Highlight> highlights,
                              List<String> unchangedTitles,
                              Depth depth,
                              int newArticles,
                              OffsetDateTime lastSeenAt) {
        DepthConfig config = depth.config();
        String sinceLabel = lastSeenAt != null
                ? "since " + SINCE_FORMAT.format(lastSeenAt.atZoneSameInstant(ZoneOffset.UTC))
                : "in the last 24 hours";

        String headline = newArticles > 0
                ? newArticles + " new " + (newArticles == 1 ? "story" : "stories") + " " + sinceLabel
                : "No major new updates " + sinceLabel;

        String summary;
        if (highlights.isEmpty()) {
            summary = "You are caught up. No meaningful deltas were detected in your tracked feed.";
        } else {
            String runnersUp = highlights.stream()
                    .skip(1)
                    .limit(2)
                    .map(Highlight::source)
                    .collect(Collectors.joining(", "));
            summary = highlights.get(0).title() + " leads the change set, followed by "
                    + (runnersUp.isEmpty() ? "broader coverage shifts" : runnersUp) + ".";
        }

        List<String> changed = new ArrayList<>();
        for (int i = 0; i < highlights.size() && i < config.changedBulletLimit(); i++) {
            Highlight item = highlights.get(i);
            changed.add((i + 1) + ". " + item.title() + " (" + item.source() + ")");
        }

        List<String> unchanged = unchangedTitles.stream()
                .limit(UNCHANGED_LIMIT)
                .map(title -> "Still in play: " + title)
                .toList();

        List<String> watchNext = highlights.stream()
                .map(Highlight::watchForNext)
                .filter(Objects::nonNull)
                .filter(value -> !value.isBlank())
                .limit(config.watchNextLimit())
                .toList();

        return new Brief(headline, summary, changed, unchanged, watchNext);
    }
}

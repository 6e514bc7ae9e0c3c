package com.thedigest.continuity.service;

import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.dto.Citation;
import com.thedigest.continuity.dto.ContinuityStateView;
import com.thedigest.continuity.dto.Highlight;
import com.thedigest.continuity.dto.SinceLastReadPayload;
import com.thedigest.continuity.dto.SnapshotCounts;
import com.thedigest.continuity.dto.SnapshotState;
import com.thedigest.continuity.model.Candidate;
import com.thedigest.continuity.model.ContinuityState;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.model.DepthConfig;
import com.thedigest.continuity.model.RankedCandidate;
import com.thedigest.continuity.service.brief.FallbackBriefBuilder;
import com.thedigest.continuity.service.brief.GeneratedBrief;
import com.thedigest.continuity.service.brief.NarrativeBriefService;
import com.thedigest.continuity.service.ranking.RankingEngine;
import com.thedigest.continuity.service.source.EngagementSource;
import com.thedigest.continuity.service.source.WatchlistSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Computes the "since you last read" view for a client: the ranked delta since its
 * watermark, a short brief, and citations, served from the snapshot cache when the
 * same delta was computed recently.
 *
 * Only a total failure of the candidate store reaches the caller. Every other
 * collaborator degrades to an empty signal or the deterministic brief.
 */
@Service
public class ContinuityEngine {

    private static final Logger logger = LoggerFactory.getLogger(ContinuityEngine.class);

    private final ContinuityStateService stateService;
    private final WatchlistSource watchlistSource;
    private final EngagementSource engagementSource;
    private final CandidateFetcher candidateFetcher;
    private final RankingEngine rankingEngine;
    private final SnapshotHashingService hashingService;
    private final SnapshotCacheService cacheService;
    private final UnchangedContextBuilder unchangedContextBuilder;
    private final NarrativeBriefService briefService;
    private final Executor executor;
    private final Clock clock;
    private final Duration firstVisitLookback;
    private final long ioTimeoutMs;

    public ContinuityEngine(ContinuityStateService stateService,
                            WatchlistSource watchlistSource,
                            EngagementSource engagementSource,
                            CandidateFetcher candidateFetcher,
                            RankingEngine rankingEngine,
                            SnapshotHashingService hashingService,
                            SnapshotCacheService cacheService,
                            UnchangedContextBuilder unchangedContextBuilder,
                            NarrativeBriefService briefService,
                            @Qualifier("continuityExecutor") Executor executor,
                            Clock clock,
                            @Value("${app.continuity.lookback-hours:24}") long lookbackHours,
                            @Value("${app.continuity.io-timeout-ms:4000}") long ioTimeoutMs) {
        this.stateService = stateService;
        this.watchlistSource = watchlistSource;
        this.engagementSource = engagementSource;
        this.candidateFetcher = candidateFetcher;
        this.rankingEngine = rankingEngine;
        this.hashingService = hashingService;
        this.cacheService = cacheService;
        this.unchangedContextBuilder = unchangedContextBuilder;
        this.briefService = briefService;
        this.executor = executor;
        this.clock = clock;
        this.firstVisitLookback = Duration.ofHours(Math.max(1, lookbackHours));
        this.ioTimeoutMs = Math.max(1, ioTimeoutMs);
    }

    /**
     * Builds the since-last-read payload. Never advances the watermark.
     *
     * @param rawClientId caller supplied client id, normalized here
     * @param rawDepth    requested depth; unrecognised values fall back to the stored preference
     * @throws CandidateStoreUnavailableException when the delta cannot be read at all
     */
    public SinceLastReadPayload getSinceLastRead(String rawClientId, String rawDepth) {
        String clientId = ClientIds.normalize(rawClientId);
        ContinuityState state = stateService.resolve(clientId);
        Depth depth = Depth.parse(rawDepth)
                .orElse(state.getPreferredDepth() != null ? state.getPreferredDepth() : stateService.defaultDepth());
        DepthConfig config = depth.config();

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime lastSeenAt = state.getLastSeenAt();
        OffsetDateTime sinceAt = lastSeenAt != null ? lastSeenAt : now.minus(firstVisitLookback);

        CompletableFuture<List<String>> watchlistFuture = optional(
                watchlistSource::loadTerms, List.of(), "watchlist");
        CompletableFuture<Map<String, Double>> engagementFuture = optional(
                engagementSource::topicEngagement, Map.of(), "engagement");
        // runs on the request thread: its reaction lookup is itself a task on the executor
        List<Candidate> candidates = fetchRequired(sinceAt);
        List<RankedCandidate> ranked = rankingEngine.rank(
                candidates, watchlistFuture.join(), engagementFuture.join());

        List<Highlight> highlights = ranked.stream()
                .limit(config.highlightLimit())
                .map(Highlight::from)
                .toList();
        String snapshotHash = hashingService.snapshotHash(
                clientId, depth, sinceAt, ranked.stream().map(RankedCandidate::id).toList());

        Optional<SinceLastReadPayload> cached = cacheService.lookup(clientId, snapshotHash, depth);
        if (cached.isPresent()) {
            logger.debug("Serving cached snapshot {} for {}", snapshotHash, clientId);
            SinceLastReadPayload hydrated = hydrate(cached.get(), clientId, depth, lastSeenAt, sinceAt, now, snapshotHash);
            stateService.touch(clientId, depth, snapshotHash);
            return hydrated;
        }

        Set<String> changedThreadKeys = new LinkedHashSet<>();
        ranked.forEach(item -> changedThreadKeys.add(item.threadKey()));

        List<String> unchangedTitles = optional(
                () -> unchangedContextBuilder.unchangedTitles(sinceAt, changedThreadKeys), List.<String>of(), "unchanged context")
                .join();

        Brief fallback = FallbackBriefBuilder.build(highlights, unchangedTitles, depth, ranked.size(), lastSeenAt);
        GeneratedBrief generated = briefService.generate(depth, highlights, unchangedTitles, fallback, lastSeenAt);

        SinceLastReadPayload payload = SinceLastReadPayload.builder()
                .state(SnapshotState.builder()
                        .clientId(clientId)
                        .depth(depth)
                        .lastSeenAt(lastSeenAt)
                        .sinceAt(sinceAt)
                        .untilAt(now)
                        .isFirstVisit(lastSeenAt == null)
                        .cached(false)
                        .snapshotHash(snapshotHash)
                        .build())
                .counts(new SnapshotCounts(
                        ranked.size(),
                        changedThreadKeys.size(),
                        (int) ranked.stream().filter(RankedCandidate::hasWatchlistMatch).count()))
                .highlights(highlights)
                .brief(generated.brief())
                .citations(highlights.stream()
                        .limit(config.citationLimit())
                        .map(Citation::from)
                        .toList())
                .build();

        CompletableFuture.allOf(
                background(() -> cacheService.store(clientId, snapshotHash, depth, sinceAt, now, payload,
                        generated.modelUsed(), generated.inputTokens(), generated.outputTokens()), "snapshot store"),
                background(() -> stateService.touch(clientId, depth, snapshotHash), "state touch"),
                background(cacheService::maybeCleanup, "snapshot cleanup")
        ).join();

        logger.info("Computed since-last-read for {} at {}: {} new, {} threads, model {}",
                clientId, depth.code(), ranked.size(), changedThreadKeys.size(), generated.modelUsed());
        return payload;
    }

    /**
     * Moves the client's watermark. See {@link ContinuityStateService#acknowledge}.
     */
    public ContinuityStateView acknowledge(String rawClientId, String rawDepth, String rawUntilAt) {
        return stateService.acknowledge(rawClientId, rawDepth, rawUntilAt);
    }

    /**
     * Adapts a cached payload to the current request: the request's depth limits, the
     * current watermark and window, and {@code cached = true}. The cached brief is kept.
     */
    static SinceLastReadPayload hydrate(SinceLastReadPayload cached,
                                        String clientId,
                                        Depth depth,
                                        OffsetDateTime lastSeenAt,
                                        OffsetDateTime sinceAt,
                                        OffsetDateTime untilAt,
                                        String snapshotHash) {
        DepthConfig config = depth.config();
        List<Highlight> highlights = cached.highlights().stream().limit(config.highlightLimit()).toList();
        List<Citation> citations = cached.citations().stream().limit(config.citationLimit()).toList();
        Brief brief = cached.brief() != null
                ? cached.brief()
                : FallbackBriefBuilder.build(highlights, List.of(), depth, highlights.size(), lastSeenAt);

        SnapshotState.SnapshotStateBuilder stateBuilder = cached.state() != null
                ? cached.state().toBuilder()
                : SnapshotState.builder().isFirstVisit(lastSeenAt == null);
        SnapshotState state = stateBuilder
                .clientId(clientId)
                .depth(depth)
                .lastSeenAt(lastSeenAt)
                .sinceAt(sinceAt)
                .untilAt(untilAt)
                .cached(true)
                .snapshotHash(snapshotHash)
                .build();

        return cached.toBuilder()
                .state(state)
                .highlights(highlights)
                .citations(citations)
                .brief(brief)
                .build();
    }

    private <T> CompletableFuture<T> optional(Supplier<T> read, T fallback, String label) {
        return CompletableFuture.supplyAsync(read, executor)
                .completeOnTimeout(fallback, ioTimeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    logger.warn("Optional {} read failed, continuing without it: {}", label, e.toString());
                    return fallback;
                });
    }

    private CompletableFuture<Void> background(Runnable task, String label) {
        return CompletableFuture.runAsync(task, executor)
                .exceptionally(e -> {
                    logger.warn("{} failed: {}", label, e.toString());
                    return null;
                });
    }

    private List<Candidate> fetchRequired(OffsetDateTime sinceAt) {
        try {
            return candidateFetcher.fetchDelta(sinceAt);
        } catch (CandidateStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CandidateStoreUnavailableException("Failed to fetch delta articles", e);
        }
    }
}

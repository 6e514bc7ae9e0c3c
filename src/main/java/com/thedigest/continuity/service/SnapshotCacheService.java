package com.thedigest.continuity.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thedigest.continuity.dto.SinceLastReadPayload;
import com.thedigest.continuity.model.ContinuitySnapshot;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.repository.ContinuitySnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Content-addressed cache of computed since-last-read payloads, keyed by
 * (client, snapshot hash, depth).
 *
 * Key goals:
 * - Best effort: read and write failures are logged and behave like a miss / no-op.
 * - Bounded: a low-probability inline sweep deletes rows past the retention window.
 */
@Service
public class SnapshotCacheService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotCacheService.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ContinuitySnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final Duration retention;
    private final double cleanupProbability;
    private final DoubleSupplier random;

    @Autowired
    public SnapshotCacheService(ContinuitySnapshotRepository snapshotRepository,
                                ObjectMapper objectMapper,
                                Clock clock,
                                @Value("${app.continuity.snapshot-ttl-minutes:15}") long ttlMinutes,
                                @Value("${app.continuity.snapshot-retention-days:14}") long retentionDays,
                                @Value("${app.continuity.cleanup-probability:0.08}") double cleanupProbability) {
        this(snapshotRepository, objectMapper, clock, Duration.ofMinutes(ttlMinutes), Duration.ofDays(retentionDays),
                cleanupProbability, () -> ThreadLocalRandom.current().nextDouble());
    }

    SnapshotCacheService(ContinuitySnapshotRepository snapshotRepository,
                         ObjectMapper objectMapper,
                         Clock clock,
                         Duration ttl,
                         Duration retention,
                         double cleanupProbability,
                         DoubleSupplier random) {
        this.snapshotRepository = snapshotRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = ttl;
        this.retention = retention;
        this.cleanupProbability = cleanupProbability;
        this.random = random;
    }

    /**
     * Returns the payload stored for the key if it was generated within the TTL.
     */
    public Optional<SinceLastReadPayload> lookup(String clientId, String snapshotHash, Depth depth) {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(ttl);
        Optional<ContinuitySnapshot> row;
        try {
            row = snapshotRepository
                    .findFirstByClientIdAndSnapshotHashAndDepthAndGeneratedAtGreaterThanEqualOrderByGeneratedAtDesc(
                            clientId, snapshotHash, depth.code(), cutoff);
        } catch (DataAccessException e) {
            logger.error("Snapshot cache read failed for {}: {}", clientId, e.getMessage());
            return Optional.empty();
        }
        if (row.isEmpty() || row.get().getPayload() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.convertValue(row.get().getPayload(), SinceLastReadPayload.class));
        } catch (IllegalArgumentException e) {
            logger.warn("Discarding unreadable cached snapshot {} for {}: {}", snapshotHash, clientId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Upserts the payload for the key, replacing any earlier entry.
     */
    public void store(String clientId,
                      String snapshotHash,
                      Depth depth,
                      OffsetDateTime sinceAt,
                      OffsetDateTime untilAt,
                      SinceLastReadPayload payload,
                      String modelUsed,
                      int inputTokens,
                      int outputTokens) {
        try {
            ContinuitySnapshot snapshot = new ContinuitySnapshot();
            snapshot.setClientId(clientId);
            snapshot.setSnapshotHash(snapshotHash);
            snapshot.setDepth(depth.code());
            snapshot.setSinceAt(sinceAt);
            snapshot.setUntilAt(untilAt);
            snapshot.setPayload(objectMapper.convertValue(payload, PAYLOAD_TYPE));
            snapshot.setModelUsed(modelUsed);
            snapshot.setInputTokens(inputTokens);
            snapshot.setOutputTokens(outputTokens);
            snapshot.setGeneratedAt(OffsetDateTime.now(clock));
            snapshotRepository.save(snapshot);
        } catch (DataAccessException | IllegalArgumentException e) {
            logger.error("Snapshot cache write failed for {}: {}", clientId, e.getMessage());
        }
    }

    /**
     * Occasionally deletes snapshots older than the retention window.
     *
     * @return rows deleted; 0 when the sweep was skipped
     */
    public int maybeCleanup() {
        if (random.getAsDouble() >= cleanupProbability) {
            return 0;
        }
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(retention);
        try {
            int deleted = snapshotRepository.deleteGeneratedBefore(cutoff);
            if (deleted > 0) {
                logger.info("Snapshot cache sweep removed {} entries older than {}.", deleted, cutoff);
            }
            return deleted;
        } catch (DataAccessException e) {
            logger.warn("Snapshot cache sweep failed: {}", e.getMessage());
            return 0;
        }
    }
}

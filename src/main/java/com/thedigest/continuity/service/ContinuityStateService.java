package com.thedigest.continuity.service;

import com.thedigest.continuity.dto.ContinuityStateView;
import com.thedigest.continuity.model.ContinuityState;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.repository.ContinuityStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Owns the per-client continuity row.
 *
 * Writes are targeted updates (upsert on miss) rather than read-modify-write, so a
 * concurrent snapshot touch can never roll back a watermark set by an acknowledgment.
 * Every persistence failure is logged and the in-memory value is used instead.
 */
@Service
public class ContinuityStateService {

    private static final Logger logger = LoggerFactory.getLogger(ContinuityStateService.class);

    private final ContinuityStateRepository stateRepository;
    private final Clock clock;
    private final Depth defaultDepth;

    public ContinuityStateService(ContinuityStateRepository stateRepository,
                                  Clock clock,
                                  @Value("${app.continuity.default-depth:shallow}") String defaultDepth) {
        this.stateRepository = stateRepository;
        this.clock = clock;
        this.defaultDepth = Depth.parse(defaultDepth).orElse(Depth.SHALLOW);
    }

    public Depth defaultDepth() {
        return defaultDepth;
    }

    /**
     * Loads the client's state, creating it (no watermark, default depth) on first contact.
     */
    public ContinuityState resolve(String clientId) {
        ContinuityState fallback = new ContinuityState(clientId, defaultDepth);
        try {
            Optional<ContinuityState> existing = stateRepository.findById(clientId);
            if (existing.isPresent()) {
                ContinuityState state = existing.get();
                if (state.getPreferredDepth() == null) {
                    state.setPreferredDepth(defaultDepth);
                }
                return state;
            }
        } catch (DataAccessException e) {
            logger.error("Failed to fetch continuity state for {}: {}", clientId, e.getMessage());
            return fallback;
        }

        try {
            return stateRepository.save(fallback);
        } catch (DataIntegrityViolationException race) {
            return findOrDefault(clientId, fallback);
        } catch (DataAccessException e) {
            logger.error("Failed to create continuity state for {}: {}", clientId, e.getMessage());
            return fallback;
        }
    }

    /**
     * Marks everything up to {@code untilAt} as seen. A missing, unparseable or future
     * {@code untilAt} becomes now. Last write wins; repeating a call is a no-op.
     *
     * @param rawClientId caller supplied client id
     * @param rawDepth    depth to remember; when absent the stored preference is kept
     * @param rawUntilAt  ISO-8601 watermark
     */
    public ContinuityStateView acknowledge(String rawClientId, String rawDepth, String rawUntilAt) {
        String clientId = ClientIds.normalize(rawClientId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime lastSeenAt = clampWatermark(parseTimestamp(rawUntilAt), now);
        Depth depth = Depth.parse(rawDepth).orElseGet(() -> storedPreference(clientId));

        try {
            int updated = stateRepository.updateWatermark(clientId, lastSeenAt, depth, now);
            if (updated == 0) {
                ContinuityState created = new ContinuityState(clientId, depth);
                created.setLastSeenAt(lastSeenAt);
                try {
                    stateRepository.save(created);
                } catch (DataIntegrityViolationException race) {
                    // another request created the row first
                    stateRepository.updateWatermark(clientId, lastSeenAt, depth, now);
                }
            }
            logger.info("Continuity watermark for {} advanced to {} ({}).", clientId, lastSeenAt, depth.code());
        } catch (DataAccessException e) {
            logger.error("Failed to acknowledge continuity checkpoint for {}: {}", clientId, e.getMessage());
        }
        return new ContinuityStateView(clientId, lastSeenAt, depth);
    }

    /**
     * Records the depth and snapshot actually served. Leaves the watermark alone.
     */
    public void touch(String clientId, Depth depth, String snapshotHash) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            int updated = stateRepository.updateSnapshotTouch(clientId, depth, snapshotHash, now);
            if (updated == 0) {
                ContinuityState created = new ContinuityState(clientId, depth);
                created.setLastSnapshotHash(snapshotHash);
                created.setLastSnapshotGeneratedAt(now);
                try {
                    stateRepository.save(created);
                } catch (DataIntegrityViolationException race) {
                    stateRepository.updateSnapshotTouch(clientId, depth, snapshotHash, now);
                }
            }
        } catch (DataAccessException e) {
            logger.error("Failed to update continuity state for {}: {}", clientId, e.getMessage());
        }
    }

    private ContinuityState findOrDefault(String clientId, ContinuityState fallback) {
        try {
            return stateRepository.findById(clientId).orElse(fallback);
        } catch (DataAccessException e) {
            logger.error("Failed to re-read continuity state for {}: {}", clientId, e.getMessage());
            return fallback;
        }
    }

    private Depth storedPreference(String clientId) {
        try {
            return stateRepository.findById(clientId)
                    .map(ContinuityState::getPreferredDepth)
                    .orElse(defaultDepth);
        } catch (DataAccessException e) {
            logger.debug("Could not read stored depth for {}, using default: {}", clientId, e.getMessage());
            return defaultDepth;
        }
    }

    static OffsetDateTime clampWatermark(OffsetDateTime requested, OffsetDateTime now) {
        if (requested == null || requested.isAfter(now)) {
            return now;
        }
        return requested;
    }

    static OffsetDateTime parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                logger.debug("Ignoring unparseable watermark '{}'", value);
                return null;
            }
        }
    }
}

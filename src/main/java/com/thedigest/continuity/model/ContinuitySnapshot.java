package com.thedigest.continuity.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Cached since-last-read payload for one (client, candidate set, depth) combination.
 * {@code generatedAt} drives both the TTL lookup and the retention sweep.
 */
@Setter
@Getter
@Entity
@Table(name = "continuity_snapshots")
@IdClass(ContinuitySnapshotId.class)
public class ContinuitySnapshot {

    @Id
    @Column(name = "client_id", nullable = false, length = 120)
    private String clientId;

    @Id
    @Column(name = "snapshot_hash", nullable = false, length = 64)
    private String snapshotHash;

    // depth code; enum converters do not apply to identifier attributes
    @Id
    @Column(name = "depth", nullable = false, length = 16)
    private String depth;

    @Column(name = "since_at", nullable = false)
    private OffsetDateTime sinceAt;

    @Column(name = "until_at", nullable = false)
    private OffsetDateTime untilAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false)
    private Map<String, Object> payload;

    @Column(name = "model_used")
    private String modelUsed;

    @Column(name = "input_tokens")
    private Integer inputTokens;

    @Column(name = "output_tokens")
    private Integer outputTokens;

    @Column(name = "generated_at", nullable = false)
    private OffsetDateTime generatedAt;
}

package com.thedigest.continuity.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Per-client continuity row. {@code lastSeenAt} only moves through an acknowledgment.
 */
@Setter
@Getter
@Entity
@Table(name = "continuity_state")
public class ContinuityState {

    @Id
    @Column(name = "client_id", nullable = false, length = 120)
    private String clientId;

    @Column(name = "last_seen_at")
    private OffsetDateTime lastSeenAt;

    @Column(name = "preferred_depth", nullable = false, length = 16)
    private Depth preferredDepth;

    @Column(name = "last_snapshot_hash", length = 64)
    private String lastSnapshotHash;

    @Column(name = "last_snapshot_generated_at")
    private OffsetDateTime lastSnapshotGeneratedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public ContinuityState() {
    }

    public ContinuityState(String clientId, Depth preferredDepth) {
        this.clientId = clientId;
        this.preferredDepth = preferredDepth;
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}

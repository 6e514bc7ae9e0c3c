package com.thedigest.continuity.repository;

import com.thedigest.continuity.model.ContinuityState;
import com.thedigest.continuity.model.Depth;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

@Repository
public interface ContinuityStateRepository extends JpaRepository<ContinuityState, String> {

    /**
     * Moves the watermark and preferred depth without touching snapshot bookkeeping.
     *
     * @return number of rows updated; 0 when the client has no row yet
     */
    @Transactional
    @Modifying
    @Query("update ContinuityState s set s.lastSeenAt = :lastSeenAt, s.preferredDepth = :depth, s.updatedAt = :updatedAt where s.clientId = :clientId")
    int updateWatermark(@Param("clientId") String clientId,
                        @Param("lastSeenAt") OffsetDateTime lastSeenAt,
                        @Param("depth") Depth depth,
                        @Param("updatedAt") OffsetDateTime updatedAt);

    /**
     * Records the snapshot last shown to the client; never touches the watermark.
     *
     * @return number of rows updated; 0 when the client has no row yet
     */
    @Transactional
    @Modifying
    @Query("update ContinuityState s set s.preferredDepth = :depth, s.lastSnapshotHash = :snapshotHash, s.lastSnapshotGeneratedAt = :generatedAt, s.updatedAt = :generatedAt where s.clientId = :clientId")
    int updateSnapshotTouch(@Param("clientId") String clientId,
                            @Param("depth") Depth depth,
                            @Param("snapshotHash") String snapshotHash,
                            @Param("generatedAt") OffsetDateTime generatedAt);
}

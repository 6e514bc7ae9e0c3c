package com.thedigest.continuity.repository;

import com.thedigest.continuity.model.ContinuitySnapshot;
import com.thedigest.continuity.model.ContinuitySnapshotId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface ContinuitySnapshotRepository extends JpaRepository<ContinuitySnapshot, ContinuitySnapshotId> {

    /**
     * Finds the newest snapshot for the key that was generated at or after the cutoff.
     */
    Optional<ContinuitySnapshot> findFirstByClientIdAndSnapshotHashAndDepthAndGeneratedAtGreaterThanEqualOrderByGeneratedAtDesc(
            String clientId, String snapshotHash, String depth, OffsetDateTime cutoff);

    /**
     * Deletes every snapshot generated before the cutoff.
     */
    @Transactional
    @Modifying
    @Query("delete from ContinuitySnapshot s where s.generatedAt < :cutoff")
    int deleteGeneratedBefore(@Param("cutoff") OffsetDateTime cutoff);
}

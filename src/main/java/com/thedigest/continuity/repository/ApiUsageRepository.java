package com.thedigest.continuity.repository;

import com.thedigest.continuity.model.ApiUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

@Repository
public interface ApiUsageRepository extends JpaRepository<ApiUsage, LocalDate> {

    /**
     * Adds one call's usage to the day's row in place.
     *
     * @return number of rows updated; 0 when the day has no row yet
     */
    @Transactional
    @Modifying
    @Query("""
            update ApiUsage u
            set u.inputTokens = u.inputTokens + :inputTokens,
                u.outputTokens = u.outputTokens + :outputTokens,
                u.costCents = u.costCents + :costCents,
                u.callCount = u.callCount + 1
            where u.usageDate = :usageDate
            """)
    int addUsage(@Param("usageDate") LocalDate usageDate,
                 @Param("inputTokens") long inputTokens,
                 @Param("outputTokens") long outputTokens,
                 @Param("costCents") long costCents);
}

package org.healthplatform.warehouse.repository;

import org.healthplatform.warehouse.entity.LifeExpectancyEntry;
import org.healthplatform.warehouse.entity.LifeExpectancyEntryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for loaded life expectancy rows.
 * Each batch is identified by the ingested_at stamp of the run that loaded it.
 */
@Repository
public interface LifeExpectancyRepository extends JpaRepository<LifeExpectancyEntry, LifeExpectancyEntryId> {

    /**
     * Count the rows of one batch
     */
    long countByIngestedAt(LocalDateTime ingestedAt);

    /**
     * Stamp of the most recently loaded batch
     */
    @Query("SELECT MAX(e.ingestedAt) FROM LifeExpectancyEntry e")
    Optional<LocalDateTime> findLatestIngestedAt();

    /**
     * One country's series from the most recent batch, oldest year first
     */
    @Query("SELECT e FROM LifeExpectancyEntry e WHERE e.countryCode = :countryCode "
        + "AND e.ingestedAt = (SELECT MAX(x.ingestedAt) FROM LifeExpectancyEntry x) ORDER BY e.year")
    List<LifeExpectancyEntry> findLatestSeries(@Param("countryCode") String countryCode);
}

package com.example.slotnotifier.domain.repository;

import com.example.slotnotifier.domain.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ScheduledJob entity.
 * <p>
 * Due jobs are selected with FOR UPDATE SKIP LOCKED so that instances polling
 * at the same moment never pick the same row; the fire lock columns then keep
 * the job reserved for the whole fire.
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    /**
     * Jobs whose next fire time has passed and that no live fire holds.
     * Oldest due first.
     */
    @Query(value = """
            SELECT j.* FROM scheduled_jobs j
            WHERE j.next_fire_time <= :now
              AND (j.locked_by IS NULL OR j.locked_until < :now)
            ORDER BY j.next_fire_time ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<ScheduledJob> findDueJobs(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Reserve a job for one fire.
     *
     * @return 1 if this instance now holds the fire lock, 0 otherwise
     */
    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.lockedBy = :instanceId,
                j.lockedUntil = :lockUntil,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND (j.lockedBy IS NULL OR j.lockedUntil < :now)
            """)
    int acquireFireLock(
            @Param("jobId") String jobId,
            @Param("instanceId") String instanceId,
            @Param("lockUntil") Instant lockUntil,
            @Param("now") Instant now);

    /**
     * Give a reserved job back without firing it
     */
    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND j.lockedBy = :instanceId
            """)
    int releaseFireLock(@Param("jobId") String jobId, @Param("instanceId") String instanceId, @Param("now") Instant now);

    /**
     * Jobs whose fire lock expired before the threshold, typically left behind by a crashed instance
     */
    @Query("""
            SELECT j FROM ScheduledJob j
            WHERE j.lockedBy IS NOT NULL
              AND j.lockedUntil < :threshold
            """)
    List<ScheduledJob> findStaleJobs(@Param("threshold") Instant threshold);

    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.updatedAt = :now
            WHERE j.id IN :jobIds
            """)
    int resetStaleLocks(@Param("jobIds") List<String> jobIds, @Param("now") Instant now);

    /**
     * Delete a job by id.
     *
     * @return number of rows removed, 0 when no such job existed
     */
    @Query("SELECT j.id FROM ScheduledJob j")
    List<String> findAllJobIds();

    @Modifying
    @Query("DELETE FROM ScheduledJob j WHERE j.id = :jobId")
    int deleteJobById(@Param("jobId") String jobId);
}

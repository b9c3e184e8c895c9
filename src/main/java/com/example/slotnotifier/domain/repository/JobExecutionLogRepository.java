package com.example.slotnotifier.domain.repository;

import com.example.slotnotifier.domain.entity.JobExecutionLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobExecutionLogRepository extends JpaRepository<JobExecutionLog, UUID> {

    List<JobExecutionLog> findByJobIdOrderByStartedAtDesc(String jobId, Pageable pageable);

    /**
     * Purge history older than the retention cutoff
     */
    @Modifying
    @Query("DELETE FROM JobExecutionLog l WHERE l.startedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}

package com.example.slotnotifier.service.executor;

import com.example.slotnotifier.config.SlotNotifierProperties;
import com.example.slotnotifier.domain.entity.ScheduledJob;
import com.example.slotnotifier.domain.repository.JobExecutionLogRepository;
import com.example.slotnotifier.domain.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Finds due jobs and hands them to the worker pool.
 * <p>
 * Flow:
 * 1. Poll job runs every few seconds on one instance (ShedLock)
 * 2. Claims a batch of due jobs (FOR UPDATE SKIP LOCKED plus the fire lock)
 * 3. Dispatches each claimed job to the {@link JobRegistry}
 * 4. Returns without waiting; each fire re-arms its own job
 * <p>
 * Also clears fire locks left behind by crashed instances and purges old
 * execution history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPollingService {

    private final ScheduledJobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final JobFireService jobFireService;
    private final JobRegistry jobRegistry;
    private final SlotNotifierProperties properties;
    private final Clock clock;

    private final AtomicBoolean isPolling = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${slot-notifier.poll-interval-ms:15000}")
    @SchedulerLock(name = "jobPollingCycle", lockAtLeastFor = "5s", lockAtMostFor = "2m")
    public void pollDueJobs() {
        if (!jobRegistry.isRunning()) {
            log.debug("Job registry not running, skipping poll");
            return;
        }
        if (!isPolling.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var claimed = jobFireService.claimDueJobs(properties.getBatchSize());
            if (claimed.isEmpty()) {
                log.debug("No jobs due");
                return;
            }

            log.info("Claimed {} due jobs", claimed.size());
            var dispatched = claimed.stream().filter(this::dispatch).count();
            log.info("Dispatched {} of {} due jobs", dispatched, claimed.size());
        } catch (Exception e) {
            log.error("Error in polling cycle: {}", e.getMessage(), e);
        } finally {
            isPolling.set(false);
        }
    }

    private boolean dispatch(ScheduledJob job) {
        var jobId = job.getId();
        try {
            if (jobRegistry.dispatch(jobId, () -> jobFireService.onFire(jobId))) {
                return true;
            }
            jobFireService.releaseFireLock(jobId);
        } catch (Exception e) {
            log.error("Error dispatching job {}: {}", jobId, e.getMessage(), e);
        }
        return false;
    }

    /**
     * Release fire locks that expired long ago, typically left by an instance
     * that died mid-fire. The job becomes due again on the next poll.
     */
    @Scheduled(fixedDelayString = "${slot-notifier.stale-job-check-interval-ms:300000}")
    @SchedulerLock(name = "staleJobCleanup", lockAtLeastFor = "30s", lockAtMostFor = "5m")
    @Transactional
    public void cleanupStaleJobs() {
        try {
            var now = clock.instant();
            var threshold = now.minus(Duration.ofMinutes(properties.getStaleJobThresholdMinutes()));
            var staleIds = jobRepository.findStaleJobs(threshold).stream()
                    .map(ScheduledJob::getId)
                    .filter(jobId -> !jobRegistry.isInFlight(jobId))
                    .toList();

            if (staleIds.isEmpty()) {
                log.debug("No stale jobs found");
                return;
            }

            log.warn("Found {} jobs with stale fire locks, releasing", staleIds.size());
            var resetCount = jobRepository.resetStaleLocks(staleIds, now);
            log.info("Released {} stale fire locks", resetCount);
        } catch (Exception e) {
            log.error("Error cleaning up stale jobs: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${slot-notifier.log-purge-cron:0 30 3 * * *}", zone = "${slot-notifier.time-zone:Asia/Kolkata}")
    @SchedulerLock(name = "executionLogPurge", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    @Transactional
    public void purgeExecutionLogs() {
        try {
            var cutoff = clock.instant().minus(Duration.ofDays(properties.getExecutionLogRetentionDays()));
            var deleted = executionLogRepository.deleteOlderThan(cutoff);
            log.info("Purged {} execution log entries older than {}", deleted, cutoff);
        } catch (Exception e) {
            log.error("Error purging execution logs: {}", e.getMessage(), e);
        }
    }
}

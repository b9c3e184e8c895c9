package com.example.slotnotifier.service.executor;

import com.example.slotnotifier.config.DeliveryProperties;
import com.example.slotnotifier.config.MetricsConfig;
import com.example.slotnotifier.config.SlotNotifierProperties;
import com.example.slotnotifier.domain.entity.JobExecutionLog;
import com.example.slotnotifier.domain.entity.ScheduledJob;
import com.example.slotnotifier.domain.enums.FireOutcome;
import com.example.slotnotifier.domain.repository.JobExecutionLogRepository;
import com.example.slotnotifier.domain.repository.ScheduledJobRepository;
import com.example.slotnotifier.service.PlayerNotificationService;
import com.example.slotnotifier.service.alert.SlackAlertService;
import com.example.slotnotifier.source.PreferenceSource;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one fire of a notification job.
 * <p>
 * Handles:
 * - Fire lock acquisition and release
 * - Re-reading the job and the player's current preferences
 * - Misfire detection
 * - The notification pipeline and its outcome
 * - Execution logging and metrics
 * - Re-arming the job for its next occurrence
 * <p>
 * Nothing thrown inside a fire escapes {@link #onFire(String)}; a failed
 * fire is logged and the job stays scheduled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobFireService {

    private final ScheduledJobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final PreferenceSource preferenceSource;
    private final PlayerNotificationService notificationService;
    private final JobRegistry jobRegistry;
    private final TransactionTemplate transactionTemplate;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final SlotNotifierProperties properties;
    private final DeliveryProperties deliveryProperties;
    private final Clock clock;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    @PostConstruct
    void initInstanceId() {
        try {
            instanceId = InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
        } catch (Exception e) {
            instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
        log.info("Fire lock owner id: {}", instanceId);
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * Select due jobs and take the fire lock on each in one transaction, so
     * the row locks from SKIP LOCKED cover the whole claim. Jobs already
     * firing on this instance are left alone.
     */
    @Transactional
    public List<ScheduledJob> claimDueJobs(int limit) {
        var now = clock.instant();
        var lockUntil = now.plus(Duration.ofMinutes(properties.getLockDurationMinutes()));
        var claimed = new ArrayList<ScheduledJob>();

        for (var job : jobRepository.findDueJobs(now, limit)) {
            if (jobRegistry.isInFlight(job.getId())) {
                log.debug("Job {} is still firing, skipping", job.getId());
                continue;
            }
            if (job.isLocked(now)) {
                log.debug("Job {} is held by {} until {}, skipping", job.getId(), job.getLockedBy(), job.getLockedUntil());
                continue;
            }
            if (jobRepository.acquireFireLock(job.getId(), instanceId, lockUntil, now) == 1) {
                claimed.add(job);
            } else {
                log.debug("Job {} is locked by another fire", job.getId());
            }
        }
        return claimed;
    }

    @Transactional
    public void releaseFireLock(String jobId) {
        jobRepository.releaseFireLock(jobId, instanceId, clock.instant());
    }

    /**
     * Execute one occurrence of a job. The job and the player are re-read, so
     * a fire never acts on data captured when the job was scheduled.
     */
    public FireOutcome onFire(String jobId) {
        var job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.info("Job {} was cancelled before it fired", jobId);
            return null;
        }

        var timerSample = metricsConfig.startFireTimer();
        var startedAt = clock.instant();
        var executionLog = JobExecutionLog.builder()
                .jobId(jobId)
                .userIdentity(job.getUserIdentity())
                .scheduledFor(job.getNextFireTime())
                .executorInstance(instanceId)
                .startedAt(startedAt)
                .build();

        FireOutcome outcome;
        try {
            outcome = fire(job, startedAt, executionLog);
        } catch (Exception e) {
            log.error("Fire of job {} failed: {}", jobId, e.getMessage(), e);
            executionLog.setErrorMessage(e.getMessage());
            executionLog.setErrorType(e.getClass().getSimpleName());
            outcome = FireOutcome.FAILED;
        } finally {
            rearm(jobId, startedAt);
        }

        executionLog.complete(outcome, clock.instant());
        saveExecutionLog(executionLog);
        metricsConfig.recordFire(timerSample, outcome);

        log.info("Fire of job {} finished: {} in {} ms", jobId, outcome, executionLog.getDurationMs());
        return outcome;
    }

    private FireOutcome fire(ScheduledJob job, Instant startedAt, JobExecutionLog executionLog) {
        if (isMisfire(job, startedAt)) {
            log.warn("Job {} was due at {}, more than {} minutes ago; skipping this occurrence",
                    job.getId(), job.getNextFireTime(), properties.getMisfireGraceMinutes());
            return FireOutcome.SKIPPED_MISFIRE;
        }

        var player = preferenceSource.findByIdentity(job.getUserIdentity());
        if (player.isEmpty()) {
            log.warn("Player {} of job {} not found in the preference source, skipping", job.getUserIdentity(), job.getId());
            return FireOutcome.SKIPPED_PLAYER_NOT_FOUND;
        }

        log.info("Firing job {} for {}", job.getId(), job.getUserIdentity());
        var deadline = startedAt.plus(deliveryProperties.getFireDeadline());
        var result = notificationService.notifyPlayer(player.get(), deadline);

        executionLog.setMatchedSlotCount(result.getMatchedSlotCount());
        executionLog.setDeliveryAttempts(result.getAttempts());
        if (result.isDelivered()) {
            return FireOutcome.DELIVERED;
        }

        executionLog.setErrorMessage(result.getError());
        slackAlertService.sendDeliveryFailedAlert(job.getId(), job.getUserIdentity(), result.getAttempts(), result.getError());
        return FireOutcome.DELIVERY_FAILED;
    }

    private boolean isMisfire(ScheduledJob job, Instant startedAt) {
        var dueAt = job.getNextFireTime();
        return dueAt != null && Duration.between(dueAt, startedAt).compareTo(Duration.ofMinutes(properties.getMisfireGraceMinutes())) > 0;
    }

    /**
     * Compute the next fire time and release the fire lock. A job deleted or
     * taken over while firing is left as it is.
     */
    void rearm(String jobId, Instant firedAt) {
        try {
            jobRegistry.withJobLock(jobId, () -> transactionTemplate.execute(status -> {
                var current = jobRepository.findById(jobId);
                if (current.isEmpty()) {
                    log.debug("Job {} was cancelled while firing, nothing to re-arm", jobId);
                    return null;
                }
                var job = current.get();
                if (!instanceId.equals(job.getLockedBy())) {
                    log.warn("Fire lock on job {} is no longer held by {}, not re-arming", jobId, instanceId);
                    return null;
                }
                var next = job.toTriggerSpec().nextFireAfter(ZonedDateTime.now(clock)).toInstant();
                job.setNextFireTime(next);
                job.setLastFiredAt(firedAt);
                job.setFireCount(job.getFireCount() + 1);
                job.setLockedBy(null);
                job.setLockedUntil(null);
                jobRepository.save(job);
                log.debug("Job {} re-armed for {}", jobId, next);
                return null;
            }));
        } catch (Exception e) {
            log.error("Failed to re-arm job {}, the stale lock cleanup will release it: {}", jobId, e.getMessage(), e);
        }
    }

    private void saveExecutionLog(JobExecutionLog executionLog) {
        try {
            executionLogRepository.save(executionLog);
        } catch (Exception e) {
            log.error("Failed to record execution of job {}: {}", executionLog.getJobId(), e.getMessage());
        }
    }
}

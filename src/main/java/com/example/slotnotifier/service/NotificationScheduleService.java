package com.example.slotnotifier.service;

import com.example.slotnotifier.config.MetricsConfig;
import com.example.slotnotifier.domain.entity.ScheduledJob;
import com.example.slotnotifier.domain.enums.Frequency;
import com.example.slotnotifier.domain.model.PlayerPreference;
import com.example.slotnotifier.domain.model.TriggerSpec;
import com.example.slotnotifier.domain.repository.JobExecutionLogRepository;
import com.example.slotnotifier.domain.repository.ScheduledJobRepository;
import com.example.slotnotifier.dto.JobExecutionLogResponse;
import com.example.slotnotifier.dto.ReconcileResult;
import com.example.slotnotifier.dto.ScheduledJobResponse;
import com.example.slotnotifier.exception.InvalidFrequencyException;
import com.example.slotnotifier.exception.InvalidTimeException;
import com.example.slotnotifier.exception.JobPersistenceException;
import com.example.slotnotifier.exception.PlayerNotFoundException;
import com.example.slotnotifier.mapper.ScheduledJobMapper;
import com.example.slotnotifier.service.executor.JobRegistry;
import com.example.slotnotifier.service.resolver.ScheduleResolver;
import com.example.slotnotifier.source.IdentityNormalizer;
import com.example.slotnotifier.source.PreferenceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Service for managing players' notification jobs.
 * <p>
 * Scheduling is an upsert keyed by the player: the trigger is resolved
 * first, so invalid input never touches the store, and the write runs
 * under the job's mutation lock inside one transaction. Scheduling the
 * same player twice leaves one job with the second trigger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationScheduleService {

    private final ScheduledJobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final PreferenceSource preferenceSource;
    private final IdentityNormalizer identityNormalizer;
    private final JobRegistry jobRegistry;
    private final TransactionTemplate transactionTemplate;
    private final ScheduledJobMapper mapper;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Install or replace the player's recurring job.
     *
     * @return the job id
     * @throws InvalidFrequencyException for an unknown frequency label
     * @throws InvalidTimeException      for an unreadable notification time
     * @throws JobPersistenceException   when the job store write fails
     */
    public String schedule(PlayerPreference player) {
        var identity = identityNormalizer.normalize(player.getIdentity());
        if (identity == null) {
            throw new IllegalArgumentException("Player identity is required");
        }
        var frequency = ScheduleResolver.resolveFrequency(player.getNotificationFrequency());
        var time = ScheduleResolver.parseTimeOfDay(player.getNotificationTime());
        var trigger = TriggerSpec.of(frequency.getDays(), time, clock.getZone());
        var jobId = ScheduledJob.jobIdFor(identity);

        try {
            return jobRegistry.withJobLock(jobId, () -> transactionTemplate.execute(status ->
                    install(jobId, identity, frequency, player.getNotificationTime(), trigger)));
        } catch (DataAccessException | TransactionException e) {
            throw new JobPersistenceException(jobId, "schedule", e);
        }
    }

    private String install(String jobId, String identity, Frequency frequency, String notificationTime, TriggerSpec trigger) {
        var nextFireTime = trigger.nextFireAfter(ZonedDateTime.now(clock)).toInstant();
        var existing = jobRepository.findById(jobId);
        var job = existing.orElseGet(() -> ScheduledJob.builder()
                .id(jobId)
                .userIdentity(identity)
                .build());
        job.applyTrigger(trigger, frequency, notificationTime, nextFireTime);
        jobRepository.save(job);

        if (existing.isPresent()) {
            log.info("Replaced trigger of job {}: {} ({}), next fire at {}", jobId, trigger.toCronExpression(), frequency, nextFireTime);
        } else {
            log.info("Scheduled job {}: {} ({}), next fire at {}", jobId, trigger.toCronExpression(), frequency, nextFireTime);
        }
        return jobId;
    }

    /**
     * Schedule a player from their current record in the preference source
     */
    public String scheduleFromSource(String identity) {
        var normalized = identityNormalizer.normalize(identity);
        var player = preferenceSource.findByIdentity(normalized)
                .orElseThrow(() -> new PlayerNotFoundException(normalized));
        var missing = player.missingFields();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Player record of " + normalized + " is missing " + String.join(", ", missing));
        }
        return schedule(player);
    }

    /**
     * Remove the player's job. A fire already running completes but the job
     * is not re-armed.
     *
     * @return true when a job was removed, false when there was none
     */
    public boolean cancel(String identity) {
        var normalized = identityNormalizer.normalize(identity);
        if (normalized == null) {
            return false;
        }
        var jobId = ScheduledJob.jobIdFor(normalized);

        try {
            var removed = jobRegistry.withJobLock(jobId, () -> transactionTemplate.execute(status -> jobRepository.deleteJobById(jobId)));
            if (removed != null && removed > 0) {
                log.info("Cancelled job {}", jobId);
                return true;
            }
            log.debug("No job {} to cancel", jobId);
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw new JobPersistenceException(jobId, "cancel", e);
        }
    }

    /**
     * Schedule every valid record of a preference snapshot. Incomplete records
     * and records with an unknown frequency or unreadable time are skipped with
     * a warning; one bad record never stops the others.
     */
    public ReconcileResult reconcileAll(List<PlayerPreference> players) {
        var result = ReconcileResult.builder().totalRecords(players.size()).build();

        for (var player : players) {
            var missing = player.missingFields();
            if (!missing.isEmpty()) {
                log.warn("Skipping player record {}: missing {}", player.getIdentity(), missing);
                result.setSkipped(result.getSkipped() + 1);
                result.getProblems().add(player.getIdentity() + ": missing " + String.join(", ", missing));
                continue;
            }
            try {
                schedule(player);
                result.setScheduled(result.getScheduled() + 1);
            } catch (InvalidFrequencyException | InvalidTimeException | IllegalArgumentException e) {
                log.warn("Skipping player {}: {}", player.getIdentity(), e.getMessage());
                result.setSkipped(result.getSkipped() + 1);
                result.getProblems().add(player.getIdentity() + ": " + e.getMessage());
            } catch (JobPersistenceException e) {
                log.error("Failed to schedule player {}: {}", player.getIdentity(), e.getMessage());
                result.setFailed(result.getFailed() + 1);
                result.getProblems().add(player.getIdentity() + ": " + e.getMessage());
            }
        }

        log.info("Reconciled {} player records: {} scheduled, {} skipped, {} failed",
                result.getTotalRecords(), result.getScheduled(), result.getSkipped(), result.getFailed());
        metricsConfig.recordReconcile(result);
        return result;
    }

    /**
     * Rebuild all jobs from the preference source, then remove the jobs of
     * players the source no longer lists. An empty snapshot removes nothing.
     */
    public ReconcileResult reconcileFromSource() {
        var players = preferenceSource.findAll();
        var result = reconcileAll(players);
        if (!players.isEmpty()) {
            removeOrphans(players, result);
        }
        return result;
    }

    private void removeOrphans(List<PlayerPreference> players, ReconcileResult result) {
        var listed = players.stream()
                .map(player -> identityNormalizer.normalize(player.getIdentity()))
                .filter(Objects::nonNull)
                .map(ScheduledJob::jobIdFor)
                .collect(Collectors.toSet());

        var removed = 0;
        for (var jobId : jobRepository.findAllJobIds()) {
            if (listed.contains(jobId)) {
                continue;
            }
            try {
                var deleted = jobRegistry.withJobLock(jobId, () -> transactionTemplate.execute(status -> jobRepository.deleteJobById(jobId)));
                if (deleted != null && deleted > 0) {
                    log.info("Removed job {}: player no longer in the preference source", jobId);
                    removed++;
                }
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to remove orphan job {}: {}", jobId, e.getMessage());
                result.setFailed(result.getFailed() + 1);
                result.getProblems().add(jobId + ": orphan job not removed: " + e.getMessage());
            }
        }

        if (removed > 0) {
            result.setRemoved(removed);
            metricsConfig.recordOrphansRemoved(removed);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ScheduledJobResponse> getJob(String identity) {
        var normalized = identityNormalizer.normalize(identity);
        if (normalized == null) {
            return Optional.empty();
        }
        return jobRepository.findById(ScheduledJob.jobIdFor(normalized)).map(mapper::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<ScheduledJobResponse> listJobs(Pageable pageable) {
        return jobRepository.findAll(pageable).map(mapper::toResponse);
    }

    @Transactional(readOnly = true)
    public List<JobExecutionLogResponse> getExecutions(String identity, int limit) {
        var normalized = identityNormalizer.normalize(identity);
        if (normalized == null) {
            return List.of();
        }
        var logs = executionLogRepository.findByJobIdOrderByStartedAtDesc(ScheduledJob.jobIdFor(normalized), PageRequest.of(0, limit));
        return mapper.toLogResponses(logs);
    }
}

package com.example.slotnotifier.service.executor;

import com.example.slotnotifier.config.SlotNotifierProperties;
import com.example.slotnotifier.domain.entity.ScheduledJob;
import com.example.slotnotifier.domain.repository.JobExecutionLogRepository;
import com.example.slotnotifier.domain.repository.ScheduledJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobPollingService Tests")
class JobPollingServiceTest {

    private static final Instant NOW = Instant.parse("2024-12-05T04:30:00Z");

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private JobExecutionLogRepository executionLogRepository;

    @Mock
    private JobFireService jobFireService;

    private JobRegistry jobRegistry;
    private SlotNotifierProperties properties;
    private JobPollingService pollingService;

    @BeforeEach
    void setUp() {
        jobRegistry = new JobRegistry(2, Duration.ofMillis(500));
        properties = new SlotNotifierProperties();
        properties.setBatchSize(25);
        pollingService = new JobPollingService(jobRepository, executionLogRepository, jobFireService, jobRegistry,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        jobRegistry.shutdown();
    }

    private static ScheduledJob job(String identity) {
        return ScheduledJob.builder().id(ScheduledJob.jobIdFor(identity)).userIdentity(identity).build();
    }

    @Nested
    @DisplayName("pollDueJobs Tests")
    class PollDueJobsTests {

        @Test
        @DisplayName("Should dispatch every claimed job to the worker pool")
        void shouldDispatchClaimedJobs() {
            // Given
            jobRegistry.init();
            var first = job("+911111111111");
            var second = job("+912222222222");
            when(jobFireService.claimDueJobs(25)).thenReturn(List.of(first, second));

            // When
            pollingService.pollDueJobs();

            // Then
            verify(jobFireService, timeout(2000)).onFire(first.getId());
            verify(jobFireService, timeout(2000)).onFire(second.getId());
            verify(jobFireService, never()).releaseFireLock(first.getId());
        }

        @Test
        @DisplayName("Should do nothing when no job is due")
        void shouldHandleEmptyBatch() {
            jobRegistry.init();
            when(jobFireService.claimDueJobs(25)).thenReturn(List.of());

            pollingService.pollDueJobs();

            assertThat(jobRegistry.inFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should not claim jobs while the registry is not running")
        void shouldSkipWhenRegistryStopped() {
            pollingService.pollDueJobs();

            verifyNoInteractions(jobFireService);
        }

        @Test
        @DisplayName("Should release the fire lock of a job the registry refused")
        void shouldReleaseRefusedJob() throws InterruptedException {
            // Given
            jobRegistry.init();
            var busy = job("+911111111111");
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            jobRegistry.dispatch(busy.getId(), () -> {
                started.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            when(jobFireService.claimDueJobs(25)).thenReturn(List.of(busy));

            // When
            pollingService.pollDueJobs();
            release.countDown();

            // Then
            verify(jobFireService).releaseFireLock(busy.getId());
            verify(jobFireService, never()).onFire(busy.getId());
        }

        @Test
        @DisplayName("Should contain a failing claim")
        void shouldContainClaimFailure() {
            jobRegistry.init();
            when(jobFireService.claimDueJobs(anyInt())).thenThrow(new IllegalStateException("database down"));

            pollingService.pollDueJobs();

            verify(jobFireService).claimDueJobs(25);
        }
    }

    @Nested
    @DisplayName("cleanupStaleJobs Tests")
    class CleanupStaleJobsTests {

        @Test
        @DisplayName("Should release locks older than the stale threshold")
        void shouldResetStaleLocks() {
            // Given
            var stale = job("+911111111111");
            var threshold = NOW.minus(Duration.ofMinutes(properties.getStaleJobThresholdMinutes()));
            when(jobRepository.findStaleJobs(threshold)).thenReturn(List.of(stale));
            when(jobRepository.resetStaleLocks(List.of(stale.getId()), NOW)).thenReturn(1);

            // When
            pollingService.cleanupStaleJobs();

            // Then
            verify(jobRepository).resetStaleLocks(List.of(stale.getId()), NOW);
        }

        @Test
        @DisplayName("Should not touch the database when nothing is stale")
        void shouldSkipWhenNothingStale() {
            when(jobRepository.findStaleJobs(NOW.minus(Duration.ofMinutes(30)))).thenReturn(List.of());

            pollingService.cleanupStaleJobs();

            verify(jobRepository, never()).resetStaleLocks(anyList(), any());
        }
    }

    @Test
    @DisplayName("Should purge execution logs older than the retention period")
    void shouldPurgeOldExecutionLogs() {
        var cutoff = NOW.minus(Duration.ofDays(30));
        when(executionLogRepository.deleteOlderThan(cutoff)).thenReturn(4);

        pollingService.purgeExecutionLogs();

        verify(executionLogRepository).deleteOlderThan(cutoff);
    }
}

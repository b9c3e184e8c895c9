package com.example.slotnotifier.service.executor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobRegistry Tests")
class JobRegistryTest {

    private JobRegistry jobRegistry;

    @BeforeEach
    void setUp() {
        jobRegistry = new JobRegistry(4, Duration.ofMillis(200));
        jobRegistry.init();
    }

    @AfterEach
    void tearDown() {
        jobRegistry.shutdown();
    }

    @Nested
    @DisplayName("dispatch Tests")
    class DispatchTests {

        @Test
        @DisplayName("Should run the fire on a worker and clear it afterwards")
        void shouldRunFire() throws InterruptedException {
            // Given
            var done = new CountDownLatch(1);

            // When
            var accepted = jobRegistry.dispatch("+919876543210_notification", done::countDown);

            // Then
            assertThat(accepted).isTrue();
            assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
            waitUntilIdle();
            assertThat(jobRegistry.isInFlight("+919876543210_notification")).isFalse();
        }

        @Test
        @DisplayName("Should drop a second fire of a job that is still firing")
        void shouldCoalesceOverlappingFires() throws InterruptedException {
            // Given
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var runs = new AtomicInteger();
            Runnable slowFire = () -> {
                runs.incrementAndGet();
                started.countDown();
                awaitQuietly(release);
            };
            jobRegistry.dispatch("job-a", slowFire);
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            // When
            var second = jobRegistry.dispatch("job-a", slowFire);
            var other = jobRegistry.dispatch("job-b", () -> { });

            // Then
            assertThat(second).isFalse();
            assertThat(other).isTrue();
            assertThat(jobRegistry.isInFlight("job-a")).isTrue();

            release.countDown();
            waitUntilIdle();
            assertThat(runs.get()).isEqualTo(1);
            assertThat(jobRegistry.dispatch("job-a", () -> { })).isTrue();
        }

        @Test
        @DisplayName("Should clear the in-flight mark when the fire throws")
        void shouldClearInFlightOnFailure() throws InterruptedException {
            jobRegistry.dispatch("job-a", () -> {
                throw new IllegalStateException("boom");
            });

            waitUntilIdle();

            assertThat(jobRegistry.isInFlight("job-a")).isFalse();
        }

        @Test
        @DisplayName("Should refuse fires before init and after shutdown")
        void shouldRefuseWhenNotRunning() {
            var notStarted = new JobRegistry(1, Duration.ofMillis(100));
            assertThat(notStarted.isRunning()).isFalse();
            assertThat(notStarted.dispatch("job-a", () -> { })).isFalse();

            jobRegistry.shutdown();

            assertThat(jobRegistry.isRunning()).isFalse();
            assertThat(jobRegistry.dispatch("job-a", () -> { })).isFalse();
            assertThat(jobRegistry.isInFlight("job-a")).isFalse();
        }

        @Test
        @DisplayName("Should reject a second init")
        void shouldRejectSecondInit() {
            assertThatThrownBy(() -> jobRegistry.init())
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("withJobLock Tests")
    class WithJobLockTests {

        @Test
        @DisplayName("Should apply mutations of the same job one at a time")
        void shouldSerializeMutations() throws InterruptedException {
            // Given
            var active = new AtomicInteger();
            var overlapped = new AtomicBoolean();
            var order = Collections.synchronizedList(new ArrayList<Integer>());
            var threads = new ArrayList<Thread>();

            // When
            for (int i = 0; i < 8; i++) {
                var index = i;
                var thread = new Thread(() -> jobRegistry.withJobLock("job-a", () -> {
                    if (active.incrementAndGet() > 1) {
                        overlapped.set(true);
                    }
                    sleepQuietly(5);
                    order.add(index);
                    active.decrementAndGet();
                    return null;
                }));
                threads.add(thread);
                thread.start();
            }
            for (var thread : threads) {
                thread.join(2000);
            }

            // Then
            assertThat(overlapped.get()).isFalse();
            assertThat(order).hasSize(8);
            assertThat(jobRegistry.mutationLockCount()).isZero();
        }

        @Test
        @DisplayName("Should return the mutation's result")
        void shouldReturnResult() {
            assertThat(jobRegistry.withJobLock("job-a", () -> "installed")).isEqualTo("installed");
        }

        @Test
        @DisplayName("Should drop a job's lock once no mutation holds or waits for it")
        void shouldNotRetainLocksOfFinishedMutations() {
            // Given
            var applied = new AtomicInteger();

            // When
            for (int i = 0; i < 1000; i++) {
                var jobId = String.format("+9190000%05d_notification", i);
                jobRegistry.withJobLock(jobId, applied::incrementAndGet);
            }

            // Then
            assertThat(applied.get()).isEqualTo(1000);
            assertThat(jobRegistry.mutationLockCount()).isZero();
        }

        @Test
        @DisplayName("Should release the lock when the mutation throws")
        void shouldReleaseLockOnFailure() {
            assertThatThrownBy(() -> jobRegistry.withJobLock("job-a", () -> {
                throw new IllegalStateException("store down");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(jobRegistry.mutationLockCount()).isZero();
            assertThat(jobRegistry.withJobLock("job-a", () -> "installed")).isEqualTo("installed");
        }
    }

    @Nested
    @DisplayName("shutdown Tests")
    class ShutdownTests {

        @Test
        @DisplayName("Should interrupt fires still running after the wait")
        void shouldInterruptLongFires() throws InterruptedException {
            // Given
            var started = new CountDownLatch(1);
            var interrupted = new CountDownLatch(1);
            jobRegistry.dispatch("job-a", () -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                }
            });
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            // When
            jobRegistry.shutdown();

            // Then
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("Should be safe to call twice")
        void shouldAllowRepeatedShutdown() {
            jobRegistry.shutdown();
            jobRegistry.shutdown();

            assertThat(jobRegistry.isRunning()).isFalse();
        }
    }

    private void waitUntilIdle() throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (jobRegistry.inFlightCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

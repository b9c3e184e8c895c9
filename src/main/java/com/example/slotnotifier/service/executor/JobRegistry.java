package com.example.slotnotifier.service.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process side of the scheduler: the bounded worker pool fires run on,
 * the set of jobs currently firing, and one mutation lock per job id.
 * <p>
 * A job that is already firing is not dispatched again; the extra
 * occurrence is dropped. Writes to a job (schedule, cancel, re-arm) take
 * the job's mutation lock so they are applied one after another. A lock
 * exists only while some thread holds or waits for it.
 * <p>
 * Created and destroyed by the Spring context; {@link #init()} must run
 * before any dispatch.
 */
@Slf4j
public class JobRegistry {

    private final int workerPoolSize;
    private final Duration shutdownWait;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, MutationLock> mutationLocks = new ConcurrentHashMap<>();

    private volatile ExecutorService workers;

    public JobRegistry(int workerPoolSize, Duration shutdownWait) {
        this.workerPoolSize = workerPoolSize;
        this.shutdownWait = shutdownWait;
    }

    public synchronized void init() {
        if (workers != null) {
            throw new IllegalStateException("Job registry already initialized");
        }
        workers = Executors.newFixedThreadPool(workerPoolSize, new CustomizableThreadFactory("job-fire-"));
        log.info("Job registry started with {} workers", workerPoolSize);
    }

    /**
     * Run a fire on the worker pool without waiting for it.
     *
     * @return false when the job is already firing or the pool no longer accepts work
     */
    public boolean dispatch(String jobId, Runnable fire) {
        if (!isRunning()) {
            log.warn("Job registry not running, fire of {} dropped", jobId);
            return false;
        }
        if (!inFlight.add(jobId)) {
            log.debug("Job {} is still firing, occurrence coalesced", jobId);
            return false;
        }
        try {
            workers.execute(() -> {
                try {
                    fire.run();
                } finally {
                    inFlight.remove(jobId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            log.warn("Worker pool rejected fire of {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    /**
     * Apply a mutation to one job while holding that job's lock
     */
    public <T> T withJobLock(String jobId, Supplier<T> mutation) {
        var entry = mutationLocks.compute(jobId, (id, current) -> {
            var held = current != null ? current : new MutationLock();
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return mutation.get();
        } finally {
            entry.lock.unlock();
            mutationLocks.computeIfPresent(jobId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    int mutationLockCount() {
        return mutationLocks.size();
    }

    public boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isRunning() {
        var current = workers;
        return current != null && !current.isShutdown();
    }

    /**
     * Stop accepting fires, give running ones the configured time to finish,
     * then interrupt whatever is left.
     */
    public synchronized void shutdown() {
        var current = workers;
        if (current == null || current.isShutdown()) {
            return;
        }
        log.info("Shutting down job registry, {} fire(s) in flight", inFlight.size());
        current.shutdown();
        try {
            if (!current.awaitTermination(shutdownWait.toMillis(), TimeUnit.MILLISECONDS)) {
                var dropped = current.shutdownNow();
                log.warn("Fires still running after {}, interrupted them ({} queued fire(s) dropped)", shutdownWait, dropped.size());
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Guarded by the map's compute: {@code users} counts holders and waiters.
     */
    private static final class MutationLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}

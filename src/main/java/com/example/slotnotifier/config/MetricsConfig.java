package com.example.slotnotifier.config;

import com.example.slotnotifier.domain.enums.DeliveryStatus;
import com.example.slotnotifier.domain.enums.FireOutcome;
import com.example.slotnotifier.domain.repository.ScheduledJobRepository;
import com.example.slotnotifier.dto.ReconcileResult;
import com.example.slotnotifier.service.executor.JobRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring scheduler health and delivery.
 * <p>
 * Exposes Prometheus metrics for:
 * - Number of active jobs and fires in flight
 * - Fire duration by outcome
 * - Delivery attempts
 * - Reconciliation results
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ScheduledJobRepository jobRepository;
    private final JobRegistry jobRegistry;

    private final AtomicLong activeJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("slot_notifier_active_jobs", activeJobs, AtomicLong::get)
                .description("Number of scheduled notification jobs")
                .register(meterRegistry);

        Gauge.builder("slot_notifier_fires_in_flight", jobRegistry, JobRegistry::inFlightCount)
                .description("Number of fires currently running on this instance")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh the job count from the database
     */
    @Scheduled(fixedDelayString = "${slot-notifier.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        activeJobs.set(jobRepository.count());
    }

    public Timer.Sample startFireTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record how long a fire took and how it ended
     */
    public void recordFire(Timer.Sample sample, FireOutcome outcome) {
        sample.stop(Timer.builder("slot_notifier_fire_time")
                .tag("outcome", outcome.name().toLowerCase())
                .description("Time spent on one scheduled fire")
                .register(meterRegistry));
    }

    public void recordDelivery(DeliveryStatus status, int attempts) {
        meterRegistry.counter("slot_notifier_deliveries", "status", status.name().toLowerCase()).increment();
        meterRegistry.counter("slot_notifier_delivery_attempts").increment(attempts);
    }

    public void recordReconcile(ReconcileResult result) {
        meterRegistry.counter("slot_notifier_reconciled", "result", "scheduled").increment(result.getScheduled());
        meterRegistry.counter("slot_notifier_reconciled", "result", "skipped").increment(result.getSkipped());
        meterRegistry.counter("slot_notifier_reconciled", "result", "failed").increment(result.getFailed());
    }

    public void recordOrphansRemoved(int removed) {
        meterRegistry.counter("slot_notifier_reconciled", "result", "removed").increment(removed);
    }
}

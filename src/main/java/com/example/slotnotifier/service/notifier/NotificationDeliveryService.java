package com.example.slotnotifier.service.notifier;

import com.example.slotnotifier.config.DeliveryProperties;
import com.example.slotnotifier.exception.ExternalServiceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers rendered messages through the {@link MessageChannel} with a
 * bounded, fixed-delay retry.
 * <p>
 * Only transient provider failures are retried. A retry is never started
 * after the fire's deadline has passed or once the worker thread has been
 * interrupted by shutdown. The outcome is always returned, never thrown.
 */
@Slf4j
@Service
public class NotificationDeliveryService {

    private final MessageChannel channel;
    private final Clock clock;
    private final Retry retry;

    public NotificationDeliveryService(MessageChannel channel, DeliveryProperties properties, Clock clock) {
        this.channel = channel;
        this.clock = clock;
        this.retry = Retry.of("message-delivery", RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .waitDuration(properties.getRetryDelay())
                .retryOnException(NotificationDeliveryService::isTransient)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Delivery attempt {} via {} failed, retrying in {} ms: {}",
                        event.getNumberOfRetryAttempts(), channel.getName(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    public DeliveryOutcome deliver(String destination, String text) {
        return deliver(destination, text, null);
    }

    /**
     * @param deadline no attempt after the first one starts past this instant; null for no limit
     */
    public DeliveryOutcome deliver(String destination, String text, Instant deadline) {
        var attempts = new AtomicInteger();

        try {
            var messageId = Retry.decorateCallable(retry, () -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Delivery to " + destination + " interrupted");
                }
                if (attempts.get() > 0 && deadline != null && clock.instant().isAfter(deadline)) {
                    throw new CancellationException("Delivery deadline passed for " + destination);
                }
                attempts.incrementAndGet();
                return channel.send(destination, text);
            }).call();

            log.info("Delivered message to {} via {} after {} attempt(s)", destination, channel.getName(), attempts.get());
            return DeliveryOutcome.delivered(attempts.get(), messageId);
        } catch (Exception e) {
            log.error("Delivery to {} via {} failed after {} attempt(s): {}", destination, channel.getName(), attempts.get(), e.getMessage());
            return DeliveryOutcome.failed(attempts.get(), e);
        }
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof ExternalServiceException ese && ese.isRetryable();
    }
}

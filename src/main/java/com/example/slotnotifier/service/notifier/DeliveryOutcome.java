package com.example.slotnotifier.service.notifier;

import com.example.slotnotifier.domain.enums.DeliveryStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of delivering one message, including how many sends it took
 */
@Value
@Builder
public class DeliveryOutcome {

    DeliveryStatus status;
    int attempts;
    String messageId;
    String errorMessage;
    String errorType;

    public static DeliveryOutcome delivered(int attempts, String messageId) {
        return DeliveryOutcome.builder()
                .status(DeliveryStatus.DELIVERED)
                .attempts(attempts)
                .messageId(messageId)
                .build();
    }

    public static DeliveryOutcome failed(int attempts, Throwable error) {
        return DeliveryOutcome.builder()
                .status(DeliveryStatus.DELIVERY_FAILED)
                .attempts(attempts)
                .errorMessage(error.getMessage())
                .errorType(error.getClass().getSimpleName())
                .build();
    }

    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }
}

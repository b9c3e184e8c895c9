package com.example.slotnotifier.dto;

import com.example.slotnotifier.domain.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of composing, and optionally delivering, one notification.
 * Delivery fields stay empty for a preview.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResult {

    private String destination;
    private int matchedSlotCount;
    private String message;
    private DeliveryStatus deliveryStatus;
    private Integer attempts;
    private String error;

    public boolean isDelivered() {
        return deliveryStatus == DeliveryStatus.DELIVERED;
    }
}

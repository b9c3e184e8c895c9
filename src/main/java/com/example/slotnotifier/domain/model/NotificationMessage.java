package com.example.slotnotifier.domain.model;

import lombok.Value;

/**
 * Rendered message text together with the number of slots it lists
 */
@Value
public class NotificationMessage {
    String text;
    int matchedSlotCount;
}

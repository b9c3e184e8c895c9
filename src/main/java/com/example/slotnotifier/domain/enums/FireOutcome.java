package com.example.slotnotifier.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a single fire of a notification job ended
 */
@Getter
@RequiredArgsConstructor
public enum FireOutcome {

    DELIVERED("Message delivered"),
    DELIVERY_FAILED("Delivery failed after all attempts"),
    SKIPPED_PLAYER_NOT_FOUND("Player no longer present in the preference source"),
    SKIPPED_MISFIRE("Fire started too late after its scheduled time"),
    FAILED("Fire aborted by an unexpected error");

    private final String description;

    public boolean isSkipped() {
        return this == SKIPPED_PLAYER_NOT_FOUND || this == SKIPPED_MISFIRE;
    }
}

package com.example.slotnotifier.domain.enums;

public enum DeliveryStatus {
    DELIVERED,
    DELIVERY_FAILED
}

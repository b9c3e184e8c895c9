package com.example.slotnotifier.domain.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * A bookable court slot from the availability snapshot.
 * Date and time range are kept as the raw text the venue entered.
 */
@Value
@Builder
public class Slot {

    public static final String STATUS_NOT_BOOKED = "not booked";

    String businessId;
    String sport;
    String locality;
    String status;
    String date;
    String timeRange;
    @Getter(AccessLevel.NONE)
    String price;
    @Getter(AccessLevel.NONE)
    String bookingReference;

    public Optional<String> getPrice() {
        return Optional.ofNullable(price).map(String::trim).filter(value -> !value.isEmpty());
    }

    public Optional<String> getBookingReference() {
        return Optional.ofNullable(bookingReference).map(String::trim).filter(value -> !value.isEmpty());
    }

    public boolean isNotBooked() {
        return status != null && STATUS_NOT_BOOKED.equals(status.trim().toLowerCase(Locale.ROOT));
    }
}

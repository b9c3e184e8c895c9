package com.example.slotnotifier.domain.enums;

import com.example.slotnotifier.exception.InvalidFrequencyException;
import lombok.Getter;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Notification frequencies a player can pick, each bound to a fixed set of weekdays.
 */
@Getter
public enum Frequency {

    DAILY("Daily", EnumSet.allOf(DayOfWeek.class)),
    WEEKLY("Weekly", EnumSet.of(DayOfWeek.MONDAY)),
    TWICE_A_WEEK("Twice a Week", EnumSet.of(DayOfWeek.TUESDAY, DayOfWeek.THURSDAY)),
    THRICE_A_WEEK("Thrice a Week", EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY)),
    WEEKEND("Weekend", EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    private final String displayName;
    private final Set<DayOfWeek> days;

    Frequency(String displayName, EnumSet<DayOfWeek> days) {
        this.displayName = displayName;
        this.days = Collections.unmodifiableSet(days);
    }

    /**
     * Resolve a free-text label. Case, spaces, hyphens and underscores are ignored,
     * so "Twice a Week", "twice-a-week" and "TWICE_A_WEEK" are the same frequency.
     *
     * @throws InvalidFrequencyException if the label matches no frequency
     */
    public static Frequency fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidFrequencyException(label);
        }
        var key = normalize(label);
        for (var frequency : values()) {
            if (normalize(frequency.name()).equals(key)) {
                return frequency;
            }
        }
        throw new InvalidFrequencyException(label);
    }

    private static String normalize(String label) {
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
    }
}

package com.example.slotnotifier.domain.model;

import lombok.Value;
import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recurring trigger: a set of weekdays at a fixed hour and minute in one zone.
 * Fire instants come from the equivalent Spring cron expression, so daylight
 * saving gaps and overlaps are handled the way Spring's scheduler handles them.
 */
@Value
public class TriggerSpec {

    Set<DayOfWeek> daysOfWeek;
    int hour;
    int minute;
    ZoneId zone;

    private TriggerSpec(Set<DayOfWeek> daysOfWeek, int hour, int minute, ZoneId zone) {
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new IllegalArgumentException("A trigger needs at least one weekday");
        }
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException(String.format("Invalid trigger time %d:%d", hour, minute));
        }
        this.daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        this.hour = hour;
        this.minute = minute;
        this.zone = zone;
    }

    public static TriggerSpec of(Set<DayOfWeek> daysOfWeek, LocalTime time, ZoneId zone) {
        return new TriggerSpec(daysOfWeek, time.getHour(), time.getMinute(), zone);
    }

    public static TriggerSpec of(Set<DayOfWeek> daysOfWeek, int hour, int minute, ZoneId zone) {
        return new TriggerSpec(daysOfWeek, hour, minute, zone);
    }

    /**
     * Six-field Spring cron expression, e.g. {@code 0 30 9 * * MON,WED,FRI}
     */
    public String toCronExpression() {
        var days = daysOfWeek.stream()
                .sorted()
                .map(day -> day.name().substring(0, 3))
                .collect(Collectors.joining(","));
        return String.format("0 %d %d * * %s", minute, hour, days);
    }

    /**
     * First fire instant strictly after the given moment
     */
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        var next = CronExpression.parse(toCronExpression()).next(after.withZoneSameInstant(zone));
        if (next == null) {
            throw new IllegalStateException("Trigger " + toCronExpression() + " has no future fire time");
        }
        return next;
    }
}

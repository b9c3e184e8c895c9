package com.example.slotnotifier.domain.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores a weekday set as a comma separated column, e.g. {@code MON,WED,FRI}.
 */
@Converter
public class WeekdaySetConverter implements AttributeConverter<Set<DayOfWeek>, String> {

    @Override
    public String convertToDatabaseColumn(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) {
            return null;
        }
        return days.stream()
                .sorted()
                .map(day -> day.name().substring(0, 3))
                .collect(Collectors.joining(","));
    }

    @Override
    public Set<DayOfWeek> convertToEntityAttribute(String column) {
        var days = EnumSet.noneOf(DayOfWeek.class);
        if (column == null || column.isBlank()) {
            return days;
        }
        Arrays.stream(column.split(","))
                .map(token -> token.trim().toUpperCase(Locale.ROOT))
                .filter(token -> !token.isEmpty())
                .forEach(token -> days.add(fromAbbreviation(token)));
        return days;
    }

    private static DayOfWeek fromAbbreviation(String abbreviation) {
        for (var day : DayOfWeek.values()) {
            if (day.name().startsWith(abbreviation)) {
                return day;
            }
        }
        throw new IllegalArgumentException("Unknown weekday in column: " + abbreviation);
    }
}

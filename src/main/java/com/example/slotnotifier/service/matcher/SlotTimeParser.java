package com.example.slotnotifier.service.matcher;

import com.example.slotnotifier.exception.InvalidSlotFormatException;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses the free-text date and time range venues enter for a slot.
 */
public final class SlotTimeParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("yyyy-MM-dd"),
            formatter("d/M/yyyy"),
            formatter("d-M-yyyy"),
            formatter("d MMM yyyy"),
            formatter("d MMMM yyyy"),
            formatter("MMM d, yyyy"),
            formatter("MMMM d, yyyy"),
            formatter("EEE, d MMM yyyy"),
            formatter("EEEE, d MMMM yyyy")
    );

    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s*(?:-|\u2013|\u2014|\\bto\\b)\\s*");
    private static final Pattern TWELVE_HOUR = Pattern.compile("^(\\d{1,2})(?:[:.](\\d{2}))?([ap]m)?$");

    private SlotTimeParser() {
    }

    /**
     * Start and end of a slot
     */
    @Value
    public static class TimeRange {
        LocalTime start;
        LocalTime end;
    }

    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidSlotFormatException("date", text);
        }
        var value = text.strip();
        for (var format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        throw new InvalidSlotFormatException("date", text);
    }

    /**
     * Parses a 12-hour range such as {@code 6:00 AM - 7:00 AM} or {@code 6-7pm}.
     * When only the end carries AM/PM the start takes the same one, unless that would
     * put the start after the end ({@code 11-12pm}), in which case it takes the other.
     */
    public static TimeRange parseTimeRange(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidSlotFormatException("time range", text);
        }
        var parts = RANGE_SEPARATOR.split(text.strip().toLowerCase(Locale.ROOT), -1);
        if (parts.length != 2) {
            throw new InvalidSlotFormatException("time range", text);
        }
        var start = TWELVE_HOUR.matcher(compact(parts[0]));
        var end = TWELVE_HOUR.matcher(compact(parts[1]));
        if (!start.matches() || !end.matches() || end.group(3) == null) {
            throw new InvalidSlotFormatException("time range", text);
        }
        var endTime = toLocalTime(end.group(1), end.group(2), end.group(3), text);
        if (start.group(3) != null) {
            return new TimeRange(toLocalTime(start.group(1), start.group(2), start.group(3), text), endTime);
        }
        var startTime = toLocalTime(start.group(1), start.group(2), end.group(3), text);
        if (startTime.isAfter(endTime)) {
            var other = end.group(3).equals("pm") ? "am" : "pm";
            startTime = toLocalTime(start.group(1), start.group(2), other, text);
        }
        return new TimeRange(startTime, endTime);
    }

    private static LocalTime toLocalTime(String hourText, String minuteText, String meridiem, String original) {
        var hour = Integer.parseInt(hourText);
        var minute = minuteText != null ? Integer.parseInt(minuteText) : 0;
        if (hour < 1 || hour > 12 || minute > 59) {
            throw new InvalidSlotFormatException("time range", original);
        }
        return LocalTime.of(hour % 12 + (meridiem.equals("pm") ? 12 : 0), minute);
    }

    private static String compact(String part) {
        return part.replaceAll("\\s+", "").replaceAll("([ap])\\.?m\\.?$", "$1m");
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}

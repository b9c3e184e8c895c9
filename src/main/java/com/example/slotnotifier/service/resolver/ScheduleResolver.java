package com.example.slotnotifier.service.resolver;

import com.example.slotnotifier.domain.enums.Frequency;
import com.example.slotnotifier.exception.InvalidTimeException;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a player's free-text frequency and time of day into trigger fields.
 * <p>
 * Accepted time forms:
 * <ul>
 *   <li>{@code 7:30 PM}, {@code 7.30pm}, {@code 7 PM}, {@code 7 p.m.}</li>
 *   <li>{@code 19:30}, {@code 07:30} (24-hour)</li>
 *   <li>a bare hour such as {@code 9} or {@code 8}, read with {@link #bareHour(int)}</li>
 * </ul>
 * A leading apostrophe, which spreadsheets add to keep text cells as text, is ignored.
 */
public final class ScheduleResolver {

    private static final Pattern MERIDIEM_TIME = Pattern.compile("^(\\d{1,2})(?:[:.](\\d{2}))?\\s*([ap])\\.?\\s*m\\.?$");
    private static final Pattern CLOCK_TIME = Pattern.compile("^(\\d{1,2})[:.](\\d{2})$");
    private static final Pattern BARE_HOUR = Pattern.compile("^(\\d{1,2})$");

    private ScheduleResolver() {
    }

    public static Frequency resolveFrequency(String label) {
        return Frequency.fromLabel(label);
    }

    /**
     * @throws com.example.slotnotifier.exception.InvalidFrequencyException for an unknown label
     */
    public static Set<DayOfWeek> daysForFrequency(String label) {
        return resolveFrequency(label).getDays();
    }

    /**
     * @throws InvalidTimeException when the text is not a time of day
     */
    public static LocalTime parseTimeOfDay(String text) {
        if (text == null) {
            throw new InvalidTimeException(null);
        }
        var value = text.strip();
        while (value.startsWith("'")) {
            value = value.substring(1).strip();
        }
        value = value.toLowerCase(Locale.ROOT);

        var meridiem = MERIDIEM_TIME.matcher(value);
        if (meridiem.matches()) {
            var hour = Integer.parseInt(meridiem.group(1));
            var minute = meridiem.group(2) != null ? Integer.parseInt(meridiem.group(2)) : 0;
            if (hour < 1 || hour > 12 || minute > 59) {
                throw new InvalidTimeException(text);
            }
            var pm = meridiem.group(3).equals("p");
            return LocalTime.of(hour % 12 + (pm ? 12 : 0), minute);
        }

        var clock = CLOCK_TIME.matcher(value);
        if (clock.matches()) {
            var hour = Integer.parseInt(clock.group(1));
            var minute = Integer.parseInt(clock.group(2));
            if (hour > 23 || minute > 59) {
                throw new InvalidTimeException(text);
            }
            return LocalTime.of(hour, minute);
        }

        var bare = BARE_HOUR.matcher(value);
        if (bare.matches()) {
            var hour = Integer.parseInt(bare.group(1));
            if (hour > 23) {
                throw new InvalidTimeException(text);
            }
            return bareHour(hour);
        }

        throw new InvalidTimeException(text);
    }

    /**
     * Reads an hour given without minutes or AM/PM. 0 to 7 and 9 to 11 are morning
     * hours, 8 is 20:00, 12 is noon and 13 to 23 are already 24-hour values.
     */
    static LocalTime bareHour(int hour) {
        if (hour == 8) {
            return LocalTime.of(20, 0);
        }
        return LocalTime.of(hour, 0);
    }
}

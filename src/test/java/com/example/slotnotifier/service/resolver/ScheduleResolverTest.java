package com.example.slotnotifier.service.resolver;

import com.example.slotnotifier.exception.InvalidFrequencyException;
import com.example.slotnotifier.exception.InvalidTimeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;
import java.time.LocalTime;

import static java.time.DayOfWeek.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScheduleResolver Tests")
class ScheduleResolverTest {

    @Nested
    @DisplayName("daysForFrequency Tests")
    class DaysForFrequencyTests {

        @Test
        @DisplayName("Daily should cover the whole week")
        void dailyCoversWholeWeek() {
            assertThat(ScheduleResolver.daysForFrequency("Daily")).containsExactlyInAnyOrder(DayOfWeek.values());
        }

        @Test
        @DisplayName("Weekly should fire on Monday")
        void weeklyFiresOnMonday() {
            assertThat(ScheduleResolver.daysForFrequency("Weekly")).containsExactly(MONDAY);
        }

        @Test
        @DisplayName("Twice a week should fire on Tuesday and Thursday")
        void twiceAWeek() {
            assertThat(ScheduleResolver.daysForFrequency("Twice a Week")).containsExactlyInAnyOrder(TUESDAY, THURSDAY);
        }

        @Test
        @DisplayName("Thrice a week should fire on Monday, Wednesday and Friday")
        void thriceAWeek() {
            assertThat(ScheduleResolver.daysForFrequency("thrice a week")).containsExactlyInAnyOrder(MONDAY, WEDNESDAY, FRIDAY);
        }

        @Test
        @DisplayName("Weekend should fire on Saturday and Sunday")
        void weekend() {
            assertThat(ScheduleResolver.daysForFrequency("WEEKEND")).containsExactlyInAnyOrder(SATURDAY, SUNDAY);
        }

        @Test
        @DisplayName("Should reject an unknown frequency")
        void shouldRejectUnknownFrequency() {
            assertThatThrownBy(() -> ScheduleResolver.daysForFrequency("Every other day"))
                    .isInstanceOf(InvalidFrequencyException.class);
        }
    }

    @Nested
    @DisplayName("parseTimeOfDay Tests")
    class ParseTimeOfDayTests {

        @ParameterizedTest
        @CsvSource({
                "'10:00 AM', 10, 0",
                "'7:30 PM', 19, 30",
                "'7:30pm', 19, 30",
                "'7 PM', 19, 0",
                "'7 p.m.', 19, 0",
                "'12:00 AM', 0, 0",
                "'12:15 PM', 12, 15",
                "'19:45', 19, 45",
                "'07:05', 7, 5",
                "'''10:00 AM', 10, 0"
        })
        @DisplayName("Should parse 12-hour and 24-hour forms")
        void shouldParseClockForms(String text, int hour, int minute) {
            assertThat(ScheduleResolver.parseTimeOfDay(text)).isEqualTo(LocalTime.of(hour, minute));
        }

        @Test
        @DisplayName("A bare 9 should be nine in the morning")
        void bareNineIsMorning() {
            assertThat(ScheduleResolver.parseTimeOfDay("9")).isEqualTo(LocalTime.of(9, 0));
        }

        @Test
        @DisplayName("A bare 8 should be eight in the evening")
        void bareEightIsEvening() {
            assertThat(ScheduleResolver.parseTimeOfDay("8")).isEqualTo(LocalTime.of(20, 0));
        }

        @ParameterizedTest
        @CsvSource({"1, 1", "5, 5", "7, 7", "8, 20", "10, 10", "11, 11", "12, 12", "0, 0", "18, 18", "23, 23"})
        @DisplayName("Should read other bare hours consistently")
        void shouldReadBareHours(String text, int hour) {
            assertThat(ScheduleResolver.parseTimeOfDay(text)).isEqualTo(LocalTime.of(hour, 0));
        }

        @ParameterizedTest
        @ValueSource(strings = {"25:00", "24", "13 PM", "0 AM", "10:75", "noon", "", "ten"})
        @DisplayName("Should reject text that is not a time of day")
        void shouldRejectInvalidTimes(String text) {
            assertThatThrownBy(() -> ScheduleResolver.parseTimeOfDay(text))
                    .isInstanceOf(InvalidTimeException.class);
        }

        @Test
        @DisplayName("Should reject null")
        void shouldRejectNull() {
            assertThatThrownBy(() -> ScheduleResolver.parseTimeOfDay(null)).isInstanceOf(InvalidTimeException.class);
        }
    }
}

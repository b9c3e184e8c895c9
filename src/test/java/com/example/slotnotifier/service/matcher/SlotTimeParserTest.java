package com.example.slotnotifier.service.matcher;

import com.example.slotnotifier.exception.InvalidSlotFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlotTimeParser Tests")
class SlotTimeParserTest {

    @Nested
    @DisplayName("parseDate Tests")
    class ParseDateTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "2024-12-05",
                "05/12/2024",
                "5/12/2024",
                "05-12-2024",
                "5 Dec 2024",
                "05 December 2024",
                "Dec 5, 2024",
                "december 5, 2024",
                "Thu, 5 Dec 2024",
                "Thursday, 5 December 2024"
        })
        @DisplayName("Should read the layouts venues use")
        void shouldParseKnownLayouts(String text) {
            assertThat(SlotTimeParser.parseDate(text)).isEqualTo(LocalDate.of(2024, 12, 5));
        }

        @ParameterizedTest
        @ValueSource(strings = {"tomorrow", "2024/13/45", "12.05.2024", " "})
        @DisplayName("Should reject anything else")
        void shouldRejectUnknownLayouts(String text) {
            assertThatThrownBy(() -> SlotTimeParser.parseDate(text))
                    .isInstanceOf(InvalidSlotFormatException.class)
                    .hasMessageContaining("date");
        }
    }

    @Nested
    @DisplayName("parseTimeRange Tests")
    class ParseTimeRangeTests {

        @ParameterizedTest
        @CsvSource({
                "'6:00 AM - 7:00 AM', 6, 0, 7, 0",
                "'6AM-7AM', 6, 0, 7, 0",
                "'11:30 am – 12:30 pm', 11, 30, 12, 30",
                "'6 - 7 PM', 18, 0, 19, 0",
                "'9pm to 10pm', 21, 0, 22, 0",
                "'12:00 AM - 1:00 AM', 0, 0, 1, 0",
                "'11-12pm', 11, 0, 12, 0",
                "'10:30 - 1 PM', 10, 30, 13, 0",
                "'11-1am', 23, 0, 1, 0"
        })
        @DisplayName("Should read 12-hour ranges")
        void shouldParseRanges(String text, int startHour, int startMinute, int endHour, int endMinute) {
            var range = SlotTimeParser.parseTimeRange(text);

            assertThat(range.getStart()).isEqualTo(LocalTime.of(startHour, startMinute));
            assertThat(range.getEnd()).isEqualTo(LocalTime.of(endHour, endMinute));
        }

        @ParameterizedTest
        @ValueSource(strings = {"18:00 - 19:00", "6:00 AM", "evening", "13:00 PM - 14:00 PM", "6 AM - 7 AM - 8 AM"})
        @DisplayName("Should reject ranges that are not 12-hour ranges")
        void shouldRejectInvalidRanges(String text) {
            assertThatThrownBy(() -> SlotTimeParser.parseTimeRange(text))
                    .isInstanceOf(InvalidSlotFormatException.class);
        }

        @Test
        @DisplayName("Start without AM/PM should never land after the end")
        void borrowedMeridiemShouldKeepStartBeforeEnd() {
            var range = SlotTimeParser.parseTimeRange("11 - 12 PM");

            assertThat(range.getStart()).isEqualTo(LocalTime.of(11, 0));
            assertThat(range.getStart()).isBefore(range.getEnd());
        }
    }
}

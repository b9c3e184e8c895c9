package com.example.slotnotifier.domain.enums;

import com.example.slotnotifier.exception.InvalidFrequencyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Frequency Tests")
class FrequencyTest {

    @Nested
    @DisplayName("fromLabel Tests")
    class FromLabelTests {

        @ParameterizedTest
        @ValueSource(strings = {"Twice a Week", "twice a week", "TWICE_A_WEEK", "twice-a-week", "  Twice  A  Week "})
        @DisplayName("Should ignore case, spacing, hyphens and underscores")
        void shouldNormalizeLabel(String label) {
            assertThat(Frequency.fromLabel(label)).isEqualTo(Frequency.TWICE_A_WEEK);
        }

        @ParameterizedTest
        @ValueSource(strings = {"Fortnightly", "Monthly", "weekday"})
        @DisplayName("Should reject unknown labels")
        void shouldRejectUnknownLabel(String label) {
            assertThatThrownBy(() -> Frequency.fromLabel(label))
                    .isInstanceOf(InvalidFrequencyException.class)
                    .hasMessageContaining(label);
        }

        @Test
        @DisplayName("Should reject null and blank labels")
        void shouldRejectBlankLabel() {
            assertThatThrownBy(() -> Frequency.fromLabel(null)).isInstanceOf(InvalidFrequencyException.class);
            assertThatThrownBy(() -> Frequency.fromLabel("  ")).isInstanceOf(InvalidFrequencyException.class);
        }
    }

    @Test
    @DisplayName("Day sets should be read-only")
    void daySetsShouldBeReadOnly() {
        var days = Frequency.WEEKEND.getDays();

        assertThat(days).containsExactlyInAnyOrder(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
        assertThatThrownBy(() -> days.add(DayOfWeek.MONDAY)).isInstanceOf(UnsupportedOperationException.class);
    }
}

package com.example.slotnotifier.domain.entity;

import com.example.slotnotifier.domain.enums.Frequency;
import com.example.slotnotifier.domain.model.TriggerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScheduledJob Entity Tests")
class ScheduledJobTest {

    private static final ZoneId KOLKATA = ZoneId.of("Asia/Kolkata");

    private ScheduledJob job;

    @BeforeEach
    void setUp() {
        job = ScheduledJob.builder()
                .id(ScheduledJob.jobIdFor("+919876543210"))
                .userIdentity("+919876543210")
                .build();
    }

    @Test
    @DisplayName("Should derive the job id from the identity")
    void shouldDeriveJobId() {
        assertThat(job.getId()).isEqualTo("+919876543210_notification");
    }

    @Nested
    @DisplayName("applyTrigger Tests")
    class ApplyTriggerTests {

        @Test
        @DisplayName("Should store the trigger columns and their cron form")
        void shouldStoreTrigger() {
            var trigger = TriggerSpec.of(Frequency.THRICE_A_WEEK.getDays(), 19, 30, KOLKATA);
            var nextFire = Instant.parse("2024-12-06T14:00:00Z");

            job.applyTrigger(trigger, Frequency.THRICE_A_WEEK, "7:30 PM", nextFire);

            assertThat(job.getDaysOfWeek()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
            assertThat(job.getHour()).isEqualTo(19);
            assertThat(job.getMinute()).isEqualTo(30);
            assertThat(job.getTimeZone()).isEqualTo("Asia/Kolkata");
            assertThat(job.getCronExpression()).isEqualTo("0 30 19 * * MON,WED,FRI");
            assertThat(job.getNextFireTime()).isEqualTo(nextFire);
            assertThat(job.getDescriptorVersion()).isEqualTo(ScheduledJob.DESCRIPTOR_VERSION);
            assertThat(job.toTriggerSpec()).isEqualTo(trigger);
        }

        @Test
        @DisplayName("Should keep the fire lock of a running fire")
        void shouldKeepLock() {
            job.setLockedBy("instance-1");
            job.setLockedUntil(Instant.now().plusSeconds(600));

            job.applyTrigger(TriggerSpec.of(EnumSet.of(DayOfWeek.MONDAY), 9, 0, KOLKATA), Frequency.WEEKLY, "9", Instant.now());

            assertThat(job.getLockedBy()).isEqualTo("instance-1");
        }
    }

    @Nested
    @DisplayName("isLocked Tests")
    class IsLockedTests {

        @Test
        @DisplayName("Should return false when not locked")
        void shouldReturnFalseWhenNotLocked() {
            assertThat(job.isLocked(Instant.now())).isFalse();
        }

        @Test
        @DisplayName("Should return true when locked with future expiry")
        void shouldReturnTrueWhenLockedWithFutureExpiry() {
            job.setLockedBy("instance-1");
            job.setLockedUntil(Instant.now().plusSeconds(3600));

            assertThat(job.isLocked(Instant.now())).isTrue();
        }

        @Test
        @DisplayName("Should return false when the lock has expired")
        void shouldReturnFalseWhenLockExpired() {
            job.setLockedBy("instance-1");
            job.setLockedUntil(Instant.now().minusSeconds(60));

            assertThat(job.isLocked(Instant.now())).isFalse();
        }
    }

    @Nested
    @DisplayName("WeekdaySetConverter Tests")
    class WeekdaySetConverterTests {

        private final WeekdaySetConverter converter = new WeekdaySetConverter();

        @Test
        @DisplayName("Should write weekdays in calendar order")
        void shouldWriteSortedAbbreviations() {
            assertThat(converter.convertToDatabaseColumn(EnumSet.of(DayOfWeek.SUNDAY, DayOfWeek.SATURDAY)))
                    .isEqualTo("SAT,SUN");
        }

        @Test
        @DisplayName("Should read abbreviations back into weekdays")
        void shouldReadAbbreviations() {
            assertThat(converter.convertToEntityAttribute("tue, THU"))
                    .containsExactly(DayOfWeek.TUESDAY, DayOfWeek.THURSDAY);
            assertThat(converter.convertToEntityAttribute(null)).isEmpty();
        }

        @Test
        @DisplayName("Should reject an unknown weekday")
        void shouldRejectUnknownWeekday() {
            assertThatThrownBy(() -> converter.convertToEntityAttribute("MON,XYZ"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

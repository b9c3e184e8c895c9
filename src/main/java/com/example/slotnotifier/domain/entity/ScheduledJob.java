package com.example.slotnotifier.domain.entity;

import com.example.slotnotifier.domain.enums.Frequency;
import com.example.slotnotifier.domain.model.TriggerSpec;
import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * The durable recurring notification job of one player.
 * <p>
 * Holds:
 * - The trigger (weekdays, hour, minute, zone) and its cron form
 * - The next fire instant the poller selects on
 * - Fire lock columns so one job never fires twice at the same time
 * <p>
 * The id is derived from the player identity, which makes scheduling a
 * player an upsert rather than an insert.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
        @Index(name = "idx_job_next_fire_time", columnList = "next_fire_time"),
        @Index(name = "idx_job_user_identity", columnList = "user_identity", unique = true),
        @Index(name = "idx_job_locked_by_until", columnList = "locked_by, locked_until")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJob {

    /**
     * Version of the job descriptor layout; bump when the stored trigger shape changes
     */
    public static final int DESCRIPTOR_VERSION = 1;

    private static final String JOB_ID_SUFFIX = "_notification";

    @Id
    @Column(name = "id", updatable = false, nullable = false, length = 120)
    private String id;

    @Column(name = "user_identity", nullable = false, length = 100)
    private String userIdentity;

    @Convert(converter = WeekdaySetConverter.class)
    @Column(name = "days_of_week", nullable = false, length = 40)
    @Builder.Default
    private Set<DayOfWeek> daysOfWeek = EnumSet.noneOf(DayOfWeek.class);

    @Column(name = "fire_hour", nullable = false)
    private Integer hour;

    @Column(name = "fire_minute", nullable = false)
    private Integer minute;

    @Column(name = "time_zone", nullable = false, length = 50)
    private String timeZone;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    /**
     * Frequency label the trigger was resolved from
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "frequency", nullable = false, length = 30)
    private Frequency frequency;

    /**
     * Notification time exactly as the player entered it
     */
    @Column(name = "notification_time", length = 30)
    private String notificationTime;

    @Column(name = "descriptor_version", nullable = false)
    @Builder.Default
    private Integer descriptorVersion = DESCRIPTOR_VERSION;

    @Column(name = "next_fire_time", nullable = false)
    private Instant nextFireTime;

    @Column(name = "last_fired_at")
    private Instant lastFiredAt;

    @Column(name = "fire_count", nullable = false)
    @Builder.Default
    private Long fireCount = 0L;

    // === Fire Lock Fields ===

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.fireCount == null) {
            this.fireCount = 0L;
        }
        if (this.descriptorVersion == null) {
            this.descriptorVersion = DESCRIPTOR_VERSION;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Job id used for a player, e.g. {@code +919876543210_notification}
     */
    public static String jobIdFor(String userIdentity) {
        return userIdentity + JOB_ID_SUFFIX;
    }

    public TriggerSpec toTriggerSpec() {
        return TriggerSpec.of(daysOfWeek, hour, minute, ZoneId.of(timeZone));
    }

    /**
     * Replace the trigger of this job. Lock columns are left alone so a fire
     * in progress still re-arms the job when it finishes.
     */
    public void applyTrigger(TriggerSpec trigger, Frequency frequency, String notificationTime, Instant nextFireTime) {
        this.daysOfWeek = EnumSet.copyOf(trigger.getDaysOfWeek());
        this.hour = trigger.getHour();
        this.minute = trigger.getMinute();
        this.timeZone = trigger.getZone().getId();
        this.cronExpression = trigger.toCronExpression();
        this.frequency = frequency;
        this.notificationTime = notificationTime;
        this.descriptorVersion = DESCRIPTOR_VERSION;
        this.nextFireTime = nextFireTime;
    }

    public boolean isLocked(Instant now) {
        return lockedBy != null && lockedUntil != null && lockedUntil.isAfter(now);
    }
}

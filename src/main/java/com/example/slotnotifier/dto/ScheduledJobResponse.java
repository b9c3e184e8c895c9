package com.example.slotnotifier.dto;

import com.example.slotnotifier.domain.enums.Frequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * Response DTO for a scheduled notification job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJobResponse {

    private String id;
    private String userIdentity;
    private Set<DayOfWeek> daysOfWeek;
    private Integer hour;
    private Integer minute;
    private String timeZone;
    private String cronExpression;
    private Frequency frequency;
    private String notificationTime;
    private Integer descriptorVersion;
    private Instant nextFireTime;
    private Instant lastFiredAt;
    private Long fireCount;
    private String lockedBy;
    private Instant lockedUntil;
    private Instant createdAt;
    private Instant updatedAt;
}

package com.example.slotnotifier.dto;

import com.example.slotnotifier.domain.enums.FireOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for execution log
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionLogResponse {

    private UUID id;
    private String jobId;
    private String userIdentity;
    private FireOutcome outcome;
    private Instant scheduledFor;
    private Integer matchedSlotCount;
    private Integer deliveryAttempts;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String errorMessage;
    private String errorType;
}

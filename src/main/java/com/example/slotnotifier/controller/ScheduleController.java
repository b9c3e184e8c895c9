package com.example.slotnotifier.controller;

import com.example.slotnotifier.dto.ApiResponse;
import com.example.slotnotifier.dto.JobExecutionLogResponse;
import com.example.slotnotifier.dto.NotificationResult;
import com.example.slotnotifier.dto.ReconcileResult;
import com.example.slotnotifier.dto.SchedulePreferenceRequest;
import com.example.slotnotifier.dto.ScheduledJobResponse;
import com.example.slotnotifier.service.NotificationScheduleService;
import com.example.slotnotifier.service.PlayerNotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for notification schedules.
 * <p>
 * Provides endpoints for:
 * - Scheduling, rescheduling and cancelling a player's notifications
 * - Rebuilding all schedules from the preference source
 * - Inspecting jobs and their execution history
 * - On-demand and preview notifications
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Notification Schedules", description = "APIs for managing players' slot notification schedules")
public class ScheduleController {

    private final NotificationScheduleService scheduleService;
    private final PlayerNotificationService notificationService;

    // === Scheduling ===

    @PostMapping("/{identity}")
    @Operation(summary = "Schedule from record", description = "Schedule a player using their current record in the preference source")
    public ResponseEntity<ApiResponse<ScheduledJobResponse>> scheduleFromSource(
            @Parameter(description = "Player phone number") @PathVariable String identity) {
        log.info("API: Schedule {} from preference source", identity);

        scheduleService.scheduleFromSource(identity);
        return scheduledJob(identity, "Notifications scheduled");
    }

    @PutMapping("/{identity}")
    @Operation(summary = "Schedule with preferences", description = "Install or replace a player's schedule from the supplied preferences")
    public ResponseEntity<ApiResponse<ScheduledJobResponse>> schedule(
            @Parameter(description = "Player phone number") @PathVariable String identity,
            @Valid @RequestBody SchedulePreferenceRequest request) {
        log.info("API: Schedule {} at {} ({})", identity, request.getNotificationTime(), request.getNotificationFrequency());

        scheduleService.schedule(request.toPreference(identity));
        return scheduledJob(identity, "Notifications scheduled");
    }

    @DeleteMapping("/{identity}")
    @Operation(summary = "Cancel schedule", description = "Stop notifications for a player; a no-op when none are scheduled")
    public ResponseEntity<ApiResponse<Boolean>> cancel(
            @Parameter(description = "Player phone number") @PathVariable String identity) {
        log.info("API: Cancel schedule of {}", identity);

        var removed = scheduleService.cancel(identity);
        return ResponseEntity.ok(ApiResponse.success(removed, removed ? "Notifications cancelled" : "No notifications were scheduled"));
    }

    @PostMapping("/reconcile")
    @Operation(summary = "Reconcile all", description = "Rebuild every schedule from the preference source and remove those of players it no longer lists")
    public ResponseEntity<ApiResponse<ReconcileResult>> reconcile() {
        log.info("API: Reconcile all schedules");

        return ResponseEntity.ok(ApiResponse.success(scheduleService.reconcileFromSource()));
    }

    // === Retrieval ===

    @GetMapping("/{identity}")
    @Operation(summary = "Get schedule", description = "Retrieve the scheduled job of a player")
    public ResponseEntity<ApiResponse<ScheduledJobResponse>> getSchedule(
            @Parameter(description = "Player phone number") @PathVariable String identity) {
        return scheduleService.getJob(identity)
                .map(job -> ResponseEntity.ok(ApiResponse.success(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "List schedules", description = "List scheduled jobs ordered by next fire time")
    public ResponseEntity<ApiResponse<Page<ScheduledJobResponse>>> listSchedules(
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "nextFireTime"));
        return ResponseEntity.ok(ApiResponse.success(scheduleService.listJobs(pageable)));
    }

    @GetMapping("/{identity}/executions")
    @Operation(summary = "Execution history", description = "Most recent fires of a player's job")
    public ResponseEntity<ApiResponse<List<JobExecutionLogResponse>>> getExecutions(
            @Parameter(description = "Player phone number") @PathVariable String identity,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.getExecutions(identity, limit)));
    }

    // === Notifications ===

    @PostMapping("/{identity}/notify")
    @Operation(summary = "Notify now", description = "Send a player their matching slots immediately")
    public ResponseEntity<ApiResponse<NotificationResult>> notifyNow(
            @Parameter(description = "Player phone number") @PathVariable String identity) {
        log.info("API: Notify {} now", identity);

        var result = notificationService.notifyNow(identity);
        return ResponseEntity.ok(ApiResponse.success(result, result.isDelivered() ? "Notification delivered" : "Notification not delivered"));
    }

    @GetMapping("/{identity}/preview")
    @Operation(summary = "Preview message", description = "Render the message a player would receive now without sending it")
    public ResponseEntity<ApiResponse<NotificationResult>> preview(
            @Parameter(description = "Player phone number") @PathVariable String identity) {
        return ResponseEntity.ok(ApiResponse.success(notificationService.preview(identity)));
    }

    @PostMapping("/businesses/{businessId}/notify")
    @Operation(summary = "Court update", description = "Send the open slots of one business to a phone number")
    public ResponseEntity<ApiResponse<NotificationResult>> notifyBusiness(
            @Parameter(description = "Business id, e.g. turfxl") @PathVariable String businessId,
            @Parameter(description = "Destination phone number") @RequestParam String destination) {
        log.info("API: Send {} availability to {}", businessId, destination);

        var result = notificationService.notifyBusinessAvailability(businessId, destination);
        return ResponseEntity.ok(ApiResponse.success(result, result.isDelivered() ? "Notification delivered" : "Notification not delivered"));
    }

    private ResponseEntity<ApiResponse<ScheduledJobResponse>> scheduledJob(String identity, String message) {
        return scheduleService.getJob(identity)
                .map(job -> ResponseEntity.ok(ApiResponse.success(job, message)))
                .orElse(ResponseEntity.notFound().build());
    }
}

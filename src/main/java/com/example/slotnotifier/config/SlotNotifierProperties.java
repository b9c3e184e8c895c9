package com.example.slotnotifier.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the notification scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "slot-notifier")
public class SlotNotifierProperties {

    /**
     * Zone every trigger is evaluated in and "today" is computed in
     */
    @NotBlank
    private String timeZone = "Asia/Kolkata";

    /**
     * Prefix applied to phone numbers that carry no international prefix
     */
    @NotBlank
    private String defaultCountryCode = "+91";

    /**
     * Polling interval in milliseconds for checking due jobs
     */
    @Min(1000)
    private long pollIntervalMs = 15000;

    /**
     * Maximum number of due jobs fetched per poll cycle
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * Number of concurrent fires
     */
    @Min(1)
    private int workerPoolSize = 10;

    /**
     * How long a fire lock is held before another instance may take the job over
     */
    @Min(1)
    private int lockDurationMinutes = 15;

    /**
     * Threshold in minutes after which an expired fire lock is cleared
     */
    @Min(1)
    private int staleJobThresholdMinutes = 30;

    /**
     * A fire that starts later than this after its scheduled instant is skipped
     */
    @Min(1)
    private int misfireGraceMinutes = 60;

    /**
     * Rebuild all jobs from the preference source once the application is ready
     */
    private boolean reconcileOnStartup = true;

    /**
     * Interval between periodic rebuilds from the preference source
     */
    @Min(60000)
    private long reconcileIntervalMs = 3600000;

    /**
     * How long shutdown waits for running fires before interrupting them
     */
    @Min(0)
    private int shutdownWaitSeconds = 30;

    /**
     * Days of execution history kept
     */
    @Min(1)
    private int executionLogRetentionDays = 30;
}

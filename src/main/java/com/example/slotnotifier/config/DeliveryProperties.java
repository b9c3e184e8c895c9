package com.example.slotnotifier.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message delivery and rendering settings
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "slot-notifier.delivery")
public class DeliveryProperties {

    /**
     * Total send attempts per message, the first one included
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Fixed pause between two send attempts
     */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(5);

    /**
     * Upper bound on how long one fire may keep retrying
     */
    @NotNull
    private Duration fireDeadline = Duration.ofMinutes(5);

    /**
     * Booking links used when a slot carries none, keyed by lower-case business id
     */
    private Map<String, String> bookingLinks = new LinkedHashMap<>();
}

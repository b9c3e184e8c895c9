package com.example.slotnotifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Slot Notifier Application
 * <p>
 * Sends players recurring WhatsApp messages about sports-court slots that
 * are still open, filtered by each player's sports and localities.
 * <p>
 * Features:
 * - One durable recurring trigger per player, rebuilt from preferences on start-up
 * - Polling trigger evaluation with a bounded worker pool
 * - Fire locks so a player's job never runs twice at once, even across instances
 * - Bounded delivery retry with Slack alerting when the budget is exhausted
 */
@EnableScheduling
@SpringBootApplication
public class SlotNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlotNotifierApplication.class, args);
    }
}

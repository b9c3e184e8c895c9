package com.example.slotnotifier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Twilio WhatsApp messaging configuration
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioProperties {
    private String baseUrl = "https://api.twilio.com";
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private int timeoutSeconds = 20;
}

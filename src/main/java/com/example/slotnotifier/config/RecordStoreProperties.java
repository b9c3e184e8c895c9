package com.example.slotnotifier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for the spreadsheet-backed record store
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "record-store")
public class RecordStoreProperties {
    private String baseUrl = "http://localhost:8081";
    private String apiKey;
    private String playersPath = "/api/v1/sheets/players/rows";
    private String slotsPath = "/api/v1/sheets/slots/rows";
    private int timeoutSeconds = 30;
}

package com.example.slotnotifier.dto;

import com.example.slotnotifier.domain.model.PlayerPreference;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Request DTO for scheduling a player from preferences supplied in the request body
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePreferenceRequest {

    @NotBlank(message = "Display name is required")
    private String displayName;

    @NotEmpty(message = "At least one sport is required")
    private Set<String> sports;

    @NotEmpty(message = "At least one locality is required")
    private Set<String> localities;

    /**
     * Time of day, e.g. "7:30 PM" or "19:30"
     */
    @NotBlank(message = "Notification time is required")
    private String notificationTime;

    /**
     * One of Daily, Weekly, Twice a Week, Thrice a Week, Weekend
     */
    @NotBlank(message = "Notification frequency is required")
    private String notificationFrequency;

    public PlayerPreference toPreference(String identity) {
        return PlayerPreference.builder()
                .identity(identity)
                .displayName(displayName)
                .sports(sports)
                .localities(localities)
                .notificationTime(notificationTime)
                .notificationFrequency(notificationFrequency)
                .build();
    }
}

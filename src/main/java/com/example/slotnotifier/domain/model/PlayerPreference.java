package com.example.slotnotifier.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One player's notification preferences as read from the preference source.
 * <p>
 * Sports and localities keep the player's own spelling; matching normalizes them.
 */
@Value
@Builder(toBuilder = true)
public class PlayerPreference {

    String identity;
    String displayName;
    @Singular
    Set<String> sports;
    @Singular
    Set<String> localities;
    String notificationTime;
    String notificationFrequency;

    /**
     * Names of the required fields this record is missing, empty when complete
     */
    public List<String> missingFields() {
        var missing = new ArrayList<String>();
        if (isBlank(identity)) {
            missing.add("identity");
        }
        if (isBlank(displayName)) {
            missing.add("displayName");
        }
        if (sports.isEmpty()) {
            missing.add("sports");
        }
        if (localities.isEmpty()) {
            missing.add("localities");
        }
        if (isBlank(notificationTime)) {
            missing.add("notificationTime");
        }
        if (isBlank(notificationFrequency)) {
            missing.add("notificationFrequency");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

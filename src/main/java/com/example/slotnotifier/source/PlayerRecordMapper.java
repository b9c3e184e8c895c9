package com.example.slotnotifier.source;

import com.example.slotnotifier.domain.model.PlayerPreference;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps a row of the players sheet to a {@link PlayerPreference}.
 * Missing cells stay null or empty; completeness is checked by the caller.
 */
@Component
@RequiredArgsConstructor
public class PlayerRecordMapper {

    static final String PHONE_NUMBER = "Phone Number";
    static final String PLAYER_NAME = "Player Name";
    static final String PREFERENCES = "Preferences";
    static final String LOCALITY = "Locality";
    static final String NOTIFICATION_TIME = "Notification Time";
    static final String NOTIFICATION_FREQUENCY = "Notification Frequency";

    private final IdentityNormalizer identityNormalizer;

    public PlayerPreference toPreference(Map<String, Object> row) {
        return PlayerPreference.builder()
                .identity(identityNormalizer.normalize(row.get(PHONE_NUMBER)))
                .displayName(text(row.get(PLAYER_NAME)))
                .sports(tokens(row.get(PREFERENCES)))
                .localities(tokens(row.get(LOCALITY)))
                .notificationTime(stripApostrophe(text(row.get(NOTIFICATION_TIME))))
                .notificationFrequency(text(row.get(NOTIFICATION_FREQUENCY)))
                .build();
    }

    static String text(Object cell) {
        if (cell == null) {
            return null;
        }
        var value = cell.toString().strip();
        return value.isEmpty() ? null : value;
    }

    /**
     * Splits a comma separated cell, e.g. "Football, Padel", keeping cell order
     */
    static Set<String> tokens(Object cell) {
        var value = text(cell);
        var tokens = new LinkedHashSet<String>();
        if (value == null) {
            return tokens;
        }
        Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(token -> !token.isEmpty())
                .forEach(tokens::add);
        return tokens;
    }

    private static String stripApostrophe(String value) {
        if (value != null && value.startsWith("'")) {
            return value.substring(1).strip();
        }
        return value;
    }
}

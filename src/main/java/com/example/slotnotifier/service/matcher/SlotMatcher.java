package com.example.slotnotifier.service.matcher;

import com.example.slotnotifier.domain.model.PlayerPreference;
import com.example.slotnotifier.domain.model.Slot;
import com.example.slotnotifier.exception.InvalidSlotFormatException;
import com.example.slotnotifier.exception.InvalidTimeException;
import com.example.slotnotifier.service.resolver.ScheduleResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Selects the slots worth telling a player about.
 * <p>
 * A slot matches when it is not booked, its sport and locality are among the
 * player's (compared trimmed and case-insensitively) and it has not started
 * yet. A slot later today must also start after the player's notification
 * time. Slots with an unreadable date or time are dropped with a warning.
 * Snapshot order is kept.
 */
@Slf4j
@Component
public class SlotMatcher {

    public List<Slot> match(PlayerPreference player, List<Slot> snapshot, ZonedDateTime now) {
        var sports = normalize(player.getSports());
        var localities = normalize(player.getLocalities());
        var notBefore = notificationTimeOf(player);

        return snapshot.stream()
                .filter(Slot::isNotBooked)
                .filter(slot -> sports.contains(normalize(slot.getSport())))
                .filter(slot -> localities.contains(normalize(slot.getLocality())))
                .filter(slot -> isUpcoming(slot, now, notBefore))
                .toList();
    }

    /**
     * Open, upcoming slots of one business, for court-specific updates
     */
    public List<Slot> matchBusiness(String businessId, List<Slot> snapshot, ZonedDateTime now) {
        var business = normalize(businessId);
        return snapshot.stream()
                .filter(Slot::isNotBooked)
                .filter(slot -> business.equals(normalize(slot.getBusinessId())))
                .filter(slot -> isUpcoming(slot, now, null))
                .toList();
    }

    boolean isUpcoming(Slot slot, ZonedDateTime now, LocalTime notBefore) {
        try {
            var date = SlotTimeParser.parseDate(slot.getDate());
            var range = SlotTimeParser.parseTimeRange(slot.getTimeRange());
            var today = now.toLocalDate();
            if (date.isAfter(today)) {
                return true;
            }
            if (date.isBefore(today)) {
                return false;
            }
            var start = range.getStart();
            return start.isAfter(now.toLocalTime()) && (notBefore == null || start.isAfter(notBefore));
        } catch (InvalidSlotFormatException e) {
            log.warn("Skipping slot of {} on '{}' at '{}': {}", slot.getBusinessId(), slot.getDate(), slot.getTimeRange(), e.getMessage());
            return false;
        }
    }

    private LocalTime notificationTimeOf(PlayerPreference player) {
        if (player.getNotificationTime() == null) {
            return null;
        }
        try {
            return ScheduleResolver.parseTimeOfDay(player.getNotificationTime());
        } catch (InvalidTimeException e) {
            log.debug("Notification time of {} unreadable, matching against the current time only", player.getIdentity());
            return null;
        }
    }

    private static Set<String> normalize(Collection<String> values) {
        return values.stream().map(SlotMatcher::normalize).collect(Collectors.toSet());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

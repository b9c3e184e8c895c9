package com.example.slotnotifier.service;

import com.example.slotnotifier.config.MetricsConfig;
import com.example.slotnotifier.domain.model.NotificationMessage;
import com.example.slotnotifier.domain.model.PlayerPreference;
import com.example.slotnotifier.dto.NotificationResult;
import com.example.slotnotifier.exception.PlayerNotFoundException;
import com.example.slotnotifier.service.matcher.SlotMatcher;
import com.example.slotnotifier.service.notifier.DeliveryOutcome;
import com.example.slotnotifier.service.notifier.NotificationDeliveryService;
import com.example.slotnotifier.service.notifier.NotificationMessageRenderer;
import com.example.slotnotifier.source.AvailabilitySource;
import com.example.slotnotifier.source.IdentityNormalizer;
import com.example.slotnotifier.source.PreferenceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * The notification pipeline: fetch the slot snapshot, match it against a
 * player's preferences, render the message and deliver it.
 * <p>
 * Used by scheduled fires and by on-demand requests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerNotificationService {

    private final PreferenceSource preferenceSource;
    private final AvailabilitySource availabilitySource;
    private final SlotMatcher slotMatcher;
    private final NotificationMessageRenderer renderer;
    private final NotificationDeliveryService deliveryService;
    private final IdentityNormalizer identityNormalizer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public NotificationMessage compose(PlayerPreference player) {
        var now = ZonedDateTime.now(clock);
        var snapshot = availabilitySource.fetchSnapshot();
        var matched = slotMatcher.match(player, snapshot, now);
        log.info("Matched {} of {} slots for {}", matched.size(), snapshot.size(), player.getIdentity());
        return new NotificationMessage(renderer.render(player.getDisplayName(), matched), matched.size());
    }

    /**
     * Compose and deliver. Delivery failures are reported in the result, not thrown.
     *
     * @param deadline last instant a delivery retry may start; null for no limit
     */
    public NotificationResult notifyPlayer(PlayerPreference player, Instant deadline) {
        var message = compose(player);
        var outcome = deliveryService.deliver(player.getIdentity(), message.getText(), deadline);
        metricsConfig.recordDelivery(outcome.getStatus(), outcome.getAttempts());
        return toResult(player.getIdentity(), message, outcome);
    }

    /**
     * On-demand update for one player, e.g. when they ask for the latest slots
     */
    public NotificationResult notifyNow(String identity) {
        return notifyPlayer(requirePlayer(identity), null);
    }

    /**
     * Message a player would receive right now, without sending it
     */
    public NotificationResult preview(String identity) {
        var player = requirePlayer(identity);
        var message = compose(player);
        return NotificationResult.builder()
                .destination(player.getIdentity())
                .matchedSlotCount(message.getMatchedSlotCount())
                .message(message.getText())
                .build();
    }

    /**
     * Send the open slots of one business to a destination
     */
    public NotificationResult notifyBusinessAvailability(String businessId, String destination) {
        var normalizedDestination = identityNormalizer.normalize(destination);
        if (normalizedDestination == null) {
            throw new IllegalArgumentException("Destination is required");
        }
        var now = ZonedDateTime.now(clock);
        var matched = slotMatcher.matchBusiness(businessId, availabilitySource.fetchSnapshot(), now);
        var message = new NotificationMessage(renderer.renderBusinessUpdate(businessId, matched), matched.size());
        var outcome = deliveryService.deliver(normalizedDestination, message.getText());
        metricsConfig.recordDelivery(outcome.getStatus(), outcome.getAttempts());
        return toResult(normalizedDestination, message, outcome);
    }

    private PlayerPreference requirePlayer(String identity) {
        var normalized = identityNormalizer.normalize(identity);
        return preferenceSource.findByIdentity(normalized)
                .orElseThrow(() -> new PlayerNotFoundException(normalized));
    }

    private static NotificationResult toResult(String destination, NotificationMessage message, DeliveryOutcome outcome) {
        return NotificationResult.builder()
                .destination(destination)
                .matchedSlotCount(message.getMatchedSlotCount())
                .message(message.getText())
                .deliveryStatus(outcome.getStatus())
                .attempts(outcome.getAttempts())
                .error(outcome.getErrorMessage())
                .build();
    }
}

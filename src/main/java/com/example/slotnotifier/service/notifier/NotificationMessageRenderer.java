package com.example.slotnotifier.service.notifier;

import com.example.slotnotifier.config.DeliveryProperties;
import com.example.slotnotifier.domain.model.Slot;
import com.example.slotnotifier.exception.InvalidSlotFormatException;
import com.example.slotnotifier.service.matcher.SlotTimeParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the WhatsApp text for a set of matched slots.
 */
@Component
@RequiredArgsConstructor
public class NotificationMessageRenderer {

    static final String PRICE_NOT_PROVIDED = "Not Provided";
    static final String BOOKING_LINK_NOT_AVAILABLE = "Booking link not available";
    static final String INVALID_DATE = "Invalid Date Format";

    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final DeliveryProperties deliveryProperties;

    /**
     * Message for a player. An empty slot list yields the "nothing matches" text.
     */
    public String render(String displayName, List<Slot> slots) {
        if (slots.isEmpty()) {
            return String.format("Hi %s, currently no available slots match your preferences.", displayName);
        }
        var message = new StringBuilder("Hi " + displayName + ", here are the latest updates for your preferences:\n\n");
        slots.forEach(slot -> message.append(renderSlot(slot)).append("\n\n"));
        return message.toString().stripTrailing();
    }

    /**
     * Message listing the open slots of one business
     */
    public String renderBusinessUpdate(String businessName, List<Slot> slots) {
        var name = capitalize(businessName);
        if (slots.isEmpty()) {
            return String.format("No available slots for %s at the moment.", name);
        }
        var message = new StringBuilder("Here are the available slots at " + name + ":\n\n");
        slots.forEach(slot -> message.append(renderSlot(slot)).append("\n\n"));
        return message.toString().stripTrailing();
    }

    String renderSlot(Slot slot) {
        return String.join(" | ",
                "*Turf*: " + capitalize(slot.getBusinessId()),
                "*Sport*: " + capitalize(slot.getSport()),
                "*Area*: " + capitalize(slot.getLocality()),
                "*Date*: " + displayDate(slot.getDate()),
                "*Timing*: " + (slot.getTimeRange() != null ? slot.getTimeRange().trim() : ""),
                "*Price*: " + slot.getPrice().map(price -> "₹" + price).orElse(PRICE_NOT_PROVIDED),
                "👉 *Book Now*: " + bookingLink(slot));
    }

    private String bookingLink(Slot slot) {
        return slot.getBookingReference()
                .or(() -> {
                    var business = slot.getBusinessId() == null ? "" : slot.getBusinessId().trim().toLowerCase(Locale.ROOT);
                    return Optional.ofNullable(deliveryProperties.getBookingLinks().get(business));
                })
                .orElse(BOOKING_LINK_NOT_AVAILABLE);
    }

    private static String displayDate(String date) {
        try {
            return SlotTimeParser.parseDate(date).format(DISPLAY_DATE);
        } catch (InvalidSlotFormatException e) {
            return INVALID_DATE;
        }
    }

    private static String capitalize(String value) {
        if (value == null) {
            return "";
        }
        return StringUtils.capitalize(value.trim().toLowerCase(Locale.ROOT));
    }
}

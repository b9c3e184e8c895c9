package com.example.slotnotifier.source;

import com.example.slotnotifier.config.SlotNotifierProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Brings phone numbers into international form, e.g. {@code 98765 43210} to {@code +919876543210}.
 */
@Component
@RequiredArgsConstructor
public class IdentityNormalizer {

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private final SlotNotifierProperties properties;

    /**
     * @return the normalized identity, or null when the value holds no number
     */
    public String normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        var value = raw instanceof Number number
                ? new BigDecimal(number.toString()).stripTrailingZeros().toPlainString()
                : raw.toString();
        value = value.strip();
        if (value.startsWith(WHATSAPP_PREFIX)) {
            value = value.substring(WHATSAPP_PREFIX.length());
        }
        value = value.replaceAll("[\\s\\-()']", "");
        if (value.isEmpty()) {
            return null;
        }
        return value.startsWith("+") ? value : properties.getDefaultCountryCode() + value;
    }
}

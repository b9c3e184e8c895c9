package com.example.slotnotifier.service.notifier;

import com.example.slotnotifier.exception.ExternalServiceException;

/**
 * Outbound messaging provider.
 */
public interface MessageChannel {

    /**
     * Name used in logs and alerts
     */
    String getName();

    /**
     * Send one text message.
     *
     * @param destination player identity in international format, e.g. {@code +919876543210}
     * @param text        message body
     * @return provider id of the accepted message
     * @throws ExternalServiceException when the provider rejects the message or cannot be reached;
     *                                  {@link ExternalServiceException#isRetryable()} tells whether resending may help
     */
    String send(String destination, String text);
}

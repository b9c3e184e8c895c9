package com.example.slotnotifier.client;

import com.example.slotnotifier.client.ClientModels.TwilioMessageResponse;
import com.example.slotnotifier.config.TwilioProperties;
import com.example.slotnotifier.exception.ExternalServiceException;
import com.example.slotnotifier.service.notifier.MessageChannel;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * WhatsApp delivery through the Twilio Messages API.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so a Twilio outage fails fast
 * - WebClient with form-encoded requests and basic auth
 * <p>
 * Retries are left to the caller, which decides per failure whether resending is worth it.
 */
@Slf4j
@Component
public class TwilioWhatsAppChannel implements MessageChannel {

    private static final String SERVICE_NAME = "Twilio";
    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private final WebClient webClient;
    private final TwilioProperties properties;

    public TwilioWhatsAppChannel(@Qualifier("twilioWebClient") WebClient webClient, TwilioProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "twilio-whatsapp";
    }

    @Override
    @CircuitBreaker(name = "twilio", fallbackMethod = "sendFallback")
    public String send(String destination, String text) {
        if (!StringUtils.hasText(properties.getAccountSid()) || !StringUtils.hasText(properties.getFromNumber())) {
            throw new ExternalServiceException(SERVICE_NAME, "Twilio account or sender number not configured", false);
        }
        log.debug("Sending WhatsApp message to {}", destination);

        var form = new LinkedMultiValueMap<String, String>();
        form.add("From", whatsapp(properties.getFromNumber()));
        form.add("To", whatsapp(destination));
        form.add("Body", text);

        TwilioMessageResponse response;
        try {
            response = webClient.post()
                    .uri("/2010-04-01/Accounts/{accountSid}/Messages.json", properties.getAccountSid())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(TwilioMessageResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to send WhatsApp message to {}: {}", destination, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }

        if (response == null || response.getSid() == null) {
            throw new ExternalServiceException(SERVICE_NAME, "Empty response for message to " + destination);
        }
        log.debug("Twilio accepted message {} for {} with status {}", response.getSid(), destination, response.getStatus());
        return response.getSid();
    }

    /**
     * Fallback when the circuit breaker is open
     */
    @SuppressWarnings("unused")
    private String sendFallback(String destination, String text, CallNotPermittedException e) {
        log.warn("Circuit breaker open for Twilio, message to {} not sent", destination);
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    private static String whatsapp(String number) {
        return number.startsWith(WHATSAPP_PREFIX) ? number : WHATSAPP_PREFIX + number;
    }
}

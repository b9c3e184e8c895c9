package com.example.slotnotifier.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for external service calls.
 * <p>
 * One client for the record store (player preferences and slot sheets) and
 * one for the Twilio messaging API, each with its own timeouts and
 * credentials.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    private static final String API_KEY_HEADER = "X-API-Key";

    @Bean(name = "recordStoreWebClient")
    public WebClient recordStoreWebClient(WebClient.Builder builder, RecordStoreProperties properties) {
        var client = createWebClient(builder, properties.getBaseUrl(), properties.getTimeoutSeconds(), "RecordStore")
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.getApiKey())) {
            client.defaultHeader(API_KEY_HEADER, properties.getApiKey());
        }
        return client.build();
    }

    @Bean(name = "twilioWebClient")
    public WebClient twilioWebClient(WebClient.Builder builder, TwilioProperties properties) {
        var client = createWebClient(builder, properties.getBaseUrl(), properties.getTimeoutSeconds(), "Twilio")
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.getAccountSid()) && StringUtils.hasText(properties.getAuthToken())) {
            client.defaultHeaders(headers -> headers.setBasicAuth(properties.getAccountSid(), properties.getAuthToken()));
        } else {
            log.warn("Twilio credentials are not configured, message delivery will be rejected");
        }
        return client.build();
    }

    private WebClient.Builder createWebClient(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("X-Service-Name", "slot-notifier")
                .filter(logRequest(serviceName))
                .filter(logResponse(serviceName));
    }

    private ExchangeFilterFunction logRequest(String serviceName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", serviceName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse(String serviceName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", serviceName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", serviceName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}

package com.example.slotnotifier.client;

import com.example.slotnotifier.config.RecordStoreProperties;
import com.example.slotnotifier.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the spreadsheet record store.
 * <p>
 * Every sheet is served as a JSON array of rows, each row an object keyed by
 * column header. Rows are returned untyped and mapped by the source adapters.
 */
@Slf4j
@Component
public class RecordStoreClient {

    private static final String SERVICE_NAME = "Record Store";
    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final RecordStoreProperties properties;

    public RecordStoreClient(@Qualifier("recordStoreWebClient") WebClient webClient, RecordStoreProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @CircuitBreaker(name = "recordStore")
    @Retry(name = "recordStore")
    public List<Map<String, Object>> fetchPlayerRows() {
        return fetchRows(properties.getPlayersPath());
    }

    @CircuitBreaker(name = "recordStore")
    @Retry(name = "recordStore")
    public List<Map<String, Object>> fetchSlotRows() {
        return fetchRows(properties.getSlotsPath());
    }

    private List<Map<String, Object>> fetchRows(String path) {
        log.debug("Fetching rows from {}", path);

        try {
            var rows = webClient.get()
                    .uri(path)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(ROWS)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
            return rows != null ? rows : List.of();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch rows from {}: {}", path, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }
}

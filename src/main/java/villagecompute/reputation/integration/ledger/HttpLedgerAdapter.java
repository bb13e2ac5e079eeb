/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.integration.ledger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.LedgerEventFilterType;
import villagecompute.reputation.api.types.LedgerEventType;
import villagecompute.reputation.api.types.LedgerStateQueryType;
import villagecompute.reputation.api.types.LedgerStateResultType;
import villagecompute.reputation.api.types.LedgerTransactionRequestType;
import villagecompute.reputation.api.types.LedgerTransactionResultType;
import villagecompute.reputation.api.types.LedgerTransactionStatus;
import villagecompute.reputation.exceptions.LedgerUnavailableException;

/**
 * HTTP client for the ledger node's JSON gateway.
 *
 * <p>
 * <b>Endpoints:</b>
 * <ul>
 * <li>{@code POST /v1/transactions} - submit a contract call</li>
 * <li>{@code POST /v1/state/query} - read contract state (404 means no state)</li>
 * <li>{@code GET /v1/events?cursor=...} - page through contract events</li>
 * </ul>
 *
 * <p>
 * HTTP 5xx, 429, timeouts and I/O errors map to {@link LedgerUnavailableException}. Other 4xx responses on submit are
 * returned as {@code FAILED} results carrying the gateway's error message.
 */
@ApplicationScoped
public class HttpLedgerAdapter implements LedgerAdapter {

    private static final Logger LOG = Logger.getLogger(HttpLedgerAdapter.class);

    private static final String TRANSACTIONS_PATH = "/v1/transactions";
    private static final String STATE_QUERY_PATH = "/v1/state/query";
    private static final String EVENTS_PATH = "/v1/events";

    @ConfigProperty(
            name = "reputation.ledger.base-url",
            defaultValue = "http://localhost:9650")
    String baseUrl;

    @ConfigProperty(
            name = "reputation.ledger.request-timeout",
            defaultValue = "10s")
    Duration requestTimeout;

    @ConfigProperty(
            name = "reputation.ledger.event-poll-interval",
            defaultValue = "5s")
    Duration eventPollInterval;

    @Inject
    ObjectMapper objectMapper;

    HttpClient httpClient;

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
        LOG.infof("Ledger adapter configured: baseUrl=%s, timeout=%s", baseUrl, requestTimeout);
    }

    @Override
    public LedgerTransactionResultType submitTransaction(LedgerTransactionRequestType request) {
        LOG.debugf("Submitting %s to contract %s", request.functionName(), request.to());

        HttpResponse<String> response = send(post(TRANSACTIONS_PATH, request), "submit " + request.functionName());
        JsonNode root = readBody(response);

        if (response.statusCode() >= 400) {
            // 4xx other than 429: the gateway rejected the call, nothing was applied
            String error = root.path("error").asText(root.path("message").asText("HTTP " + response.statusCode()));
            LOG.warnf("Ledger rejected %s: status=%d, error=%s", request.functionName(), response.statusCode(), error);
            return new LedgerTransactionResultType(null, LedgerTransactionStatus.FAILED, List.of(), error);
        }

        LedgerTransactionResultType result = LedgerResponseNormalizer.toTransactionResult(root, objectMapper);
        LOG.debugf("Ledger %s result: tx=%s, status=%s", request.functionName(), result.transactionId(),
                result.status());
        return result;
    }

    @Override
    public LedgerStateResultType queryState(LedgerStateQueryType query) {
        HttpResponse<String> response = send(post(STATE_QUERY_PATH, query), "query " + query.method());
        if (response.statusCode() == 404) {
            return new LedgerStateResultType(Map.of());
        }
        if (response.statusCode() >= 400) {
            throw new LedgerUnavailableException(
                    "Ledger state query " + query.method() + " returned status " + response.statusCode());
        }
        return new LedgerStateResultType(LedgerResponseNormalizer.toStateData(readBody(response), objectMapper));
    }

    /**
     * Polls the events endpoint every {@code reputation.ledger.event-poll-interval}. Each subscription keeps its own
     * cursor, starting from the ledger's current head.
     */
    @Override
    public Multi<LedgerEventType> watchEvents(LedgerEventFilterType filter) {
        return Multi.createFrom().deferred(() -> {
            AtomicReference<String> cursor = new AtomicReference<>();
            return Multi.createFrom().ticks().every(eventPollInterval).onOverflow().drop()
                    .emitOn(Infrastructure.getDefaultWorkerPool())
                    .onItem().transformToIterable(tick -> pollEvents(filter, cursor));
        });
    }

    List<LedgerEventType> pollEvents(LedgerEventFilterType filter, AtomicReference<String> cursor) {
        StringBuilder url = new StringBuilder(baseUrl).append(EVENTS_PATH).append("?limit=100");
        if (cursor.get() != null) {
            url.append("&cursor=").append(encode(cursor.get()));
        }
        for (String address : filter.addresses()) {
            url.append("&address=").append(encode(address));
        }
        for (String topic : filter.topics()) {
            url.append("&topic=").append(encode(topic));
        }

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url.toString())).timeout(requestTimeout)
                .header("Accept", "application/json").GET().build();
        HttpResponse<String> response = send(request, "poll events");
        if (response.statusCode() >= 400) {
            throw new LedgerUnavailableException("Ledger event poll returned status " + response.statusCode());
        }

        JsonNode root = readBody(response);
        List<LedgerEventType> events = new ArrayList<>();
        for (JsonNode rawEvent : root.path("events")) {
            events.add(LedgerResponseNormalizer.toEvent(rawEvent, objectMapper));
        }
        String next = root.path("next_cursor").asText(root.path("nextCursor").asText(null));
        if (next != null && !next.isBlank()) {
            cursor.set(next);
        }
        return events;
    }

    private HttpRequest post(String path, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize ledger request for " + path, e);
        }
        return HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(requestTimeout)
                .header("Content-Type", "application/json").header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json)).build();
    }

    private HttpResponse<String> send(HttpRequest request, String operation) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException("Ledger call cancelled: " + operation, e);
        } catch (IOException e) {
            LOG.warnf("Ledger unreachable during %s: %s", operation, e.getMessage());
            throw new LedgerUnavailableException("Ledger unreachable during " + operation, e);
        }

        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            LOG.warnf("Ledger returned status %d during %s", status, operation);
            throw new LedgerUnavailableException("Ledger returned status " + status + " during " + operation);
        }
        return response;
    }

    private JsonNode readBody(HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LedgerUnavailableException("Ledger returned a malformed response body", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.integration.ledger;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.reputation.api.types.LedgerClaimStatusType;
import villagecompute.reputation.api.types.LedgerEventType;
import villagecompute.reputation.api.types.LedgerReputationSnapshotType;
import villagecompute.reputation.api.types.LedgerTransactionResultType;
import villagecompute.reputation.api.types.LedgerTransactionStatus;
import villagecompute.reputation.exceptions.DataIntegrityException;

/**
 * Maps the ledger's inconsistently named response fields onto the canonical types.
 *
 * <p>
 * This is the only place that knows about field aliases. Everything behind the adapter boundary works with
 * {@link LedgerTransactionResultType}, {@link LedgerReputationSnapshotType} and {@link LedgerClaimStatusType}.
 *
 * <p>
 * <b>Aliases handled:</b>
 * <ul>
 * <li>Transaction id: {@code transactionId}, {@code transaction_id}, {@code transactionHash}, {@code hash},
 * {@code digest}, {@code id}, {@code result.transaction_id}</li>
 * <li>Status: {@code status} (confirmed/success/pending/failed/failure), {@code effects.status.status}, boolean
 * {@code success}</li>
 * <li>Error: {@code error}, {@code errorMessage}, {@code message}</li>
 * </ul>
 */
public final class LedgerResponseNormalizer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String[] TRANSACTION_ID_FIELDS = {"transactionId", "transaction_id", "transactionHash",
            "transaction_hash", "hash", "digest", "id"};
    private static final String[] ERROR_FIELDS = {"error", "errorMessage", "error_message", "message"};

    private LedgerResponseNormalizer() {
    }

    /**
     * Normalizes a raw transaction submission response.
     */
    public static LedgerTransactionResultType toTransactionResult(JsonNode raw, ObjectMapper mapper) {
        String transactionId = firstText(raw, TRANSACTION_ID_FIELDS);
        if (transactionId == null && raw.hasNonNull("result")) {
            transactionId = firstText(raw.get("result"), TRANSACTION_ID_FIELDS);
        }

        List<LedgerEventType> events = new ArrayList<>();
        JsonNode rawEvents = raw.get("events");
        if (rawEvents != null && rawEvents.isArray()) {
            for (JsonNode rawEvent : rawEvents) {
                events.add(toEvent(rawEvent, mapper));
            }
        }

        return new LedgerTransactionResultType(transactionId, toStatus(raw), events, firstText(raw, ERROR_FIELDS));
    }

    /**
     * Normalizes a raw event; {@code type} falls back to {@code eventType} / {@code event}, and payload to
     * {@code parsedJson} / {@code payload}.
     */
    public static LedgerEventType toEvent(JsonNode raw, ObjectMapper mapper) {
        String type = firstText(raw, "type", "eventType", "event");
        JsonNode payload = firstNode(raw, "data", "parsedJson", "parsed_json", "payload");
        Map<String, Object> data = payload == null || !payload.isObject() ? Map.of()
                : mapper.convertValue(payload, MAP_TYPE);
        return new LedgerEventType(shortEventName(type), data);
    }

    /**
     * Unwraps the state payload of a query response ({@code data}, {@code result} or the object itself).
     */
    public static Map<String, Object> toStateData(JsonNode raw, ObjectMapper mapper) {
        JsonNode payload = firstNode(raw, "data", "result");
        if (payload == null) {
            payload = raw;
        }
        if (payload.isObject() && payload.hasNonNull("fields")) {
            payload = payload.get("fields");
        }
        if (!payload.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(payload, MAP_TYPE);
    }

    /**
     * Builds a reputation snapshot from query state.
     *
     * @return empty when the ledger holds no reputation for the user
     * @throws DataIntegrityException
     *             when state exists but carries no score
     */
    public static Optional<LedgerReputationSnapshotType> toReputationSnapshot(String userId,
            Map<String, Object> data) {
        if (data.isEmpty()) {
            return Optional.empty();
        }
        Object score = first(data, "reputation_score", "reputationScore", "score");
        if (score == null) {
            throw new DataIntegrityException("Ledger reputation state for user " + userId + " has no score field");
        }
        Object level = first(data, "verification_level", "verificationLevel");
        Object updated = first(data, "last_updated", "lastUpdated", "updated_at");
        Object source = first(data, "source_transaction_id", "sourceTransactionId", "transaction_id",
                "previous_transaction", "digest");

        int levelCode = level == null ? 0 : (int) toLong(level);
        return Optional.of(new LedgerReputationSnapshotType(userId, toLong(score), levelCode, toInstant(updated),
                source == null ? null : source.toString()));
    }

    /**
     * Builds a claim status from query state. An empty payload or {@code claimed=false} means unclaimed.
     */
    public static LedgerClaimStatusType toClaimStatus(Map<String, Object> data) {
        if (data.isEmpty()) {
            return LedgerClaimStatusType.unclaimed();
        }
        Object claimed = first(data, "claimed", "has_claimed", "hasClaimed");
        Object transactionId = first(data, "transaction_id", "transactionId", "digest", "hash");
        boolean isClaimed = claimed == null ? transactionId != null : Boolean.parseBoolean(claimed.toString());
        if (!isClaimed) {
            return LedgerClaimStatusType.unclaimed();
        }
        Object amount = first(data, "amount", "bonus_amount");
        return new LedgerClaimStatusType(true, transactionId == null ? null : transactionId.toString(),
                amount == null ? 0L : toLong(amount), toInstant(first(data, "claimed_at", "claimedAt", "timestamp")));
    }

    static LedgerTransactionStatus toStatus(JsonNode raw) {
        String status = null;
        if (raw.hasNonNull("status") && raw.get("status").isTextual()) {
            status = raw.get("status").asText();
        } else if (raw.at("/effects/status/status").isTextual()) {
            status = raw.at("/effects/status/status").asText();
        }

        if (status != null) {
            switch (status.toLowerCase(Locale.ROOT)) {
                case "confirmed", "success", "succeeded", "finalized" -> {
                    return LedgerTransactionStatus.CONFIRMED;
                }
                case "pending", "submitted", "processing" -> {
                    return LedgerTransactionStatus.PENDING;
                }
                default -> {
                    return LedgerTransactionStatus.FAILED;
                }
            }
        }
        if (raw.has("success") && raw.get("success").isBoolean()) {
            return raw.get("success").asBoolean() ? LedgerTransactionStatus.CONFIRMED : LedgerTransactionStatus.FAILED;
        }
        // No recognizable status: never assume finality
        return LedgerTransactionStatus.PENDING;
    }

    /**
     * Strips a Move-style module prefix ({@code 0xabc::reputation::ReputationUpdated} becomes
     * {@code ReputationUpdated}).
     */
    static String shortEventName(String type) {
        if (type == null) {
            return "unknown";
        }
        int separator = type.lastIndexOf("::");
        return separator >= 0 ? type.substring(separator + 2) : type;
    }

    static long toLong(Object value) {
        if (value instanceof Number number) {
            return Math.round(number.doubleValue());
        }
        try {
            return Math.round(Double.parseDouble(value.toString().trim()));
        } catch (NumberFormatException e) {
            throw new DataIntegrityException("Ledger returned a non-numeric value: " + value, e);
        }
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = value.toString().trim();
        if (text.chars().allMatch(Character::isDigit) && !text.isEmpty()) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Object first(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static JsonNode firstNode(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}

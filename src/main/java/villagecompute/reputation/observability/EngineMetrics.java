/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.observability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Counters for the engine's three primary operations and the ledger event stream.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code reputation_trust_scores_total{cache}} - Trust scores served, {@code hit} or {@code miss}</li>
 * <li>{@code reputation_trust_clamped_endorsements_total} - Endorser trust scores clamped into [0, 1]</li>
 * <li>{@code reputation_reconcile_total{result}} - Reconciliation outcomes ({@code noop}, {@code corrected},
 * {@code correction_failed}, {@code ledger_unreachable})</li>
 * <li>{@code reputation_claims_total{result}} - Claim outcomes ({@code success} or the rejection reason code)</li>
 * <li>{@code reputation_claim_bookkeeping_failures_total} - Confirmed claims whose local record could not be
 * written</li>
 * <li>{@code reputation_ledger_events_total{type}} - Ledger events consumed by the monitor</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class EngineMetrics {

    public static final String RECONCILE_NOOP = "noop";
    public static final String RECONCILE_CORRECTED = "corrected";
    public static final String RECONCILE_CORRECTION_FAILED = "correction_failed";
    public static final String RECONCILE_LEDGER_UNREACHABLE = "ledger_unreachable";

    public static final String CLAIM_SUCCESS = "success";

    private final MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    @Inject
    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementTrustScore(boolean cacheHit) {
        counter("reputation_trust_scores_total", "Trust scores served", "cache", cacheHit ? "hit" : "miss")
                .increment();
    }

    public void incrementClampedEndorsements(int count) {
        if (count > 0) {
            Counter.builder("reputation_trust_clamped_endorsements_total")
                    .description("Endorser trust scores clamped into [0, 1]").register(registry).increment(count);
        }
    }

    public void incrementReconcile(String result) {
        counter("reputation_reconcile_total", "Reputation reconciliation outcomes", "result", result).increment();
    }

    public void incrementClaim(String result) {
        counter("reputation_claims_total", "Campaign bonus claim outcomes", "result", result).increment();
    }

    public void incrementClaimBookkeepingFailure() {
        Counter.builder("reputation_claim_bookkeeping_failures_total")
                .description("Confirmed claims whose local record could not be written").register(registry)
                .increment();
    }

    public void incrementLedgerEvent(String eventType) {
        counter("reputation_ledger_events_total", "Ledger events consumed", "type", eventType).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + ":" + tagValue, k -> Counter.builder(name).description(description)
                .tags(List.of(Tag.of(tagKey, tagValue))).register(registry));
    }
}

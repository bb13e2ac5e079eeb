/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.jobs;

import java.time.Clock;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.subscription.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.LedgerEventType;
import villagecompute.reputation.data.models.ReputationRecord;
import villagecompute.reputation.data.repositories.ReputationRecordRepository;
import villagecompute.reputation.integration.ledger.LedgerGateway;
import villagecompute.reputation.observability.EngineMetrics;
import villagecompute.reputation.services.TrustScoreService;

/**
 * Consumes ledger events and keeps local derived state fresh.
 *
 * <p>
 * <b>Event Handling:</b>
 * <ul>
 * <li>{@code EndorsementRecorded} - invalidates cached trust scores of the content</li>
 * <li>{@code ConnectionAdded} / {@code ConnectionRemoved} - invalidates cached trust scores of the follower</li>
 * <li>{@code ReputationUpdated} - marks the user's record {@code pending} so the next sync run re-checks it</li>
 * </ul>
 *
 * <p>
 * The subscription starts with the application when {@code reputation.ledger.event-monitor.enabled} is true and is
 * re-established with exponential backoff whenever the stream fails.
 */
@ApplicationScoped
public class LedgerEventMonitor {

    private static final Logger LOG = Logger.getLogger(LedgerEventMonitor.class);

    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final Duration MAX_BACKOFF = Duration.ofMinutes(1);

    @ConfigProperty(
            name = "reputation.ledger.event-monitor.enabled",
            defaultValue = "true")
    boolean enabled;

    @Inject
    LedgerGateway ledger;

    @Inject
    TrustScoreService trustScoreService;

    @Inject
    ReputationRecordRepository repository;

    @Inject
    EngineMetrics metrics;

    @Inject
    Clock clock;

    private volatile Cancellable subscription;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.info("Ledger event monitor disabled");
            return;
        }
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = ledger.watchEngineEvents()
                .onFailure().invoke(e -> LOG.warnf("Ledger event stream failed, resubscribing: %s", e.getMessage()))
                .onFailure().retry().withBackOff(INITIAL_BACKOFF, MAX_BACKOFF).indefinitely()
                .subscribe().with(this::handle, e -> LOG.errorf(e, "Ledger event stream terminated"));
        LOG.infof("Ledger event monitor subscribed to %s", LedgerGateway.MONITORED_EVENTS);
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
            LOG.info("Ledger event monitor stopped");
        }
    }

    /**
     * Applies one event. Failures are logged and do not end the subscription.
     */
    void handle(LedgerEventType event) {
        metrics.incrementLedgerEvent(event.type());
        try {
            switch (event.type()) {
                case "EndorsementRecorded" -> {
                    String contentId = field(event, "content_id", "contentId", "recommendation_id");
                    if (contentId != null) {
                        trustScoreService.onEndorsementRecorded(contentId);
                    }
                }
                case "ConnectionAdded", "ConnectionRemoved" -> {
                    String followerId = field(event, "follower_id", "followerId", "follower", "from");
                    if (followerId != null) {
                        trustScoreService.onConnectionsChanged(followerId);
                    }
                }
                case "ReputationUpdated" -> {
                    String userId = field(event, "user_id", "userId", "user");
                    if (userId != null) {
                        repository.updateSyncState(userId, ReputationRecord.SYNC_STATE_PENDING, clock.instant());
                    }
                }
                default -> LOG.debugf("Ignoring ledger event %s", event.type());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to apply ledger event %s", event.type());
        }
    }

    private static String field(LedgerEventType event, String... names) {
        for (String name : names) {
            String value = event.stringField(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}

/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.TrustScoreResultType;

/**
 * Keyed (viewer, content) cache of trust-score results with an explicit TTL and explicit invalidation.
 *
 * <p>
 * Entries expire {@code reputation.trust.cache-ttl} after being written. A new endorsement for a content item
 * invalidates every viewer's entry for that item; a change to a viewer's connections invalidates that viewer's
 * entries. Friend-of-friend effects of a connection change are left to the TTL.
 *
 * <p>
 * Every invalidation advances a generation counter. A result computed across an invalidation is never kept: callers
 * take {@link #generation()} before reading their inputs and hand it back to {@link #put}.
 *
 * <p>
 * <b>Thread Safety:</b> Backed by a Caffeine cache; all operations are thread-safe.
 */
@ApplicationScoped
public class TrustScoreCache {

    private static final Logger LOG = Logger.getLogger(TrustScoreCache.class);

    record Key(String viewerId, String contentId) {
    }

    private final Cache<Key, TrustScoreResultType> cache;
    private final AtomicLong generation = new AtomicLong();

    @Inject
    public TrustScoreCache(@ConfigProperty(
            name = "reputation.trust.cache-ttl",
            defaultValue = "10m") Duration ttl,
            @ConfigProperty(
                    name = "reputation.trust.cache-max-size",
                    defaultValue = "50000") long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    TrustScoreCache(Duration ttl, long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(maxSize).ticker(ticker).build();
        LOG.infof("Trust score cache configured: ttl=%s, maxSize=%d", ttl, maxSize);
    }

    public Optional<TrustScoreResultType> find(String viewerId, String contentId) {
        return Optional.ofNullable(cache.getIfPresent(new Key(viewerId, contentId)));
    }

    /**
     * @return the current invalidation generation, to be passed to {@link #put}
     */
    public long generation() {
        return generation.get();
    }

    /**
     * Caches a result whose inputs were read at {@code readGeneration}.
     *
     * @return false if an invalidation ran since then, in which case the result is not kept
     */
    public boolean put(TrustScoreResultType result, long readGeneration) {
        if (generation.get() != readGeneration) {
            return false;
        }
        Key key = new Key(result.viewerId(), result.contentId());
        cache.put(key, result);
        // An invalidation that started before the put may have missed the new key
        if (generation.get() != readGeneration) {
            cache.asMap().remove(key, result);
            return false;
        }
        return true;
    }

    /**
     * Drops every viewer's entry for a content item.
     *
     * @return number of entries removed
     */
    public int invalidateContent(String contentId) {
        return invalidateWhere(key -> key.contentId().equals(contentId));
    }

    /**
     * Drops every entry computed for a viewer.
     *
     * @return number of entries removed
     */
    public int invalidateViewer(String viewerId) {
        return invalidateWhere(key -> key.viewerId().equals(viewerId));
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private int invalidateWhere(Predicate<Key> predicate) {
        generation.incrementAndGet();
        int removed = 0;
        for (Key key : cache.asMap().keySet()) {
            if (predicate.test(key) && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        LOG.debugf("Invalidated %d trust score cache entries", removed);
        return removed;
    }
}

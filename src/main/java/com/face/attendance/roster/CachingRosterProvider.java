package com.face.attendance.roster;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Caffeine-backed cache in front of a slower {@link RosterProvider}.
 * Call {@link #invalidate(String)} when a class roster changes.
 */
public class CachingRosterProvider implements RosterProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingRosterProvider.class);

    private final RosterProvider delegate;
    private final Cache<String, Set<String>> cache;

    public CachingRosterProvider(RosterProvider delegate, RosterCacheConfig config) {
        this(delegate, config, Ticker.systemTicker());
    }

    CachingRosterProvider(RosterProvider delegate, RosterCacheConfig config, Ticker ticker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("CachingRosterProvider initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Set<String> rosterFor(String classId) {
        return cache.get(classId, id -> Set.copyOf(delegate.rosterFor(id)));
    }

    @Override
    public Set<String> classesOf(String identityId) {
        return delegate.classesOf(identityId);
    }

    public void invalidate(String classId) {
        cache.invalidate(classId);
        log.debug("roster.cache.invalidated classId={}", classId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}

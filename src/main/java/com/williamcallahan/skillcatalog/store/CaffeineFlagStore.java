package com.williamcallahan.skillcatalog.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-process flag store with a per-entry time-to-live.
 *
 * <p>Values written with {@link #putIfAbsent} act as run guards and live in their own cache,
 * bounded only by expiry, so a burst of ordinary flags can never evict them.</p>
 */
@Component
public class CaffeineFlagStore implements FlagStore {
    static final long MAX_ENTRIES = 100_000;

    private final Cache<String, FlagEntry> entries;
    private final Cache<String, FlagEntry> guards;

    @Autowired
    public CaffeineFlagStore() {
        this(Ticker.systemTicker());
    }

    /**
     * Creates a store driven by the given ticker; tests pass a fake ticker to advance time.
     */
    public CaffeineFlagStore(Ticker ticker) {
        this(ticker, MAX_ENTRIES);
    }

    CaffeineFlagStore(Ticker ticker, long maxEntries) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new PerEntryExpiry())
                .build();
        this.guards = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new PerEntryExpiry())
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        FlagEntry entry = guards.getIfPresent(key);
        if (entry == null) {
            entry = entries.getIfPresent(key);
        }
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        FlagEntry entry = new FlagEntry(value, ttl);
        guards.invalidate(key);
        entries.put(key, entry);
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        FlagEntry entry = new FlagEntry(value, ttl);
        if (entries.getIfPresent(key) != null) {
            return false;
        }
        return guards.asMap().putIfAbsent(key, entry) == null;
    }

    @Override
    public List<String> listKeys(String prefix, int limit) {
        return Stream.concat(guards.asMap().keySet().stream(), entries.asMap().keySet().stream())
                .filter(key -> key.startsWith(prefix))
                .distinct()
                .sorted()
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String key) {
        guards.invalidate(key);
        entries.invalidate(key);
    }

    void cleanUp() {
        entries.cleanUp();
        guards.cleanUp();
    }

    private record FlagEntry(String value, Duration ttl) {
        private FlagEntry {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(ttl, "ttl");
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("Flag TTL must be positive");
            }
        }
    }

    private static final class PerEntryExpiry implements Expiry<String, FlagEntry> {
        @Override
        public long expireAfterCreate(String key, FlagEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, FlagEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, FlagEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

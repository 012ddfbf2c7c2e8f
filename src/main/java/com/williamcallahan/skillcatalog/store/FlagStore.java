package com.williamcallahan.skillcatalog.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Small key-value map for short-lived flags and run metrics.
 */
public interface FlagStore {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    /**
     * Stores the value only when the key is absent.
     *
     * @return true when the value was stored
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    /**
     * Lists live keys with the given prefix, at most {@code limit} of them.
     */
    List<String> listKeys(String prefix, int limit);

    void delete(String key);
}

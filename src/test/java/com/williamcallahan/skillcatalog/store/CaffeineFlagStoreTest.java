package com.williamcallahan.skillcatalog.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies per-entry expiry, conditional puts and prefix listing of the in-process flag store.
 */
class CaffeineFlagStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineFlagStore flagStore;

    @BeforeEach
    void setUp() {
        flagStore = new CaffeineFlagStore(nanos::get);
    }

    @Test
    void entryExpiresAfterItsOwnTtl() {
        flagStore.put("short", "1", Duration.ofMinutes(1));
        flagStore.put("long", "1", Duration.ofHours(1));

        advance(Duration.ofMinutes(2));

        assertTrue(flagStore.get("short").isEmpty());
        assertEquals(Optional.of("1"), flagStore.get("long"));
    }

    @Test
    void putIfAbsentOnlyWinsOnce() {
        assertTrue(flagStore.putIfAbsent("guard", "a", Duration.ofHours(1)));
        assertFalse(flagStore.putIfAbsent("guard", "b", Duration.ofHours(1)));
        assertEquals(Optional.of("a"), flagStore.get("guard"));

        advance(Duration.ofHours(2));

        assertTrue(flagStore.putIfAbsent("guard", "c", Duration.ofHours(1)));
    }

    @Test
    void listsSortedKeysByPrefixUpToLimit() {
        flagStore.put("needs_update:b", "1", Duration.ofHours(1));
        flagStore.put("needs_update:a", "1", Duration.ofHours(1));
        flagStore.put("needs_update:c", "1", Duration.ofHours(1));
        flagStore.put("other:a", "1", Duration.ofHours(1));

        assertEquals(List.of("needs_update:a", "needs_update:b"), flagStore.listKeys("needs_update:", 2));

        flagStore.delete("needs_update:a");
        assertEquals(List.of("needs_update:b", "needs_update:c"), flagStore.listKeys("needs_update:", 10));
    }

    @Test
    void guardSurvivesFlagsBeyondCapacity() {
        CaffeineFlagStore small = new CaffeineFlagStore(nanos::get, 3);
        assertTrue(small.putIfAbsent("downloads:aggregated:2025-05-10", "1", Duration.ofHours(25)));

        for (int i = 0; i < 50; i++) {
            small.put("needs_update:skill-" + i, "1", Duration.ofHours(1));
        }
        small.cleanUp();

        assertEquals(Optional.of("1"), small.get("downloads:aggregated:2025-05-10"));
        assertFalse(small.putIfAbsent("downloads:aggregated:2025-05-10", "2", Duration.ofHours(25)));
        assertTrue(small.listKeys("needs_update:", 100).size() <= 3);
    }

    @Test
    void plainFlagBlocksConditionalPutAndDeleteClearsBoth() {
        flagStore.put("guard", "plain", Duration.ofHours(1));
        assertFalse(flagStore.putIfAbsent("guard", "conditional", Duration.ofHours(1)));

        flagStore.delete("guard");
        assertTrue(flagStore.putIfAbsent("guard", "conditional", Duration.ofHours(1)));
        assertEquals(List.of("guard"), flagStore.listKeys("gu", 10));
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> flagStore.put("k", "v", Duration.ZERO));
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}

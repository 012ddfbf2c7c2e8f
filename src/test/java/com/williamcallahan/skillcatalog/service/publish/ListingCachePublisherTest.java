package com.williamcallahan.skillcatalog.service.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.domain.ListingEntry;
import com.williamcallahan.skillcatalog.domain.ListingKind;
import com.williamcallahan.skillcatalog.store.LocalBlobStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

/**
 * Verifies that every listing kind is regenerated into its cache blob.
 */
class ListingCachePublisherTest {

    private static final Instant NOW = Instant.parse("2025-05-10T12:00:00Z");

    @TempDir
    Path blobRoot;

    private SkillStore skillStore;
    private LocalBlobStore blobStore;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private ListingCachePublisher publisher;

    @BeforeEach
    void setUp() throws IOException {
        skillStore = Mockito.mock(SkillStore.class);
        blobStore = new LocalBlobStore(blobRoot.toString());
        publisher = new ListingCachePublisher(skillStore, blobStore, objectMapper);
    }

    @Test
    void publishesAllListings() throws IOException {
        ListingEntry entry = new ListingEntry(
                "s1", "acme-notes", "Notes", "Takes notes", "acme", "notes", "", 42, 3, 30.5, 1000L);
        when(skillStore.findListing(ListingKind.TRENDING, ListingCachePublisher.LISTING_SIZE)).thenReturn(List.of(entry));

        publisher.execute(NOW);

        JsonNode trending = objectMapper.readTree(blobStore.getText("cache/trending.json").orElseThrow());
        assertEquals(NOW.toEpochMilli(), trending.get("generatedAt").asLong());
        assertEquals("acme-notes", trending.get("data").get(0).get("slug").asText());
        JsonNode top = objectMapper.readTree(blobStore.getText("cache/top.json").orElseThrow());
        assertTrue(top.get("data").isEmpty());
        assertTrue(blobStore.exists("cache/recent.json"));
    }
}

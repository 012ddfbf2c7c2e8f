package com.williamcallahan.skillcatalog.service.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.domain.ListingEntry;
import com.williamcallahan.skillcatalog.domain.ListingKind;
import com.williamcallahan.skillcatalog.domain.ListingSnapshot;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.store.BlobStore;
import com.williamcallahan.skillcatalog.store.BlobStoreException;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Regenerates the trending, top and recent listing snapshots read by the web layer.
 */
@Service
public class ListingCachePublisher implements PipelineJob<Instant> {
    private static final Logger log = LoggerFactory.getLogger(ListingCachePublisher.class);
    static final int LISTING_SIZE = 100;

    private final SkillStore skillStore;
    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;

    public ListingCachePublisher(SkillStore skillStore, BlobStore blobStore, ObjectMapper objectMapper) {
        this.skillStore = skillStore;
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public String jobName() {
        return "publish-listings";
    }

    @Override
    public void execute(Instant now) {
        for (ListingKind kind : ListingKind.values()) {
            publish(kind, now);
        }
    }

    void publish(ListingKind kind, Instant now) {
        List<ListingEntry> entries = skillStore.findListing(kind, LISTING_SIZE);
        ListingSnapshot snapshot = new ListingSnapshot(entries, now.toEpochMilli());
        try {
            blobStore.putText(kind.blobKey(), objectMapper.writeValueAsString(snapshot));
        } catch (JsonProcessingException serializationFailure) {
            throw new BlobStoreException("Could not serialize listing " + kind.blobKey(), serializationFailure);
        }
        log.debug("Published {} entries to {}", entries.size(), kind.blobKey());
    }
}

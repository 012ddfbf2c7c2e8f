package com.williamcallahan.skillcatalog.domain.ingestion;

import java.util.Objects;

/**
 * Result of one ingestion attempt. Expected no-op conditions are reported here, not thrown.
 *
 * @param status what happened
 * @param skillId affected record id, null when nothing was written
 * @param detail short human readable explanation
 */
public record IngestionOutcome(Status status, String skillId, String detail) {

    /**
     * Ingestion result kinds.
     */
    public enum Status {
        FORK,
        REPO_NOT_FOUND,
        MARKER_NOT_FOUND,
        DUPLICATE_REJECTED,
        UNCHANGED,
        CREATED,
        UPDATED,
        CONVERTED_PRIVATE
    }

    public IngestionOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static IngestionOutcome skipped(Status status, String detail) {
        return new IngestionOutcome(status, null, detail);
    }

    public static IngestionOutcome of(Status status, String skillId, String detail) {
        return new IngestionOutcome(status, skillId, detail);
    }

    /**
     * Returns true when the record's content or category inputs were written.
     */
    public boolean wroteContent() {
        return status == Status.CREATED || status == Status.UPDATED;
    }
}

package com.williamcallahan.skillcatalog.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Star count observed on a given UTC calendar day.
 *
 * <p>Serialized compactly as {@code {"d":"2025-01-31","s":42}} because every record carries
 * up to twenty of these.</p>
 *
 * @param date ISO-8601 calendar date
 * @param stars star count on that date
 */
public record StarSnapshot(@JsonProperty("d") String date, @JsonProperty("s") int stars) {
    public StarSnapshot {
        Objects.requireNonNull(date, "date");
        LocalDate.parse(date);
    }

    /**
     * Creates a snapshot for a calendar day.
     */
    public static StarSnapshot of(LocalDate date, int stars) {
        return new StarSnapshot(date.toString(), stars);
    }

    /**
     * Returns the snapshot date as a {@link LocalDate}.
     */
    public LocalDate localDate() {
        return LocalDate.parse(date);
    }
}

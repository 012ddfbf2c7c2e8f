package com.williamcallahan.skillcatalog.domain;

import java.util.List;

/**
 * Published listing payload: {@code {data: [...], generatedAt}}.
 *
 * @param data listed records, best first
 * @param generatedAt generation time in epoch milliseconds
 */
public record ListingSnapshot(List<ListingEntry> data, long generatedAt) {
    public ListingSnapshot {
        data = data == null ? List.of() : List.copyOf(data);
    }
}

package com.williamcallahan.skillcatalog.domain;

/**
 * Pre-computed listing snapshots consumed by the web layer.
 */
public enum ListingKind {
    TRENDING("trending"),
    TOP("top"),
    RECENT("recent");

    private final String fileName;

    ListingKind(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Returns the blob key the listing is published under.
     */
    public String blobKey() {
        return "cache/" + fileName + ".json";
    }
}

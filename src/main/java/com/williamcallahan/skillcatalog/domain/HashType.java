package com.williamcallahan.skillcatalog.domain;

/**
 * Variant of a content fingerprint.
 */
public enum HashType {
    /** SHA-256 of the raw marker file content. */
    FULL("full"),
    /** SHA-256 of whitespace-normalized marker file content. */
    NORMALIZED("normalized");

    private final String wireValue;

    HashType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}

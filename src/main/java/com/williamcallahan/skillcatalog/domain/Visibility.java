package com.williamcallahan.skillcatalog.domain;

import java.util.Locale;

/**
 * Visibility of a catalog record.
 */
public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private"),
    UNLISTED("unlisted");

    private final String wireValue;

    Visibility(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Visibility fromWireValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return PUBLIC;
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (Visibility visibility : values()) {
            if (visibility.wireValue.equals(normalized)) {
                return visibility;
            }
        }
        throw new IllegalArgumentException("Unknown visibility: " + rawValue);
    }
}

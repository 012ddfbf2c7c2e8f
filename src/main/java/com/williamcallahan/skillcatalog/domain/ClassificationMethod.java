package com.williamcallahan.skillcatalog.domain;

import java.util.Locale;

/**
 * Method that produced a record's current category assignment.
 *
 * <p>Stored on the record so the tier refresh can detect keyword-classified records that have
 * since become popular enough for AI classification.</p>
 */
public enum ClassificationMethod {
    DIRECT("direct"),
    KEYWORD("keyword"),
    AI("ai");

    private final String wireValue;

    ClassificationMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a persisted method value; null or blank means the record was never classified.
     *
     * @param rawValue stored value
     * @return matching method, or null when absent
     */
    public static ClassificationMethod fromWireValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (ClassificationMethod method : values()) {
            if (method.wireValue.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown classification method: " + rawValue);
    }
}

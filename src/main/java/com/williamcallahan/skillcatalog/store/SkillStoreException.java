package com.williamcallahan.skillcatalog.store;

/**
 * Relational store failure. Fatal for the unit of work that hit it.
 */
public class SkillStoreException extends RuntimeException {
    public SkillStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

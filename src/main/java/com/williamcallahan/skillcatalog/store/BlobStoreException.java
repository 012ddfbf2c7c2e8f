package com.williamcallahan.skillcatalog.store;

/**
 * Blob store read or write failure.
 */
public class BlobStoreException extends RuntimeException {
    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

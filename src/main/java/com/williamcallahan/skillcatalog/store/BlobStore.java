package com.williamcallahan.skillcatalog.store;

import java.util.List;
import java.util.Optional;

/**
 * Blob storage for cached skill files, published listings and archive snapshots.
 *
 * <p>Keys are slash-separated relative paths such as {@code skills/{owner}/{name}/SKILL.md}.</p>
 */
public interface BlobStore {

    Optional<String> getText(String key);

    void putText(String key, String content);

    /**
     * Deletes a blob.
     *
     * @return true when a blob existed
     */
    boolean delete(String key);

    boolean exists(String key);

    /**
     * Lists keys under a prefix, sorted.
     */
    List<String> list(String prefix);
}

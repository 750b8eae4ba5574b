package com.sentient.storage;

import java.util.Map;

/**
 * Blob storage for rendered canvases.
 *
 * Writes to an existing key overwrite it, so a retried job that already
 * uploaded simply replaces the same object.
 */
public interface ArtifactStorage {

    String CONTENT_TYPE = "text/plain; charset=utf-8";

    /**
     * Store a text artifact.
     *
     * @param key object key, see {@link ArtifactKeys}
     * @param content UTF-8 text
     * @param metadata object metadata (record_id, user_id, generated_at)
     * @return public URL of the stored object
     * @throws com.sentient.exception.ProcessingException if the object could not be stored
     */
    String store(String key, String content, Map<String, String> metadata);
}

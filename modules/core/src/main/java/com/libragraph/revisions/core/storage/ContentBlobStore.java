package com.libragraph.revisions.core.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * Write-once key/value storage for revision payloads.
 *
 * <p>The store is payload-agnostic: it moves bytes and never parses them. Keys are
 * slash-separated paths (see {@code StorageKeys}). All operations are lazy; nothing
 * happens until the returned {@link Uni} is subscribed, and resubscribing repeats the
 * I/O, which is what retry relies on.
 */
public interface ContentBlobStore {

    /**
     * Stores a payload under a new key.
     *
     * @param contentType optional hint recorded with the object (may be null)
     * @throws BlobAlreadyExistsException if the key is already occupied
     * @throws StorageException on I/O errors
     */
    Uni<Void> put(String key, byte[] payload, String contentType);

    /**
     * Reads a payload.
     *
     * @throws BlobNotFoundException if the key does not exist
     * @throws StorageException on I/O errors
     */
    Uni<byte[]> get(String key);

    Uni<Boolean> exists(String key);

    /**
     * Deletes a payload. Only used to discard blobs that never got metadata.
     *
     * @throws BlobNotFoundException if the key does not exist
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(String key);

    /**
     * Lists every key under {@code prefix}, recursively.
     */
    Multi<BlobEntry> list(String prefix);
}

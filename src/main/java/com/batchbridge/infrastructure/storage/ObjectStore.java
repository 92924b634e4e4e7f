package com.batchbridge.infrastructure.storage;

import java.util.Optional;

/**
 * Durable blob storage addressed by key.
 *
 * Keys are derived from content checksums, so a put of the same key always
 * carries the same bytes and repeating it is harmless.
 */
public interface ObjectStore {

    void put(String key, byte[] content, String contentType);

    /**
     * @return the stored bytes, or empty when no object exists under the key
     * @throws ObjectStoreException when the store cannot be reached
     */
    Optional<byte[]> get(String key);

    static String contentAddressedKey(String checksum) {
        return "raw/" + checksum.substring(0, 2) + "/" + checksum;
    }
}

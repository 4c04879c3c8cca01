package com.vesselintel.photos.output;

import java.util.List;
import java.util.Optional;

/**
 * Minimal object storage contract. All failures surface as {@link StorageException}.
 */
public interface ObjectStore {

    /** Writes or overwrites the object at key. */
    void put(String key, byte[] content, String contentType);

    /** Returns empty when the key does not exist. */
    Optional<byte[]> get(String key);

    /** Every key beginning with prefix, in no particular order. */
    List<String> list(String prefix);

    /** Fails fast when the backend is unreachable or not writable. */
    void verifyAccess();

    String describe();
}

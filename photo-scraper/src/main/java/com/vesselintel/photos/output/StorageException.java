package com.vesselintel.photos.output;

/**
 * The storage backend could not complete an operation. Treated as fatal by the
 * orchestrator: continuing would silently lose photos.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

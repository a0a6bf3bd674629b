package com.nayem.tether.store;

/**
 * A pending-mutation transaction could not be committed. Nothing it staged has
 * been applied.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.studioledger.backup.exception;

/**
 * A remote storage call failed (authentication, network, missing object).
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.assetbridge.repository;

/**
 * Raised when the persisted engine state document cannot be written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

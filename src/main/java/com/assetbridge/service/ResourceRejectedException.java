package com.assetbridge.service;

/**
 * Raised when the preview resource pool cannot admit a request. The active set is left unchanged.
 */
public class ResourceRejectedException extends RuntimeException {
    private final boolean sessionScoped;

    public ResourceRejectedException(String message, boolean sessionScoped) {
        super(message);
        this.sessionScoped = sessionScoped;
    }

    public boolean isSessionScoped() {
        return sessionScoped;
    }
}

package com.assetbridge.service;

/**
 * Raised when an operation names a path the asset tracker has never discovered.
 */
public class AssetNotFoundException extends RuntimeException {
    private final String path;

    public AssetNotFoundException(String path) {
        super("Unknown asset: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}

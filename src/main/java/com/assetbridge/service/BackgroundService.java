package com.assetbridge.service;

/**
 * A long-lived worker running off the dispatcher loop (watchers, directory scans).
 */
public interface BackgroundService {
    boolean isRunning();
    String getStatus();

    String getServiceName();

    // To identify which directory this service works on
    String getWatchedPath();

    void stopService();
}

package com.assetbridge.service;

import com.assetbridge.model.Asset;

import java.time.Instant;
import java.util.Objects;

/**
 * Splits assets into the current generation session and history, relative to a session start that only moves forward.
 */
public class SessionClassifier {

    private Instant sessionStart;

    public SessionClassifier(Instant sessionStart) {
        this.sessionStart = Objects.requireNonNull(sessionStart, "Session start cannot be null");
    }

    public Instant getSessionStart() {
        return sessionStart;
    }

    public boolean isSessionAsset(Asset asset) {
        return asset.getModifiedAt().isAfter(sessionStart);
    }

    /**
     * Starts a new generation batch at {@code newStart}.
     *
     * @throws OutOfOrderResetException if {@code newStart} is before the current session start
     */
    public void resetSession(Instant newStart) {
        Objects.requireNonNull(newStart, "Session start cannot be null");
        if (newStart.isBefore(sessionStart)) {
            throw new OutOfOrderResetException(sessionStart, newStart);
        }
        sessionStart = newStart;
    }
}

package com.assetbridge.service;

import java.time.Instant;

/**
 * Raised when a session reset would move the session boundary backwards.
 */
public class OutOfOrderResetException extends RuntimeException {
    private final Instant currentStart;
    private final Instant rejectedStart;

    public OutOfOrderResetException(Instant currentStart, Instant rejectedStart) {
        super("Session start " + rejectedStart + " is earlier than current start " + currentStart);
        this.currentStart = currentStart;
        this.rejectedStart = rejectedStart;
    }

    public Instant getCurrentStart() {
        return currentStart;
    }

    public Instant getRejectedStart() {
        return rejectedStart;
    }
}

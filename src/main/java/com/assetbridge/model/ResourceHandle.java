package com.assetbridge.model;

import java.time.Instant;

/**
 * Token for one materialized preview instance admitted by the resource pool.
 * Recency fields are updated by the pool under its own lock.
 */
public class ResourceHandle {
    private final long id;
    private final boolean sessionScoped;
    private final String label;
    private final Instant acquiredAt;
    private long lastUseSequence;
    private Instant lastUsedAt;

    public ResourceHandle(long id, boolean sessionScoped, String label, Instant acquiredAt, long sequence) {
        this.id = id;
        this.sessionScoped = sessionScoped;
        this.label = label;
        this.acquiredAt = acquiredAt;
        this.lastUsedAt = acquiredAt;
        this.lastUseSequence = sequence;
    }

    public long getId() { return id; }
    public boolean isSessionScoped() { return sessionScoped; }
    public String getLabel() { return label; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public long getLastUseSequence() { return lastUseSequence; }
    public Instant getLastUsedAt() { return lastUsedAt; }

    public void markUsed(long sequence, Instant when) {
        this.lastUseSequence = sequence;
        this.lastUsedAt = when;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((ResourceHandle) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "ResourceHandle{" +
                "id=" + id +
                ", " + (sessionScoped ? "session" : "history") +
                ", label='" + label + '\'' +
                '}';
    }
}

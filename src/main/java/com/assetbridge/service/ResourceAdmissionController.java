package com.assetbridge.service;

import com.assetbridge.model.ResourceHandle;
import com.assetbridge.util.ProjectLogger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Caps the number of concurrently materialized preview resources (3D viewers, decoded textures).
 * Session previews are favored: when the pool is full a session request evicts the least recently used
 * historical preview, while a historical request is simply rejected. Session previews have their own quota
 * so they can never take the whole pool.
 * <p>
 * Called directly from presentation threads; all state is guarded by one lock.
 */
public class ResourceAdmissionController {

    private final Path stateRoot;
    private final int totalQuota;
    private final int sessionQuota;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<Long, ResourceHandle> active = new LinkedHashMap<>();
    private long nextId = 1;
    private long useSequence;
    private Consumer<ResourceHandle> onEvicted;

    public ResourceAdmissionController(Path stateRoot, int totalQuota, int sessionQuota) {
        this(stateRoot, totalQuota, sessionQuota, Clock.systemUTC());
    }

    public ResourceAdmissionController(Path stateRoot, int totalQuota, int sessionQuota, Clock clock) {
        if (totalQuota <= 0 || sessionQuota <= 0 || sessionQuota > totalQuota) {
            throw new IllegalArgumentException("Invalid preview quotas: total=" + totalQuota + ", session=" + sessionQuota);
        }
        this.stateRoot = stateRoot;
        this.totalQuota = totalQuota;
        this.sessionQuota = sessionQuota;
        this.clock = clock;
    }

    /**
     * Receives handles released by the pool itself (LRU eviction, idle reclaim). Called outside the lock.
     */
    public void setOnEvicted(Consumer<ResourceHandle> onEvicted) {
        this.onEvicted = onEvicted;
    }

    /**
     * Admits a preview.
     *
     * @throws ResourceRejectedException if the request cannot be admitted; nothing is evicted in that case
     */
    public ResourceHandle acquire(boolean sessionScoped, String label) {
        ResourceHandle evicted = null;
        ResourceHandle handle;
        synchronized (lock) {
            if (sessionScoped && countSession() >= sessionQuota) {
                throw new ResourceRejectedException("Session preview quota reached (" + sessionQuota + ")", true);
            }
            if (active.size() >= totalQuota) {
                if (!sessionScoped) {
                    throw new ResourceRejectedException("Preview pool full (" + totalQuota + ")", false);
                }
                evicted = leastRecentlyUsedHistorical();
                if (evicted == null) {
                    throw new ResourceRejectedException("Preview pool full of session previews (" + totalQuota + ")", true);
                }
                active.remove(evicted.getId());
            }
            handle = new ResourceHandle(nextId++, sessionScoped, label, clock.instant(), ++useSequence);
            active.put(handle.getId(), handle);
        }
        if (evicted != null) {
            ProjectLogger.logInfo(stateRoot, "ResourceAdmissionController",
                    "Evicted historical preview " + evicted.getLabel() + " for session preview " + label);
            fireEvicted(evicted);
        }
        return handle;
    }

    /**
     * Frees the slot held by {@code handle}. Releasing twice is harmless.
     *
     * @return true if a slot was freed by this call
     */
    public boolean release(ResourceHandle handle) {
        if (handle == null) {
            return false;
        }
        synchronized (lock) {
            return active.remove(handle.getId()) != null;
        }
    }

    /**
     * Marks a preview as just used, moving it to the back of the eviction order.
     *
     * @return false if the handle is no longer admitted
     */
    public boolean touch(ResourceHandle handle) {
        synchronized (lock) {
            ResourceHandle current = active.get(handle.getId());
            if (current == null) {
                return false;
            }
            current.markUsed(++useSequence, clock.instant());
            return true;
        }
    }

    /**
     * Releases every preview not used within {@code idleTimeout}.
     *
     * @return the released handles
     */
    public List<ResourceHandle> releaseIdle(Duration idleTimeout) {
        List<ResourceHandle> reclaimed = new ArrayList<>();
        synchronized (lock) {
            Instant cutoff = clock.instant().minus(idleTimeout);
            active.values().removeIf(handle -> {
                if (handle.getLastUsedAt().isBefore(cutoff)) {
                    reclaimed.add(handle);
                    return true;
                }
                return false;
            });
        }
        for (ResourceHandle handle : reclaimed) {
            fireEvicted(handle);
        }
        return reclaimed;
    }

    public boolean isActive(ResourceHandle handle) {
        synchronized (lock) {
            return active.containsKey(handle.getId());
        }
    }

    public List<ResourceHandle> getActive() {
        synchronized (lock) {
            return new ArrayList<>(active.values());
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    public int getSessionCount() {
        synchronized (lock) {
            return countSession();
        }
    }

    public int getTotalQuota() {
        return totalQuota;
    }

    public int getSessionQuota() {
        return sessionQuota;
    }

    private int countSession() {
        int count = 0;
        for (ResourceHandle handle : active.values()) {
            if (handle.isSessionScoped()) {
                count++;
            }
        }
        return count;
    }

    private ResourceHandle leastRecentlyUsedHistorical() {
        ResourceHandle oldest = null;
        for (ResourceHandle handle : active.values()) {
            if (!handle.isSessionScoped()
                    && (oldest == null || handle.getLastUseSequence() < oldest.getLastUseSequence())) {
                oldest = handle;
            }
        }
        return oldest;
    }

    private void fireEvicted(ResourceHandle handle) {
        if (onEvicted == null) {
            return;
        }
        try {
            onEvicted.accept(handle);
        } catch (RuntimeException e) {
            ProjectLogger.logError(stateRoot, "ResourceAdmissionController", "Eviction callback failed for " + handle, e);
        }
    }
}

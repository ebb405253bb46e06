package com.assetbridge.service;

import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.service.DirectoryWatcher.ChangeKind;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file notification travelling from a watcher (or a view scan) to the dispatcher loop.
 */
public class DiscoveryEvent {
    private final Path path;
    private final AssetKind kind;
    private final ChangeKind change;

    public DiscoveryEvent(Path path, AssetKind kind, ChangeKind change) {
        this.path = Objects.requireNonNull(path, "Event path cannot be null");
        this.kind = Objects.requireNonNull(kind, "Event kind cannot be null");
        this.change = Objects.requireNonNull(change, "Change kind cannot be null");
    }

    public Path getPath() { return path; }
    public AssetKind getKind() { return kind; }
    public ChangeKind getChange() { return change; }

    public boolean isRemoval() {
        return change == ChangeKind.DELETED;
    }

    @Override
    public String toString() {
        return "DiscoveryEvent{" + change + " " + kind + " " + path + '}';
    }
}

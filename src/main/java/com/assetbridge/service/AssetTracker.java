package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative registry of known assets, keyed by path and kept in discovery order.
 * Only the dispatcher loop mutates it.
 */
public class AssetTracker {

    private final Map<String, Asset> assets = new LinkedHashMap<>();

    /**
     * Result of {@link #add}: the stored asset and whether this call created it.
     */
    public static class AddResult {
        private final Asset asset;
        private final boolean isNew;

        AddResult(Asset asset, boolean isNew) {
            this.asset = asset;
            this.isNew = isNew;
        }

        public Asset getAsset() { return asset; }
        public boolean isNew() { return isNew; }
    }

    /**
     * Inserts the asset if its path is unknown. A known path returns the existing record unchanged,
     * with {@link AddResult#isNew()} false so the caller does not announce it again.
     */
    public AddResult add(String path, AssetKind kind, Instant modifiedAt) {
        Asset existing = assets.get(path);
        if (existing != null) {
            return new AddResult(existing, false);
        }
        Asset asset = new Asset(path, kind, modifiedAt);
        assets.put(path, asset);
        return new AddResult(asset, true);
    }

    public boolean remove(String path) {
        return assets.remove(path) != null;
    }

    public Optional<Asset> get(String path) {
        return Optional.ofNullable(assets.get(path));
    }

    public boolean contains(String path) {
        return assets.containsKey(path);
    }

    /**
     * @return the asset, or throws if the path was never discovered
     */
    public Asset require(String path) {
        Asset asset = assets.get(path);
        if (asset == null) {
            throw new AssetNotFoundException(path);
        }
        return asset;
    }

    /**
     * Assets of one kind in insertion order (most recent last). Callers wanting newest-first reverse it.
     */
    public List<Asset> listByKind(AssetKind kind) {
        List<Asset> result = new ArrayList<>();
        for (Asset asset : assets.values()) {
            if (asset.getKind() == kind) {
                result.add(asset);
            }
        }
        return result;
    }

    public List<Asset> listAll() {
        return Collections.unmodifiableList(new ArrayList<>(assets.values()));
    }

    public int size() {
        return assets.size();
    }
}

package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.UnifiedObject;

import java.util.List;

/**
 * Notifications for the presentation layer. All callbacks run on the dispatcher thread and must return quickly;
 * calling engine operations from inside a callback is allowed and runs inline.
 */
public interface EngineListener {

    default void onAssetDiscovered(Asset asset, boolean sessionScoped) {
    }

    default void onAssetRemoved(String path) {
    }

    default void onSelectionChanged(List<UnifiedObject> unifiedObjects) {
    }

    /**
     * @param modelPath the linked model, or null when the image lost its edge
     */
    default void onAssociationChanged(String imagePath, String modelPath) {
    }
}

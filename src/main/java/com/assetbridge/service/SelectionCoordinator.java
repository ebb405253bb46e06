package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.model.UnifiedObject;
import com.assetbridge.model.UnifiedObject.Progression;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Single source of truth for which assets are selected for the next pipeline stage.
 * Holds exactly one flag per path whatever the number of views showing it, and derives the
 * unified object view (one entry per lineage at its most-derived state) after every change.
 * Only the dispatcher loop writes here.
 */
public class SelectionCoordinator {

    private final AssetTracker tracker;
    private final Map<String, Boolean> selection = new LinkedHashMap<>();
    // Flags loaded from the state document for paths not discovered yet
    private final Map<String, Boolean> pendingRestore = new LinkedHashMap<>();
    private Lineage lineage = Lineage.NONE;
    private List<UnifiedObject> unifiedView = Collections.emptyList();
    private Consumer<List<UnifiedObject>> onSelectionChanged;
    private Runnable onMutation;

    public SelectionCoordinator(AssetTracker tracker) {
        this.tracker = tracker;
    }

    public void setLineage(Lineage lineage) {
        this.lineage = lineage != null ? lineage : Lineage.NONE;
    }

    public void setOnSelectionChanged(Consumer<List<UnifiedObject>> callback) {
        this.onSelectionChanged = callback;
    }

    /**
     * Called after every flag change so the state document can be rewritten.
     */
    public void setOnMutation(Runnable onMutation) {
        this.onMutation = onMutation;
    }

    /**
     * Flips the flag of a known path.
     *
     * @return the new selection state
     * @throws AssetNotFoundException if the path was never discovered
     */
    public boolean toggle(String path) {
        tracker.require(path);
        boolean selected = !isSelected(path);
        selection.put(path, selected);
        afterMutation();
        return selected;
    }

    /**
     * @throws AssetNotFoundException if the path was never discovered
     */
    public void setSelected(String path, boolean selected) {
        tracker.require(path);
        Boolean previous = selection.put(path, selected);
        if (previous == null || previous != selected) {
            afterMutation();
        }
    }

    public boolean isSelected(String path) {
        return Boolean.TRUE.equals(selection.get(path));
    }

    public List<String> getSelectedPaths() {
        List<String> result = new ArrayList<>();
        selection.forEach((path, selected) -> {
            if (selected) {
                result.add(path);
            }
        });
        return result;
    }

    public List<String> getSelectedPaths(AssetKind kind) {
        List<String> result = new ArrayList<>();
        for (String path : getSelectedPaths()) {
            Optional<Asset> asset = tracker.get(path);
            if (asset.isPresent() && asset.get().getKind() == kind) {
                result.add(path);
            }
        }
        return result;
    }

    public int clearSelection() {
        int cleared = 0;
        for (Map.Entry<String, Boolean> entry : selection.entrySet()) {
            if (entry.getValue()) {
                entry.setValue(false);
                cleared++;
            }
        }
        if (cleared > 0) {
            afterMutation();
        }
        return cleared;
    }

    public int clearSelection(AssetKind kind) {
        int cleared = 0;
        for (String path : getSelectedPaths(kind)) {
            selection.put(path, false);
            cleared++;
        }
        if (cleared > 0) {
            afterMutation();
        }
        return cleared;
    }

    /**
     * Drops the flag of a path whose asset no longer exists.
     */
    public boolean forget(String path) {
        boolean removed = selection.remove(path) != null;
        pendingRestore.remove(path);
        if (removed && onMutation != null) {
            onMutation.run();
        }
        return removed;
    }

    /**
     * Holds flags from the state document until their paths are discovered.
     */
    public void restore(Map<String, Boolean> flags) {
        flags.forEach((path, selected) -> {
            if (tracker.contains(path)) {
                selection.put(path, selected);
            } else {
                pendingRestore.put(path, selected);
            }
        });
    }

    /**
     * Drops restored flags still waiting for discovery whose files no longer exist on disk.
     * Does not fire the mutation hook; the caller persists.
     *
     * @return the number of flags dropped
     */
    public int dropMissingPending() {
        int dropped = 0;
        Iterator<String> it = pendingRestore.keySet().iterator();
        while (it.hasNext()) {
            if (!Files.exists(Path.of(it.next()))) {
                it.remove();
                dropped++;
            }
        }
        return dropped;
    }

    /**
     * Applies a restored flag when its asset shows up.
     *
     * @return true if a pending flag was applied
     */
    public boolean onAssetTracked(Asset asset) {
        Boolean restored = pendingRestore.remove(asset.getPath());
        if (restored == null) {
            return false;
        }
        selection.putIfAbsent(asset.getPath(), restored);
        return true;
    }

    /**
     * Flags to persist: live ones plus restored ones still waiting for discovery.
     */
    public Map<String, Boolean> getPersistentFlags() {
        Map<String, Boolean> flags = new LinkedHashMap<>(pendingRestore);
        flags.putAll(selection);
        return flags;
    }

    public List<UnifiedObject> getUnifiedView() {
        return unifiedView;
    }

    /**
     * Recomputes the unified view and notifies the listener if it differs from the previous one.
     *
     * @return true if the view changed
     */
    public boolean recompute() {
        List<UnifiedObject> next = computeUnifiedView();
        if (next.equals(unifiedView)) {
            return false;
        }
        unifiedView = next;
        notifyListener();
        return true;
    }

    /**
     * Number of selected lineages per progression state.
     */
    public Map<Progression, Integer> getSelectionSummary() {
        Map<Progression, Integer> summary = new EnumMap<>(Progression.class);
        for (Progression progression : Progression.values()) {
            summary.put(progression, 0);
        }
        for (UnifiedObject object : unifiedView) {
            summary.merge(object.getProgression(), 1, Integer::sum);
        }
        return summary;
    }

    /**
     * Representative paths of the selected lineages, i.e. what the next pipeline stage receives.
     */
    public List<String> getPipelineTargets() {
        List<String> targets = new ArrayList<>();
        for (UnifiedObject object : unifiedView) {
            targets.add(object.getKey());
        }
        return targets;
    }

    List<UnifiedObject> computeUnifiedView() {
        Map<String, UnifiedObject> objects = new LinkedHashMap<>();

        for (String path : getSelectedPaths(AssetKind.IMAGE)) {
            Optional<String> model = lineage.getModelForImage(path);
            if (model.isPresent()) {
                UnifiedObject object = modelObject(path, model.get());
                objects.putIfAbsent(object.getKey(), object);
            } else {
                objects.putIfAbsent(path, new UnifiedObject(path, path, null, null, Progression.IMAGE_ONLY));
            }
        }

        for (String path : getSelectedPaths(AssetKind.MODEL)) {
            Optional<String> source = lineage.getImageForModel(path);
            if (source.isPresent() && isSelected(source.get())) {
                continue;
            }
            UnifiedObject object = modelObject(source.orElse(null), path);
            objects.putIfAbsent(object.getKey(), object);
        }

        for (String path : getSelectedPaths(AssetKind.TEXTURED_MODEL)) {
            Optional<String> base = lineage.getModelForTextured(path);
            if (base.isPresent()) {
                String model = base.get();
                Optional<String> source = lineage.getImageForModel(model);
                if (isSelected(model) || (source.isPresent() && isSelected(source.get()))) {
                    continue;
                }
                objects.putIfAbsent(path, new UnifiedObject(path, source.orElse(null), model, path, Progression.TEXTURED));
            } else {
                objects.putIfAbsent(path, new UnifiedObject(path, null, null, path, Progression.TEXTURED));
            }
        }

        return Collections.unmodifiableList(new ArrayList<>(objects.values()));
    }

    private UnifiedObject modelObject(String sourceImage, String model) {
        if (lineage.isTextured(model)) {
            String textured = lineage.getTexturedModel(model).orElse(null);
            String key = textured != null ? textured : model;
            return new UnifiedObject(key, sourceImage, model, textured, Progression.TEXTURED);
        }
        return new UnifiedObject(model, sourceImage, model, null, Progression.HAS_MODEL);
    }

    private void afterMutation() {
        if (onMutation != null) {
            onMutation.run();
        }
        unifiedView = computeUnifiedView();
        notifyListener();
    }

    private void notifyListener() {
        if (onSelectionChanged != null) {
            onSelectionChanged.accept(unifiedView);
        }
    }
}

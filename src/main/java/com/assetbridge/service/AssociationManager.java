package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.model.Association;
import com.assetbridge.repository.EngineStateStore.Snapshot;
import com.assetbridge.util.FileUtils;
import com.assetbridge.util.ProjectLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Keeps the image -> model edges and the textured markers of models.
 * The two edge maps are kept in sync on every mutation so both lookups are O(1)
 * and each image has at most one model and vice versa.
 * Selection flags are never stored here; they go through the {@link SelectionCoordinator}.
 */
public class AssociationManager implements Lineage {

    private static final List<String> GENERATOR_PREFIXES = List.of("comfyui_", "hy3d_", "image_", "model_");
    private static final List<String> TEXTURE_MARKERS = List.of("_with_texture", "_textured", "textured_");
    private static final int MIN_FRAGMENT_LENGTH = 4;

    private final Path stateRoot;
    private final AssetTracker tracker;
    private final SelectionCoordinator selection;
    private final Duration linkWindow;

    private final Map<String, Association> byImage = new LinkedHashMap<>();
    private final Map<String, String> imageByModel = new HashMap<>();
    // Model path -> textured file path ("" when marked without a file)
    private final Map<String, String> texturedByModel = new LinkedHashMap<>();
    private final Map<String, String> modelByTextured = new HashMap<>();

    // Restored from the state document, waiting for both sides to be discovered
    private final Map<String, Association> pendingLinks = new LinkedHashMap<>();
    private final Map<String, String> pendingTextured = new LinkedHashMap<>();

    private Runnable onMutation;
    private BiConsumer<String, String> onAssociationChanged;

    public AssociationManager(Path stateRoot, AssetTracker tracker, SelectionCoordinator selection, Duration linkWindow) {
        this.stateRoot = stateRoot;
        this.tracker = tracker;
        this.selection = selection;
        this.linkWindow = linkWindow;
    }

    public void setOnMutation(Runnable onMutation) {
        this.onMutation = onMutation;
    }

    /**
     * Receives (image, model) after a link and (image, null) after an edge is removed.
     */
    public void setOnAssociationChanged(BiConsumer<String, String> callback) {
        this.onAssociationChanged = callback;
    }

    /**
     * Records or overwrites the edge of {@code imagePath}. A model already linked to another image is moved.
     *
     * @throws AssetNotFoundException if either path is not a tracked asset of the right kind
     */
    public Association link(String imagePath, String modelPath) {
        requireKind(imagePath, AssetKind.IMAGE);
        requireKind(modelPath, AssetKind.MODEL);
        Association association = putEdge(imagePath, modelPath, Instant.now());
        if (selection.isSelected(imagePath)) {
            selection.setSelected(modelPath, true);
        }
        mutated();
        fireChanged(imagePath, modelPath);
        return association;
    }

    public boolean unlink(String imagePath) {
        Association removed = removeEdge(imagePath);
        if (removed == null) {
            return false;
        }
        mutated();
        fireChanged(imagePath, null);
        return true;
    }

    /**
     * Tries to link a freshly discovered asset to its counterpart. A model is linked to the single image it
     * was generated from. An image, which may arrive after its model, is linked to the single unlinked model
     * matching it, provided that model matches no other image. Zero or several candidates leave it unlinked.
     */
    public Optional<Association> autoLink(Asset asset) {
        if (asset.getKind() == AssetKind.MODEL) {
            return autoLinkModel(asset);
        }
        if (asset.getKind() == AssetKind.IMAGE) {
            return autoLinkImage(asset);
        }
        return Optional.empty();
    }

    private Optional<Association> autoLinkModel(Asset model) {
        if (imageByModel.containsKey(model.getPath())) {
            return Optional.empty();
        }
        List<Asset> candidates = findCandidateImages(model, null);
        if (candidates.size() != 1) {
            if (candidates.size() > 1) {
                ProjectLogger.logInfo(stateRoot, "AssociationManager",
                        "Ambiguous source for " + model.getPath() + " (" + candidates.size() + " candidates), left unlinked");
            }
            return Optional.empty();
        }
        return Optional.of(link(candidates.get(0).getPath(), model.getPath()));
    }

    private Optional<Association> autoLinkImage(Asset image) {
        if (byImage.containsKey(image.getPath())) {
            return Optional.empty();
        }
        List<Asset> candidates = new ArrayList<>();
        for (Asset model : tracker.listByKind(AssetKind.MODEL)) {
            if (!imageByModel.containsKey(model.getPath()) && isCandidate(image, model)) {
                candidates.add(model);
            }
        }
        if (candidates.size() != 1) {
            if (candidates.size() > 1) {
                ProjectLogger.logInfo(stateRoot, "AssociationManager",
                        "Ambiguous model for " + image.getPath() + " (" + candidates.size() + " candidates), left unlinked");
            }
            return Optional.empty();
        }
        Asset model = candidates.get(0);
        if (findCandidateImages(model, null).size() != 1) {
            return Optional.empty();
        }
        return Optional.of(link(image.getPath(), model.getPath()));
    }

    /**
     * Links every unlinked tracked model under {@code modelsDir} to an unlinked image under {@code imagesDir}
     * when the match is unique from both sides.
     *
     * @return the number of links created
     */
    public int autoDetect(Path imagesDir, Path modelsDir) {
        String imagesPrefix = FileUtils.normalize(imagesDir);
        String modelsPrefix = FileUtils.normalize(modelsDir);

        Map<String, List<Asset>> candidatesByModel = new LinkedHashMap<>();
        Map<String, Integer> claims = new HashMap<>();
        for (Asset model : tracker.listByKind(AssetKind.MODEL)) {
            if (imageByModel.containsKey(model.getPath()) || !isUnder(model.getPath(), modelsPrefix)) {
                continue;
            }
            List<Asset> candidates = findCandidateImages(model, imagesPrefix);
            candidatesByModel.put(model.getPath(), candidates);
            for (Asset image : candidates) {
                claims.merge(image.getPath(), 1, Integer::sum);
            }
        }

        int created = 0;
        for (Map.Entry<String, List<Asset>> entry : candidatesByModel.entrySet()) {
            List<Asset> candidates = entry.getValue();
            if (candidates.size() != 1) {
                continue;
            }
            String imagePath = candidates.get(0).getPath();
            if (claims.get(imagePath) != 1) {
                continue;
            }
            link(imagePath, entry.getKey());
            created++;
        }
        ProjectLogger.logInfo(stateRoot, "AssociationManager", "Auto-detect created " + created + " associations");
        return created;
    }

    /**
     * Removes every edge with a side no longer tracked, and pending restored edges whose files are gone.
     * Edges with both sides present are left untouched. Restored selection flags of vanished files are
     * dropped from the coordinator in the same pass.
     *
     * @return the number of associations removed
     */
    public int cleanupMissing() {
        List<String> stale = new ArrayList<>();
        for (Association association : byImage.values()) {
            if (!tracker.contains(association.getImagePath()) || !tracker.contains(association.getModelPath())) {
                stale.add(association.getImagePath());
            }
        }
        for (String imagePath : stale) {
            removeEdge(imagePath);
        }

        int removed = stale.size();
        Iterator<Association> pending = pendingLinks.values().iterator();
        while (pending.hasNext()) {
            Association association = pending.next();
            if (!Files.exists(Path.of(association.getImagePath())) || !Files.exists(Path.of(association.getModelPath()))) {
                pending.remove();
                removed++;
            }
        }

        boolean texturedChanged = cleanupTextured();
        int droppedFlags = selection.dropMissingPending();
        if (removed > 0 || texturedChanged || droppedFlags > 0) {
            mutated();
        }
        for (String imagePath : stale) {
            fireChanged(imagePath, null);
        }
        return removed;
    }

    /**
     * Marks a model textured without a known textured file.
     */
    public void markTextured(String modelPath) {
        markTextured(modelPath, null);
    }

    /**
     * Marks a model textured. Marking is forward-only; an already recorded textured file is kept
     * when {@code texturedPath} is null.
     *
     * @throws AssetNotFoundException if the model is not tracked
     */
    public void markTextured(String modelPath, String texturedPath) {
        requireKind(modelPath, AssetKind.MODEL);
        String previous = texturedByModel.get(modelPath);
        String next = texturedPath != null ? texturedPath : (previous != null ? previous : "");
        if (next.equals(previous)) {
            return;
        }
        if (previous != null && !previous.isEmpty()) {
            modelByTextured.remove(previous);
        }
        texturedByModel.put(modelPath, next);
        if (!next.isEmpty()) {
            modelByTextured.put(next, modelPath);
        }
        mutated();
        String image = imageByModel.get(modelPath);
        if (image != null) {
            fireChanged(image, modelPath);
        }
    }

    /**
     * Connects a textured model to its base model by name, in whichever order they were discovered.
     *
     * @return the base model path if a connection was made
     */
    public Optional<String> resolveTextured(Asset asset) {
        if (asset.getKind() == AssetKind.TEXTURED_MODEL) {
            Optional<String> baseStem = baseStemOf(asset.getStem());
            if (baseStem.isEmpty()) {
                return Optional.empty();
            }
            List<Asset> bases = new ArrayList<>();
            for (Asset model : tracker.listByKind(AssetKind.MODEL)) {
                if (model.getStem().equalsIgnoreCase(baseStem.get())) {
                    bases.add(model);
                }
            }
            if (bases.size() != 1) {
                return Optional.empty();
            }
            markTextured(bases.get(0).getPath(), asset.getPath());
            return Optional.of(bases.get(0).getPath());
        }
        if (asset.getKind() == AssetKind.MODEL && !texturedByModel.containsKey(asset.getPath())) {
            for (Asset textured : tracker.listByKind(AssetKind.TEXTURED_MODEL)) {
                if (modelByTextured.containsKey(textured.getPath())) {
                    continue;
                }
                Optional<String> baseStem = baseStemOf(textured.getStem());
                if (baseStem.isPresent() && baseStem.get().equalsIgnoreCase(asset.getStem())) {
                    markTextured(asset.getPath(), textured.getPath());
                    return Optional.of(asset.getPath());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Delegates to the selection coordinator; no selection state is kept here.
     */
    public void setSelected(String path, boolean selected) {
        selection.setSelected(path, selected);
    }

    public Map<String, Integer> getStats() {
        int selectedImages = 0;
        int selectedModels = 0;
        int imagesWithModels = 0;
        for (Association association : byImage.values()) {
            if (selection.isSelected(association.getImagePath())) {
                selectedImages++;
            }
            if (selection.isSelected(association.getModelPath())) {
                selectedModels++;
            }
            if (tracker.contains(association.getImagePath()) && tracker.contains(association.getModelPath())) {
                imagesWithModels++;
            }
        }
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("total_associations", byImage.size());
        stats.put("selected_images", selectedImages);
        stats.put("selected_models", selectedModels);
        stats.put("images_with_models", imagesWithModels);
        return stats;
    }

    public List<Association> getAssociations() {
        return Collections.unmodifiableList(new ArrayList<>(byImage.values()));
    }

    /**
     * Loads edges and textured markers from the state document. Entries whose paths are not tracked yet
     * wait until {@link #onAssetTracked} sees them.
     */
    public void restore(Snapshot snapshot) {
        pendingLinks.putAll(snapshot.getAssociations());
        pendingTextured.putAll(snapshot.getTextured());
        promotePending();
    }

    /**
     * Promotes restored entries that became complete with this discovery.
     *
     * @return true if at least one edge or marker was applied
     */
    public boolean onAssetTracked(Asset asset) {
        if (pendingLinks.isEmpty() && pendingTextured.isEmpty()) {
            return false;
        }
        return promotePending();
    }

    /**
     * Edges to persist: live ones plus restored ones not yet applied.
     */
    public Map<String, Association> getPersistentAssociations() {
        Map<String, Association> result = new LinkedHashMap<>(pendingLinks);
        result.putAll(byImage);
        return result;
    }

    public Map<String, String> getPersistentTextured() {
        Map<String, String> result = new LinkedHashMap<>(pendingTextured);
        result.putAll(texturedByModel);
        return result;
    }

    @Override
    public Optional<String> getModelForImage(String imagePath) {
        Association association = byImage.get(imagePath);
        return association != null ? Optional.of(association.getModelPath()) : Optional.empty();
    }

    @Override
    public Optional<String> getImageForModel(String modelPath) {
        return Optional.ofNullable(imageByModel.get(modelPath));
    }

    @Override
    public boolean isTextured(String modelPath) {
        return texturedByModel.containsKey(modelPath);
    }

    @Override
    public Optional<String> getTexturedModel(String modelPath) {
        String textured = texturedByModel.get(modelPath);
        return textured == null || textured.isEmpty() ? Optional.empty() : Optional.of(textured);
    }

    @Override
    public Optional<String> getModelForTextured(String texturedPath) {
        return Optional.ofNullable(modelByTextured.get(texturedPath));
    }

    /**
     * True when the two stems share a derived fragment of at least four characters. Stems made only of
     * generator prefixes and counters never match, even when identical.
     */
    static boolean namesMatch(String imageStem, String modelStem) {
        String a = deriveFragment(imageStem);
        String b = deriveFragment(modelStem);
        if (a.length() < MIN_FRAGMENT_LENGTH || b.length() < MIN_FRAGMENT_LENGTH) {
            return false;
        }
        return a.contains(b) || b.contains(a);
    }

    static String deriveFragment(String stem) {
        String s = stem.toLowerCase();
        for (String prefix : GENERATOR_PREFIXES) {
            s = s.replace(prefix, "");
        }
        for (String marker : TEXTURE_MARKERS) {
            s = s.replace(marker, "");
        }
        s = s.replaceAll("\\d+", "");
        return s.replaceAll("[\\s_.\\-]+", "");
    }

    static Optional<String> baseStemOf(String texturedStem) {
        String lower = texturedStem.toLowerCase();
        if (lower.startsWith("textured_") && texturedStem.length() > "textured_".length()) {
            return Optional.of(texturedStem.substring("textured_".length()));
        }
        if (lower.endsWith("_textured") && texturedStem.length() > "_textured".length()) {
            return Optional.of(texturedStem.substring(0, texturedStem.length() - "_textured".length()));
        }
        if (lower.endsWith("_with_texture") && texturedStem.length() > "_with_texture".length()) {
            return Optional.of(texturedStem.substring(0, texturedStem.length() - "_with_texture".length()));
        }
        return Optional.empty();
    }

    private List<Asset> findCandidateImages(Asset model, String imagesPrefix) {
        List<Asset> candidates = new ArrayList<>();
        for (Asset image : tracker.listByKind(AssetKind.IMAGE)) {
            if (byImage.containsKey(image.getPath())) {
                continue;
            }
            if (imagesPrefix != null && !isUnder(image.getPath(), imagesPrefix)) {
                continue;
            }
            if (isCandidate(image, model)) {
                candidates.add(image);
            }
        }
        return candidates;
    }

    private boolean isCandidate(Asset image, Asset model) {
        Instant imageTime = image.getModifiedAt();
        Instant modelTime = model.getModifiedAt();
        if (modelTime.isBefore(imageTime) || modelTime.isAfter(imageTime.plus(linkWindow))) {
            return false;
        }
        return namesMatch(image.getStem(), model.getStem());
    }

    private Association putEdge(String imagePath, String modelPath, Instant createdAt) {
        Association old = byImage.remove(imagePath);
        if (old != null) {
            imageByModel.remove(old.getModelPath());
        }
        String previousImage = imageByModel.remove(modelPath);
        if (previousImage != null) {
            byImage.remove(previousImage);
        }
        Association association = new Association(imagePath, modelPath, createdAt);
        byImage.put(imagePath, association);
        imageByModel.put(modelPath, imagePath);
        return association;
    }

    private Association removeEdge(String imagePath) {
        Association removed = byImage.remove(imagePath);
        if (removed != null) {
            imageByModel.remove(removed.getModelPath());
        }
        return removed;
    }

    private boolean cleanupTextured() {
        boolean changed = false;
        Iterator<Map.Entry<String, String>> it = texturedByModel.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, String> entry = it.next();
            if (!tracker.contains(entry.getKey())) {
                modelByTextured.remove(entry.getValue());
                it.remove();
                changed = true;
            } else if (!entry.getValue().isEmpty() && !tracker.contains(entry.getValue())) {
                // The model stays textured; only the file reference goes
                modelByTextured.remove(entry.getValue());
                entry.setValue("");
                changed = true;
            }
        }
        Iterator<String> pending = pendingTextured.keySet().iterator();
        while (pending.hasNext()) {
            if (!Files.exists(Path.of(pending.next()))) {
                pending.remove();
                changed = true;
            }
        }
        return changed;
    }

    private boolean promotePending() {
        boolean applied = false;
        Iterator<Association> links = pendingLinks.values().iterator();
        while (links.hasNext()) {
            Association association = links.next();
            if (isTrackedAs(association.getImagePath(), AssetKind.IMAGE)
                    && isTrackedAs(association.getModelPath(), AssetKind.MODEL)) {
                links.remove();
                putEdge(association.getImagePath(), association.getModelPath(), association.getCreatedAt());
                applied = true;
            }
        }
        Iterator<Map.Entry<String, String>> textured = pendingTextured.entrySet().iterator();
        while (textured.hasNext()) {
            Map.Entry<String, String> entry = textured.next();
            if (isTrackedAs(entry.getKey(), AssetKind.MODEL)) {
                textured.remove();
                String file = entry.getValue() == null ? "" : entry.getValue();
                texturedByModel.put(entry.getKey(), file);
                if (!file.isEmpty()) {
                    modelByTextured.put(file, entry.getKey());
                }
                applied = true;
            }
        }
        return applied;
    }

    private boolean isTrackedAs(String path, AssetKind kind) {
        Optional<Asset> asset = tracker.get(path);
        return asset.isPresent() && asset.get().getKind() == kind;
    }

    private void requireKind(String path, AssetKind kind) {
        Asset asset = tracker.require(path);
        if (asset.getKind() != kind) {
            throw new AssetNotFoundException(path + " (expected " + kind + ", found " + asset.getKind() + ")");
        }
    }

    private static boolean isUnder(String path, String prefix) {
        return Path.of(path).startsWith(Path.of(prefix));
    }

    private void mutated() {
        if (onMutation != null) {
            onMutation.run();
        }
    }

    private void fireChanged(String imagePath, String modelPath) {
        if (onAssociationChanged != null) {
            onAssociationChanged.accept(imagePath, modelPath);
        }
    }
}

package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.model.Association;
import com.assetbridge.model.ResourceHandle;
import com.assetbridge.model.UnifiedObject;
import com.assetbridge.model.UnifiedObject.Progression;
import com.assetbridge.repository.EngineStateStore;
import com.assetbridge.repository.EngineStateStore.Snapshot;
import com.assetbridge.repository.StoreException;
import com.assetbridge.service.DirectoryWatcher.ChangeKind;
import com.assetbridge.util.FileUtils;
import com.assetbridge.util.ProjectLogger;
import com.assetbridge.util.SettingsManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point of the asset lifecycle engine.
 * <p>
 * Wires the watcher, the dispatcher loop and the state components from the settings, and exposes the
 * operations used by the presentation layer. Every operation touching tracked state is routed through the
 * dispatcher and returns a future completed by the loop; a future fails with the matching exception
 * ({@link AssetNotFoundException}, {@link OutOfOrderResetException}, {@link StoreException}) when the
 * operation cannot be applied. Preview admission is the exception: it has its own lock and is called directly.
 */
public class AssetEngine {

    public static final String VIEW_IMAGES = "all_images";
    public static final String VIEW_MODELS = "all_models";
    public static final String VIEW_TEXTURED_MODELS = "all_textured_models";

    private static final Comparator<Asset> NEWEST_FIRST = Comparator.comparing(Asset::getModifiedAt).reversed();

    private final SettingsManager settings;
    private final Path stateRoot;
    private final ServiceManager serviceManager;
    private final EngineStateStore store;
    private final AssetTracker tracker;
    private final SessionClassifier classifier;
    private final SelectionCoordinator selection;
    private final AssociationManager associations;
    private final EventDispatcher dispatcher;
    private final DirectoryWatcher watcher;
    private final DirectoryScanService scanner;
    private final LazyViewLoader loader;
    private final ResourceAdmissionController admission;
    private final List<EngineListener> listeners = new CopyOnWriteArrayList<>();

    // Only touched on the dispatcher loop
    private StoreException pendingStoreFailure;
    private volatile boolean started;

    public AssetEngine(SettingsManager settings, Instant sessionStart) {
        this(settings, sessionStart, ServiceManager.getInstance());
    }

    /**
     * Engine configured from the user's global settings, with the session starting now.
     */
    public static AssetEngine createDefault() {
        return new AssetEngine(SettingsManager.getInstance(), Instant.now());
    }

    public AssetEngine(SettingsManager settings, Instant sessionStart, ServiceManager serviceManager) {
        this.settings = settings;
        this.stateRoot = settings.getStateDir();
        this.serviceManager = serviceManager;
        this.store = new EngineStateStore(stateRoot);

        this.tracker = new AssetTracker();
        this.classifier = new SessionClassifier(sessionStart);
        this.selection = new SelectionCoordinator(tracker);
        this.associations = new AssociationManager(stateRoot, tracker, selection, settings.getAutoLinkWindow());
        selection.setLineage(associations);
        selection.setOnMutation(this::persistState);
        associations.setOnMutation(this::persistState);
        selection.setOnSelectionChanged(objects -> listeners.forEach(l -> l.onSelectionChanged(objects)));
        associations.setOnAssociationChanged((image, model) -> listeners.forEach(l -> l.onAssociationChanged(image, model)));

        this.dispatcher = new EventDispatcher(stateRoot, settings.getDispatcherCapacity(), this::applyDiscovery);
        this.watcher = new DirectoryWatcher(stateRoot, settings.getWatcherPollInterval(),
                settings.getWatcherMaxBackoff(), serviceManager);
        this.scanner = new DirectoryScanService(stateRoot, settings.getWatcherPollInterval(),
                settings.getWatcherMaxBackoff(), serviceManager);
        this.loader = new LazyViewLoader(stateRoot, tracker, dispatcher, scanner);
        loader.registerView(VIEW_IMAGES, settings.getImagesDir(), AssetKind.IMAGE, settings.getPatterns(AssetKind.IMAGE));
        loader.registerView(VIEW_MODELS, settings.getModelsDir(), AssetKind.MODEL, settings.getPatterns(AssetKind.MODEL));
        loader.registerView(VIEW_TEXTURED_MODELS, settings.getTexturedModelsDir(), AssetKind.TEXTURED_MODEL,
                settings.getPatterns(AssetKind.TEXTURED_MODEL));

        this.admission = new ResourceAdmissionController(stateRoot,
                settings.getPreviewTotalQuota(), settings.getPreviewSessionQuota());
    }

    public void addListener(EngineListener listener) {
        listeners.add(listener);
    }

    public void removeListener(EngineListener listener) {
        listeners.remove(listener);
    }

    /**
     * Loads the persisted state, starts the dispatcher loop and begins watching the configured directories.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        Snapshot snapshot = store.load();
        associations.restore(snapshot);
        selection.restore(snapshot.getSelection());

        dispatcher.start();
        watch("images", settings.getImagesDir(), AssetKind.IMAGE);
        watch("models", settings.getModelsDir(), AssetKind.MODEL);
        watch("textured_models", settings.getTexturedModelsDir(), AssetKind.TEXTURED_MODEL);
        started = true;
        ProjectLogger.logInfo(stateRoot, "AssetEngine", "Engine started, session start " + classifier.getSessionStart());
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        watcher.stop();
        scanner.stopService();
        dispatcher.stop();
        ProjectLogger.logInfo(stateRoot, "AssetEngine", "Engine stopped");
        ProjectLogger.flush(stateRoot);
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isWatching() {
        return watcher.isWatching("images") && watcher.isWatching("models") && watcher.isWatching("textured_models");
    }

    /**
     * Queues a file notification from the generation service. Blocks while the dispatcher channel is full.
     *
     * @throws IllegalStateException if the engine is not started
     */
    public void notifyGenerated(Path file, AssetKind kind) throws InterruptedException {
        dispatcher.dispatch(new DiscoveryEvent(file, kind, ChangeKind.CREATED));
    }

    /**
     * Discovers a file and returns its tracked record. Discovering a known path returns the existing record.
     *
     * @throws AssetNotFoundException (through the future) if the file does not exist
     */
    public CompletableFuture<Asset> discover(Path file, AssetKind kind) {
        return dispatcher.submit(() -> {
            Asset asset = discoverFile(file, kind);
            if (asset == null) {
                throw new AssetNotFoundException(FileUtils.normalize(file));
            }
            return asset;
        });
    }

    public CompletableFuture<List<Asset>> activate(String viewName) {
        return dispatcher.submit(() -> loader.activate(viewName)).thenCompose(future -> future);
    }

    public CompletableFuture<Void> invalidate(String viewName) {
        return dispatcher.submit(() -> {
            loader.invalidate(viewName);
            return null;
        });
    }

    public CompletableFuture<Boolean> toggle(Path path) {
        String key = FileUtils.normalize(path);
        return mutate(() -> selection.toggle(key));
    }

    public CompletableFuture<Void> setSelected(Path path, boolean selected) {
        String key = FileUtils.normalize(path);
        return mutate(() -> {
            associations.setSelected(key, selected);
            return null;
        });
    }

    public CompletableFuture<Integer> clearSelection() {
        return mutate(selection::clearSelection);
    }

    public CompletableFuture<Integer> clearSelection(AssetKind kind) {
        return mutate(() -> selection.clearSelection(kind));
    }

    public CompletableFuture<Association> link(Path image, Path model) {
        String imageKey = FileUtils.normalize(image);
        String modelKey = FileUtils.normalize(model);
        return mutate(() -> {
            Association association = associations.link(imageKey, modelKey);
            selection.recompute();
            return association;
        });
    }

    public CompletableFuture<Boolean> unlink(Path image) {
        String imageKey = FileUtils.normalize(image);
        return mutate(() -> {
            boolean removed = associations.unlink(imageKey);
            selection.recompute();
            return removed;
        });
    }

    public CompletableFuture<Void> markTextured(Path model) {
        return markTextured(model, null);
    }

    public CompletableFuture<Void> markTextured(Path model, Path texturedModel) {
        String modelKey = FileUtils.normalize(model);
        String texturedKey = texturedModel != null ? FileUtils.normalize(texturedModel) : null;
        return mutate(() -> {
            associations.markTextured(modelKey, texturedKey);
            selection.recompute();
            return null;
        });
    }

    /**
     * Starts a new generation batch. Assets are classified against the new start from now on.
     */
    public CompletableFuture<Void> resetSession(Instant newStart) {
        return dispatcher.submit(() -> {
            classifier.resetSession(newStart);
            ProjectLogger.logInfo(stateRoot, "AssetEngine", "Session reset to " + newStart);
            return null;
        });
    }

    public CompletableFuture<Integer> autoDetect() {
        return autoDetect(settings.getImagesDir(), settings.getModelsDir());
    }

    public CompletableFuture<Integer> autoDetect(Path imagesDir, Path modelsDir) {
        return mutate(() -> {
            int created = associations.autoDetect(imagesDir, modelsDir);
            selection.recompute();
            return created;
        });
    }

    public CompletableFuture<Integer> cleanupMissing() {
        return mutate(() -> {
            int removed = associations.cleanupMissing();
            selection.recompute();
            return removed;
        });
    }

    public CompletableFuture<List<UnifiedObject>> getUnifiedView() {
        return dispatcher.submit(selection::getUnifiedView);
    }

    public CompletableFuture<Map<Progression, Integer>> getSelectionSummary() {
        return dispatcher.submit(selection::getSelectionSummary);
    }

    public CompletableFuture<List<String>> getPipelineTargets() {
        return dispatcher.submit(selection::getPipelineTargets);
    }

    public CompletableFuture<List<String>> getSelectedPaths(AssetKind kind) {
        return dispatcher.submit(() -> selection.getSelectedPaths(kind));
    }

    public CompletableFuture<Boolean> isSelected(Path path) {
        String key = FileUtils.normalize(path);
        return dispatcher.submit(() -> selection.isSelected(key));
    }

    public CompletableFuture<Map<String, Integer>> getAssociationStats() {
        return dispatcher.submit(associations::getStats);
    }

    public CompletableFuture<List<Association>> getAssociations() {
        return dispatcher.submit(associations::getAssociations);
    }

    /**
     * Tracked assets of {@code kind} belonging to the current session, newest first.
     */
    public CompletableFuture<List<Asset>> getSessionAssets(AssetKind kind) {
        return dispatcher.submit(() -> {
            List<Asset> result = new ArrayList<>();
            for (Asset asset : tracker.listByKind(kind)) {
                if (classifier.isSessionAsset(asset)) {
                    result.add(asset);
                }
            }
            result.sort(NEWEST_FIRST);
            return result;
        });
    }

    public CompletableFuture<List<Asset>> getTrackedAssets() {
        return dispatcher.submit(tracker::listAll);
    }

    /**
     * @throws ResourceRejectedException if the preview pool cannot admit the request
     */
    public ResourceHandle acquirePreview(boolean sessionScoped, String label) {
        return admission.acquire(sessionScoped, label);
    }

    public boolean releasePreview(ResourceHandle handle) {
        return admission.release(handle);
    }

    /**
     * Records a use of the preview so it moves to the back of the eviction order.
     *
     * @return false if the preview was already released or evicted
     */
    public boolean touchPreview(ResourceHandle handle) {
        return admission.touch(handle);
    }

    public List<ResourceHandle> reclaimIdlePreviews() {
        return admission.releaseIdle(settings.getPreviewIdleTimeout());
    }

    public ResourceAdmissionController getAdmissionController() {
        return admission;
    }

    public ServiceManager getServiceManager() {
        return serviceManager;
    }

    public String getStatus() {
        return serviceManager.getGlobalStatus();
    }

    /**
     * Number of full directory scans run by the lazy views.
     */
    public int getScanCount() {
        return loader.getScanCount();
    }

    private void watch(String name, Path directory, AssetKind kind) {
        watcher.register(name, directory, settings.getPatterns(kind), (path, change) -> {
            try {
                dispatcher.dispatch(new DiscoveryEvent(path, kind, change));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IllegalStateException e) {
                ProjectLogger.logWarning(stateRoot, "AssetEngine", "Dropped " + change + " of " + path + ": engine stopping");
            }
        });
    }

    private <T> CompletableFuture<T> mutate(Callable<T> operation) {
        return dispatcher.submit(() -> {
            pendingStoreFailure = null;
            T result = operation.call();
            StoreException failure = pendingStoreFailure;
            pendingStoreFailure = null;
            if (failure != null) {
                throw failure;
            }
            return result;
        });
    }

    private void applyDiscovery(DiscoveryEvent event) {
        if (event.isRemoval()) {
            applyRemoval(FileUtils.normalize(event.getPath()));
            return;
        }
        discoverFile(event.getPath(), event.getKind());
    }

    private Asset discoverFile(Path file, AssetKind kind) {
        Instant modifiedAt;
        try {
            if (!Files.isRegularFile(file)) {
                return null;
            }
            modifiedAt = Files.getLastModifiedTime(file).toInstant();
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            ProjectLogger.logRecurringError(stateRoot, "AssetEngine", "Failed to read " + file, e);
            return null;
        }

        AssetTracker.AddResult result = tracker.add(FileUtils.normalize(file), kind, modifiedAt);
        Asset asset = result.getAsset();
        if (!result.isNew()) {
            return asset;
        }

        boolean sessionScoped = classifier.isSessionAsset(asset);
        listeners.forEach(l -> l.onAssetDiscovered(asset, sessionScoped));

        selection.onAssetTracked(asset);
        associations.onAssetTracked(asset);
        if (kind != AssetKind.TEXTURED_MODEL) {
            associations.autoLink(asset);
        }
        associations.resolveTextured(asset);
        loader.onDiscovered(asset);
        selection.recompute();
        return asset;
    }

    private void applyRemoval(String path) {
        if (!tracker.remove(path)) {
            return;
        }
        selection.forget(path);
        associations.cleanupMissing();
        loader.onRemoved(path);
        selection.recompute();
        listeners.forEach(l -> l.onAssetRemoved(path));
    }

    private void persistState() {
        Snapshot snapshot = new Snapshot(associations.getPersistentAssociations(),
                associations.getPersistentTextured(), selection.getPersistentFlags());
        try {
            store.save(snapshot);
        } catch (StoreException e) {
            ProjectLogger.logError(stateRoot, "AssetEngine", "Failed to persist engine state", e);
            pendingStoreFailure = e;
        }
    }
}

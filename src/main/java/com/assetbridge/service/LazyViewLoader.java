package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.service.DirectoryWatcher.ChangeKind;
import com.assetbridge.util.FileUtils;
import com.assetbridge.util.ProjectLogger;

import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Defers the full enumeration of a directory until its view is first activated, then serves the cached
 * list and keeps it current from incremental discoveries.
 * <p>
 * {@link #activate}, {@link #invalidate}, {@link #onDiscovered} and {@link #onRemoved} run on the dispatcher loop.
 * The scan itself runs on the {@link DirectoryScanService}; scanned files are fed back as ordinary discovery
 * events followed by a finishing step, so the tracker stays the only registry of assets.
 */
public class LazyViewLoader {

    private final Path stateRoot;
    private final AssetTracker tracker;
    private final EventDispatcher dispatcher;
    private final DirectoryScanService scanner;
    private final Map<String, ViewState> views = new LinkedHashMap<>();
    private final AtomicInteger scanCount = new AtomicInteger();

    private static final Comparator<Asset> NEWEST_FIRST = Comparator.comparing(Asset::getModifiedAt).reversed();

    public LazyViewLoader(Path stateRoot, AssetTracker tracker, EventDispatcher dispatcher, DirectoryScanService scanner) {
        this.stateRoot = stateRoot;
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.scanner = scanner;
    }

    public void registerView(String name, Path directory, AssetKind kind, List<String> patterns) {
        views.put(name, new ViewState(name, directory.toAbsolutePath().normalize(), kind, FileUtils.compilePatterns(patterns)));
    }

    /**
     * Returns the view's assets, newest first. The first call starts one scan; callers arriving while it runs
     * share its result, and later calls are served from the cache without touching the filesystem.
     *
     * @throws IllegalArgumentException if no view is registered under {@code name}
     */
    public CompletableFuture<List<Asset>> activate(String name) {
        ViewState view = require(name);
        if (view.loaded) {
            return CompletableFuture.completedFuture(view.snapshot());
        }
        if (view.inFlight != null) {
            return view.inFlight;
        }

        CompletableFuture<List<Asset>> result = new CompletableFuture<>();
        view.inFlight = result;
        long generation = view.generation;
        scanCount.incrementAndGet();
        ProjectLogger.logInfo(stateRoot, "LazyViewLoader", "Loading view " + name + " from " + view.directory);

        scanner.scanAsync(view.directory, view.matchers).whenComplete((files, error) -> {
            if (error != null) {
                ProjectLogger.logError(stateRoot, "LazyViewLoader", "Scan failed for view " + name, error);
                dispatcher.submit(() -> {
                    view.inFlight = null;
                    result.completeExceptionally(error);
                    return null;
                }).whenComplete((ignored, stopped) -> {
                    if (stopped != null) {
                        result.completeExceptionally(error);
                    }
                });
                return;
            }
            try {
                for (Path file : files) {
                    dispatcher.dispatch(new DiscoveryEvent(file, view.kind, ChangeKind.MODIFIED));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IllegalStateException e) {
                // Engine stopped mid-scan
                result.completeExceptionally(e);
                return;
            }
            dispatcher.submit(() -> {
                finish(view, generation, result);
                return null;
            }).whenComplete((ignored, stopped) -> {
                if (stopped != null) {
                    result.completeExceptionally(stopped);
                }
            });
        });
        return result;
    }

    /**
     * Drops a view's cache so the next activation scans again. A scan already running still completes its
     * callers but does not mark the view loaded.
     */
    public void invalidate(String name) {
        ViewState view = require(name);
        view.generation++;
        view.loaded = false;
        view.cache.clear();
    }

    public void invalidateAll() {
        for (String name : views.keySet()) {
            invalidate(name);
        }
    }

    /**
     * Inserts a newly discovered asset at the front of every loaded view it belongs to.
     */
    public void onDiscovered(Asset asset) {
        for (ViewState view : views.values()) {
            if (view.loaded && view.accepts(asset) && !view.cache.contains(asset)) {
                view.cache.add(0, asset);
            }
        }
    }

    public void onRemoved(String path) {
        for (ViewState view : views.values()) {
            view.cache.removeIf(asset -> asset.getPath().equals(path));
        }
    }

    public boolean isLoaded(String name) {
        return require(name).loaded;
    }

    /**
     * @return the cached list, empty when the view was never loaded
     */
    public List<Asset> getCached(String name) {
        return require(name).snapshot();
    }

    public List<String> getViewNames() {
        return new ArrayList<>(views.keySet());
    }

    /**
     * Number of full directory scans started since creation.
     */
    public int getScanCount() {
        return scanCount.get();
    }

    private void finish(ViewState view, long generation, CompletableFuture<List<Asset>> result) {
        List<Asset> assets = new ArrayList<>();
        for (Asset asset : tracker.listByKind(view.kind)) {
            if (view.accepts(asset)) {
                assets.add(asset);
            }
        }
        assets.sort(NEWEST_FIRST);

        if (view.inFlight == result) {
            view.inFlight = null;
        }
        if (generation == view.generation) {
            view.cache.clear();
            view.cache.addAll(assets);
            view.loaded = true;
        }
        result.complete(Collections.unmodifiableList(assets));
    }

    private ViewState require(String name) {
        ViewState view = views.get(name);
        if (view == null) {
            throw new IllegalArgumentException("Unknown view: " + name);
        }
        return view;
    }

    private static final class ViewState {
        private final String name;
        private final Path directory;
        private final AssetKind kind;
        private final List<PathMatcher> matchers;
        private final List<Asset> cache = new ArrayList<>();
        private boolean loaded;
        private long generation;
        private CompletableFuture<List<Asset>> inFlight;

        private ViewState(String name, Path directory, AssetKind kind, List<PathMatcher> matchers) {
            this.name = name;
            this.directory = directory;
            this.kind = kind;
            this.matchers = matchers;
        }

        private boolean accepts(Asset asset) {
            if (asset.getKind() != kind) {
                return false;
            }
            Path path = asset.toPath();
            return directory.equals(path.getParent()) && FileUtils.matchesAny(path, matchers);
        }

        private List<Asset> snapshot() {
            return Collections.unmodifiableList(new ArrayList<>(cache));
        }

        @Override
        public String toString() {
            return "View{" + name + " -> " + directory + '}';
        }
    }
}

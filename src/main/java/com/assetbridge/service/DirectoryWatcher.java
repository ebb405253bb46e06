package com.assetbridge.service;

import com.assetbridge.util.FileUtils;
import com.assetbridge.util.ProjectLogger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Watches output directories for files written by the generation service.
 * Each registered directory gets its own watcher thread, so events for one path are always delivered in order.
 * Setup failures (missing or unreadable directory, exhausted inotify watches) are logged and retried with
 * exponential backoff; they never reach the caller.
 */
public class DirectoryWatcher implements BackgroundService {

    public enum ChangeKind {
        CREATED, MODIFIED, DELETED
    }

    /**
     * Receives filtered events on the watcher thread. May block (dispatcher backpressure).
     */
    public interface Listener {
        void onEvent(Path path, ChangeKind kind);
    }

    private final Path stateRoot;
    private final Duration pollInterval;
    private final Duration maxBackoff;
    private final ServiceManager serviceManager;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public DirectoryWatcher(Path stateRoot, Duration pollInterval, Duration maxBackoff, ServiceManager serviceManager) {
        this.stateRoot = stateRoot;
        this.pollInterval = pollInterval;
        this.maxBackoff = maxBackoff;
        this.serviceManager = serviceManager;
    }

    /**
     * Starts watching {@code directory} for files matching {@code patterns}. The directory does not need to exist yet.
     * Registering a name twice replaces the previous registration.
     */
    public void register(String name, Path directory, List<String> patterns, Listener onEvent) {
        Registration registration = new Registration(name, directory.toAbsolutePath().normalize(),
                FileUtils.compilePatterns(patterns), onEvent);
        Registration previous = registrations.put(name, registration);
        if (previous != null) {
            previous.stop();
        }
        serviceManager.registerService(this);
        registration.start();
        ProjectLogger.logInfo(stateRoot, "DirectoryWatcher", "Added monitor for " + name + ": " + registration.directory);
    }

    public boolean unregister(String name) {
        Registration registration = registrations.remove(name);
        if (registration == null) {
            return false;
        }
        registration.stop();
        ProjectLogger.logInfo(stateRoot, "DirectoryWatcher", "Removed monitor for " + name);
        return true;
    }

    public void unregisterAll() {
        for (String name : new ArrayList<>(registrations.keySet())) {
            unregister(name);
        }
    }

    /**
     * Stops every watcher thread and releases the OS watch handles.
     */
    public void stop() {
        unregisterAll();
        ProjectLogger.flush(stateRoot);
        serviceManager.unregisterService(this);
    }

    @Override
    public void stopService() {
        stop();
    }

    /**
     * @return true once the OS watch for {@code name} is established and events are being delivered.
     */
    public boolean isWatching(String name) {
        Registration registration = registrations.get(name);
        return registration != null && registration.watching;
    }

    @Override
    public boolean isRunning() {
        return registrations.values().stream().anyMatch(Registration::isAlive);
    }

    @Override
    public String getStatus() {
        long watching = registrations.values().stream().filter(r -> r.watching).count();
        return "Watching " + watching + "/" + registrations.size() + " directories";
    }

    @Override
    public String getServiceName() {
        return "watcher";
    }

    @Override
    public String getWatchedPath() {
        return registrations.values().stream()
                .map(r -> r.directory.toString())
                .collect(Collectors.joining(", "));
    }

    private final class Registration implements Runnable {
        private final String name;
        private final Path directory;
        private final List<PathMatcher> matchers;
        private final Listener listener;
        private final Thread thread;
        private volatile boolean active = true;
        private volatile boolean watching;

        private Registration(String name, Path directory, List<PathMatcher> matchers, Listener listener) {
            this.name = name;
            this.directory = directory;
            this.matchers = matchers;
            this.listener = listener;
            this.thread = new Thread(this, "watcher-" + name);
            this.thread.setDaemon(true);
        }

        private void start() {
            thread.start();
        }

        private void stop() {
            active = false;
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private boolean isAlive() {
            return thread.isAlive();
        }

        @Override
        public void run() {
            long backoffMillis = pollInterval.toMillis();
            boolean firstSetup = true;

            while (active && !Thread.currentThread().isInterrupted()) {
                try (WatchService watchService = directory.getFileSystem().newWatchService()) {
                    Files.createDirectories(directory);
                    directory.register(watchService,
                            StandardWatchEventKinds.ENTRY_CREATE,
                            StandardWatchEventKinds.ENTRY_MODIFY,
                            StandardWatchEventKinds.ENTRY_DELETE);
                    watching = true;
                    backoffMillis = pollInterval.toMillis();

                    // The directory was lost and came back: report what it holds now
                    if (!firstSetup) {
                        rescan();
                    }
                    firstSetup = false;

                    pollLoop(watchService);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (IOException | RuntimeException e) {
                    ProjectLogger.logRecurringError(stateRoot, "DirectoryWatcher",
                            "Failed to watch " + name + " at " + directory + ", retrying", e);
                } finally {
                    watching = false;
                }

                if (!active) {
                    break;
                }
                try {
                    Thread.sleep(backoffMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                backoffMillis = Math.min(backoffMillis * 2, maxBackoff.toMillis());
            }
        }

        private void pollLoop(WatchService watchService) throws InterruptedException {
            while (active) {
                WatchKey key = watchService.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
                for (WatchEvent<?> event : key.pollEvents()) {
                    WatchEvent.Kind<?> kind = event.kind();
                    if (kind == StandardWatchEventKinds.OVERFLOW) {
                        ProjectLogger.logWarning(stateRoot, "DirectoryWatcher", "Event overflow on " + directory + ", rescanning");
                        rescan();
                        continue;
                    }
                    Path child = directory.resolve((Path) event.context());
                    if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
                        deliver(child, ChangeKind.DELETED);
                    } else if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
                        deliverIfWritten(child, ChangeKind.CREATED);
                    } else {
                        deliverIfWritten(child, ChangeKind.MODIFIED);
                    }
                }
                if (!key.reset()) {
                    ProjectLogger.logWarning(stateRoot, "DirectoryWatcher", "Watch key invalidated for " + directory);
                    return;
                }
            }
        }

        private void rescan() {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path child : stream) {
                    deliverIfWritten(child, ChangeKind.MODIFIED);
                }
            } catch (IOException e) {
                ProjectLogger.logRecurringError(stateRoot, "DirectoryWatcher", "Failed to rescan " + directory, e);
            }
        }

        // Empty files are still being written by the generator; the next modify event carries them.
        private void deliverIfWritten(Path child, ChangeKind kind) {
            if (!FileUtils.matchesAny(child, matchers)) {
                return;
            }
            try {
                if (!Files.isRegularFile(child) || Files.size(child) == 0) {
                    return;
                }
            } catch (NoSuchFileException e) {
                return;
            } catch (IOException e) {
                ProjectLogger.logRecurringError(stateRoot, "DirectoryWatcher", "Failed to stat " + child, e);
                return;
            }
            deliver(child, kind);
        }

        private void deliver(Path child, ChangeKind kind) {
            if (!FileUtils.matchesAny(child, matchers)) {
                return;
            }
            try {
                listener.onEvent(child, kind);
            } catch (RuntimeException e) {
                ProjectLogger.logError(stateRoot, "DirectoryWatcher", "Listener failed for " + child, e);
            }
        }
    }
}

package com.assetbridge.service;

import com.assetbridge.util.FileUtils;
import com.assetbridge.util.ProjectLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Full enumeration of an output directory, run off the dispatcher loop.
 * Only the top level of the directory is listed, matching what the watcher observes.
 * Walk failures are logged and retried with backoff. A directory that stays unreadable fails the scan, so callers
 * can tell it apart from an empty one.
 */
public class DirectoryScanService implements BackgroundService {

    private static final int MAX_ATTEMPTS = 3;

    private final Path stateRoot;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final ServiceManager serviceManager;
    private final ExecutorService executor;
    private final AtomicInteger activeScans = new AtomicInteger();
    private volatile String currentDirectory = "";

    public DirectoryScanService(Path stateRoot, Duration initialBackoff, Duration maxBackoff, ServiceManager serviceManager) {
        this.stateRoot = stateRoot;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.serviceManager = serviceManager;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "directory-scan");
            thread.setDaemon(true);
            return thread;
        });
        serviceManager.registerService(this);
    }

    /**
     * Schedules a scan of {@code directory}. The future completes on the scan thread.
     */
    public CompletableFuture<List<Path>> scanAsync(Path directory, List<PathMatcher> matchers) {
        try {
            return CompletableFuture.supplyAsync(() -> scan(directory, matchers), executor);
        } catch (RejectedExecutionException e) {
            CompletableFuture<List<Path>> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    /**
     * Lists the non-empty regular files of {@code directory} accepted by {@code matchers}.
     * A missing directory is not an error and yields an empty list.
     *
     * @throws UncheckedIOException if the directory could not be read after all attempts
     */
    public List<Path> scan(Path directory, List<PathMatcher> matchers) {
        activeScans.incrementAndGet();
        currentDirectory = directory.toString();
        try {
            long backoffMillis = initialBackoff.toMillis();
            IOException lastFailure = null;
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    return walk(directory, matchers);
                } catch (NoSuchFileException e) {
                    return new ArrayList<>();
                } catch (IOException e) {
                    lastFailure = e;
                    ProjectLogger.logRecurringError(stateRoot, "DirectoryScanService",
                            "Scan of " + directory + " failed (attempt " + attempt + "/" + MAX_ATTEMPTS + ")", e);
                }
                if (attempt == MAX_ATTEMPTS) {
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
            ProjectLogger.logWarning(stateRoot, "DirectoryScanService", "Giving up on " + directory);
            throw new UncheckedIOException("Could not scan " + directory, lastFailure);
        } finally {
            activeScans.decrementAndGet();
        }
    }

    List<Path> walk(Path directory, List<PathMatcher> matchers) throws IOException {
        List<Path> found = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return found;
        }
        Files.walkFileTree(directory, EnumSet.noneOf(FileVisitOption.class), 1, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (Thread.currentThread().isInterrupted()) {
                    return FileVisitResult.TERMINATE;
                }
                if (!attrs.isRegularFile() || attrs.size() == 0) {
                    return FileVisitResult.CONTINUE;
                }
                if (FileUtils.matchesAny(file, matchers)) {
                    found.add(file.toAbsolutePath().normalize());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(directory)) {
                    throw exc;
                }
                ProjectLogger.logError(stateRoot, "DirectoryScanService", "Failed to visit file: " + file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
        return found;
    }

    @Override
    public boolean isRunning() {
        return activeScans.get() > 0;
    }

    @Override
    public String getStatus() {
        return "Scanning " + currentDirectory;
    }

    @Override
    public String getServiceName() {
        return "scan";
    }

    @Override
    public String getWatchedPath() {
        return currentDirectory;
    }

    @Override
    public void stopService() {
        executor.shutdownNow();
        serviceManager.unregisterService(this);
    }
}

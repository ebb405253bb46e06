package com.assetbridge.service;

import com.assetbridge.util.ProjectLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded channel plus the single consumer loop that owns all mutable engine state.
 * Discovery events and routed presentation calls are applied one at a time, in arrival order,
 * so the tracker, association and selection components never need locks.
 * Producers block when the channel is full; nothing is ever dropped.
 */
public class EventDispatcher {

    /**
     * Applies one discovery event to the engine state. Always invoked on the dispatcher thread.
     */
    public interface DiscoveryHandler {
        void onDiscovery(DiscoveryEvent event);
    }

    private static final long ENQUEUE_RECHECK_MILLIS = 100;

    private final Path stateRoot;
    private final BlockingQueue<Runnable> queue;
    private final DiscoveryHandler handler;
    private final AtomicLong processedCount = new AtomicLong();
    private volatile Thread loopThread;
    private volatile boolean running;

    public EventDispatcher(Path stateRoot, int capacity, DiscoveryHandler handler) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Dispatcher capacity must be positive: " + capacity);
        }
        this.stateRoot = stateRoot;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.handler = handler;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::runLoop, "asset-dispatcher");
        loopThread.setDaemon(true);
        loopThread.start();
    }

    /**
     * Enqueues a discovery event, blocking while the channel is full.
     *
     * @throws IllegalStateException if the loop is not running, or stops while the caller waits for room
     */
    public void dispatch(DiscoveryEvent event) throws InterruptedException {
        enqueue(() -> handler.onDiscovery(event));
    }

    /**
     * Runs {@code action} on the dispatcher loop. When already on the loop (e.g. from a listener callback)
     * the action runs inline so that callers never wait on themselves.
     * When the loop is not running the returned future is already failed with {@link IllegalStateException}.
     */
    public <T> CompletableFuture<T> submit(Callable<T> action) {
        if (isDispatchThread()) {
            return runNow(action);
        }
        PendingCall<T> call = new PendingCall<>(action);
        try {
            enqueue(call);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.future.completeExceptionally(e);
        } catch (IllegalStateException e) {
            call.future.completeExceptionally(e);
        }
        return call.future;
    }

    public boolean isDispatchThread() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isRunning() {
        return running && loopThread != null && loopThread.isAlive();
    }

    public int getPendingCount() {
        return queue.size();
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    /**
     * Stops the loop. Routed calls still waiting in the channel are cancelled.
     */
    public synchronized void stop() {
        running = false;
        Thread thread = loopThread;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        List<Runnable> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        for (Runnable task : leftover) {
            if (task instanceof PendingCall) {
                ((PendingCall<?>) task).future.completeExceptionally(new CancellationException("Dispatcher stopped"));
            }
        }
    }

    private void enqueue(Runnable task) throws InterruptedException {
        while (true) {
            if (!running) {
                throw new IllegalStateException("Dispatcher is not running");
            }
            if (queue.offer(task, ENQUEUE_RECHECK_MILLIS, TimeUnit.MILLISECONDS)) {
                break;
            }
        }
        // stop() may have drained the channel between the check and the offer
        if (!running && queue.remove(task)) {
            throw new IllegalStateException("Dispatcher is not running");
        }
    }

    private void runLoop() {
        while (running) {
            Runnable task;
            try {
                task = queue.poll(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                break;
            }
            if (task == null) {
                continue;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                ProjectLogger.logError(stateRoot, "EventDispatcher", "Event handler failed", e);
            } finally {
                processedCount.incrementAndGet();
            }
        }
    }

    private static <T> CompletableFuture<T> runNow(Callable<T> action) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            future.complete(action.call());
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private static final class PendingCall<T> implements Runnable {
        private final Callable<T> action;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private PendingCall(Callable<T> action) {
            this.action = action;
        }

        @Override
        public void run() {
            try {
                future.complete(action.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        }
    }
}

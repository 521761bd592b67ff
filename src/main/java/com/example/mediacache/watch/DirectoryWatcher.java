package com.example.mediacache.watch;

import com.example.mediacache.FileLockedException;
import com.example.mediacache.MediaCacheException;
import com.example.mediacache.NotASubpathException;
import com.example.mediacache.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Watches the media tree and forwards settled changes to a {@link WatchEventHandler}.
 *
 * <p>A dedicated thread takes raw events from the {@link WatchService}; all handling runs
 * on one scheduler thread so changes are applied in the order they were observed. File additions are debounced
 * and only handed over once the file has stopped changing and can be read.
 */
public final class DirectoryWatcher implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryWatcher.class);
    static final int MAX_ATTEMPTS = 20;

    private final PathResolver mediaResolver;
    private final WatchEventHandler handler;
    private final Duration settleDelay;
    private final Map<Path, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    private WatchService watchService;
    private WatchTree tree;
    private ScheduledExecutorService scheduler;
    private Thread eventLoop;
    private volatile boolean running;

    public DirectoryWatcher(PathResolver mediaResolver, WatchEventHandler handler, Duration settleDelay) {
        this.mediaResolver = mediaResolver;
        this.handler = handler;
        this.settleDelay = settleDelay;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        Path root = mediaResolver.root().toAbsolutePath().normalize();
        watchService = FileSystems.getDefault().newWatchService();
        tree = new WatchTree(watchService);
        tree.registerRecursively(root);
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "media-watcher-worker");
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        eventLoop = new Thread(this::eventLoop, "media-watcher");
        eventLoop.setDaemon(true);
        eventLoop.start();
        LOGGER.info("Watching {} ({} folders)", root, tree.size());
    }

    /**
     * Stops watching and waits for the event loop to finish. Pending additions are dropped.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException ex) {
            LOGGER.warn("Unable to close watch service", ex);
        }
        scheduler.shutdownNow();
        try {
            eventLoop.join(TimeUnit.SECONDS.toMillis(5));
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        pending.clear();
        LOGGER.info("Stopped watching {}", mediaResolver.root());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }

    private void eventLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException ex) {
                return;
            }
            Path directory = tree.directoryFor(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == StandardWatchEventKinds.OVERFLOW) {
                    LOGGER.warn("Watch events were lost, rescanning {}", mediaResolver.root());
                    requestRescan();
                    continue;
                }
                if (directory == null) {
                    continue;
                }
                Path child = directory.resolve((Path) event.context());
                if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
                    submit(() -> created(child));
                } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
                    submit(() -> modified(child));
                } else if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
                    submit(() -> deleted(child));
                }
            }
            if (!key.reset()) {
                tree.forget(key);
            }
        }
    }

    private void created(Path child) {
        if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
            try {
                List<Path> existing = tree.registerRecursively(child);
                LOGGER.debug("New folder {} with {} files", child, existing.size());
                existing.forEach(file -> schedule(file, 1));
            } catch (IOException ex) {
                LOGGER.warn("Unable to watch new folder {}", child, ex);
            }
        } else {
            modified(child);
        }
    }

    private void modified(Path child) {
        if (!Files.isRegularFile(child)) {
            return;
        }
        String relative = relativize(child);
        if (relative == null) {
            return;
        }
        try {
            handler.fileChanged(relative);
        } catch (MediaCacheException ex) {
            LOGGER.warn("Unable to handle change of {}: {}", relative, ex.getMessage());
        }
        schedule(child, 1);
    }

    /**
     * Handles a removal. Runs after every earlier event has been handled, so a watched
     * path here is the folder this event removed, never a later re-creation of it.
     */
    private void deleted(Path child) {
        ScheduledFuture<?> waiting = pending.remove(child);
        if (waiting != null) {
            waiting.cancel(false);
        }
        String relative = relativize(child);
        if (relative == null) {
            return;
        }
        try {
            if (tree.isWatched(child)) {
                tree.unregisterTree(child);
                handler.directoryRemoved(relative);
            } else {
                handler.fileRemoved(relative);
            }
        } catch (MediaCacheException ex) {
            LOGGER.warn("Unable to handle removal of {}: {}", relative, ex.getMessage());
        }
    }

    /**
     * Re-walks the media root on the worker thread: registers folders that were missed and
     * schedules every file, so changes lost with dropped events are still picked up.
     */
    void requestRescan() {
        submit(this::rescan);
    }

    private void rescan() {
        try {
            List<Path> files = tree.registerRecursively(mediaResolver.root());
            LOGGER.info("Rescan found {} files", files.size());
            files.forEach(file -> schedule(file, 1));
        } catch (IOException ex) {
            LOGGER.warn("Unable to rescan {}", mediaResolver.root(), ex);
        }
    }

    /**
     * (Re)starts the settle timer of a file. A newer event for the same file replaces the
     * waiting one.
     */
    private void schedule(Path file, int attempt) {
        FileLockProbe.FileState state = readState(file);
        ScheduledFuture<?> future;
        try {
            future = scheduler.schedule(() -> settle(file, state, attempt),
                    settleDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            return;
        }
        ScheduledFuture<?> previous = pending.put(file, future);
        if (previous != null && previous != future) {
            previous.cancel(false);
        }
    }

    private void settle(Path file, FileLockProbe.FileState expected, int attempt) {
        if (!Files.isRegularFile(file)) {
            pending.remove(file);
            return;
        }
        FileLockProbe.FileState current = readState(file);
        if (current == null || !current.equals(expected) || !FileLockProbe.isReadable(file)) {
            retry(file, attempt, "still being written");
            return;
        }
        String relative = relativize(file);
        if (relative == null) {
            pending.remove(file);
            return;
        }
        try {
            handler.fileAdded(relative);
            pending.remove(file);
        } catch (FileLockedException ex) {
            retry(file, attempt, ex.getMessage());
        } catch (MediaCacheException ex) {
            pending.remove(file);
            LOGGER.warn("Unable to process added file {}: {}", relative, ex.getMessage());
        }
    }

    private void retry(Path file, int attempt, String reason) {
        if (attempt >= MAX_ATTEMPTS) {
            pending.remove(file);
            LOGGER.warn("Giving up on {} after {} attempts: {}", file, attempt, reason);
            return;
        }
        LOGGER.debug("Retrying {} (attempt {}): {}", file, attempt + 1, reason);
        schedule(file, attempt + 1);
    }

    private void submit(Runnable task) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException ex) {
            LOGGER.debug("Watcher stopped, dropping event");
        }
    }

    private String relativize(Path path) {
        try {
            return mediaResolver.relativize(path);
        } catch (NotASubpathException ex) {
            LOGGER.warn("Ignoring event outside media root: {}", path);
            return null;
        }
    }

    private static FileLockProbe.FileState readState(Path file) {
        try {
            return FileLockProbe.FileState.of(file);
        } catch (IOException ex) {
            return null;
        }
    }
}

package com.example.mediacache.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The set of watched directories, one {@link WatchKey} per directory. Registration is
 * never recursive at the OS level, so every sub-directory gets its own key.
 */
final class WatchTree {
    private static final Logger LOGGER = LoggerFactory.getLogger(WatchTree.class);

    private final WatchService watchService;
    private final Map<WatchKey, Path> directoriesByKey = new ConcurrentHashMap<>();
    private final Map<Path, WatchKey> keysByDirectory = new ConcurrentHashMap<>();

    WatchTree(WatchService watchService) {
        this.watchService = watchService;
    }

    /**
     * Registers {@code root} and every directory below it that is not watched yet.
     *
     * @return the regular files found below {@code root}
     */
    List<Path> registerRecursively(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return files;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                try {
                    register(dir);
                } catch (IOException ex) {
                    LOGGER.warn("Unable to watch {}", dir, ex);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(normalize(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOGGER.debug("Unable to visit {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    void register(Path directory) throws IOException {
        Path normalized = normalize(directory);
        WatchKey existing = keysByDirectory.get(normalized);
        if (existing != null && existing.isValid()) {
            return;
        }
        WatchKey key = normalized.register(
                watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE
        );
        directoriesByKey.put(key, normalized);
        keysByDirectory.put(normalized, key);
        LOGGER.debug("Watching {}", normalized);
    }

    Path directoryFor(WatchKey key) {
        return directoriesByKey.get(key);
    }

    boolean isWatched(Path directory) {
        return keysByDirectory.containsKey(normalize(directory));
    }

    /**
     * Cancels the watch of {@code directory} and of every watched directory below it.
     * Callers must run in event order with {@link #registerRecursively}, otherwise a
     * directory re-created after its removal could lose its new watch.
     */
    void unregisterTree(Path directory) {
        Path normalized = normalize(directory);
        for (Path watched : List.copyOf(keysByDirectory.keySet())) {
            if (watched.startsWith(normalized)) {
                WatchKey key = keysByDirectory.remove(watched);
                if (key != null) {
                    key.cancel();
                    directoriesByKey.remove(key);
                    LOGGER.debug("Stopped watching {}", watched);
                }
            }
        }
    }

    /**
     * Drops a key that is no longer valid. The directory stays known until
     * {@link #unregisterTree} so that a later removal event is still recognised as a
     * folder.
     */
    void forget(WatchKey key) {
        directoriesByKey.remove(key);
    }

    int size() {
        return keysByDirectory.size();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}

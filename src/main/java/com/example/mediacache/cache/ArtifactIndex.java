package com.example.mediacache.cache;

import com.example.mediacache.NotASubpathException;
import com.example.mediacache.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory record of the artifacts known to exist in the cache tree, keyed by their
 * relative cache path. Advisory only: the files on disk decide whether work is needed.
 */
final class ArtifactIndex {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactIndex.class);

    private final Map<String, Instant> thumbnails = new ConcurrentHashMap<>();
    private final Map<String, Instant> previews = new ConcurrentHashMap<>();
    private final Map<String, Instant> albumThumbnails = new ConcurrentHashMap<>();

    /**
     * Fills the index from a full scan of the cache tree.
     */
    void load(PathResolver cacheResolver) {
        Path root = cacheResolver.root();
        if (!Files.isDirectory(root)) {
            return;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    record(cacheResolver, file, attrs.lastModifiedTime().toInstant());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.warn("Unable to read cache entry {}", file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            LOGGER.warn("Unable to scan cache {}", root, ex);
        }
        LOGGER.info("Cache index loaded: {} thumbnails, {} previews, {} album thumbnails",
                thumbnails.size(), previews.size(), albumThumbnails.size());
    }

    private void record(PathResolver cacheResolver, Path file, Instant modified) {
        String name = file.getFileName().toString();
        String key;
        try {
            key = cacheResolver.relativize(file);
        } catch (NotASubpathException ex) {
            return;
        }
        if (name.endsWith(ArtifactNames.PREVIEW_SUFFIX)) {
            previews.put(key, modified);
        } else if (name.endsWith(ArtifactNames.THUMBNAIL_SUFFIX)) {
            thumbnails.put(key, modified);
        } else if (ArtifactNames.isAlbumThumbnailName(name)) {
            albumThumbnails.put(key, modified);
        }
    }

    void putThumbnail(String key) {
        thumbnails.put(key, Instant.now());
    }

    void putPreview(String key) {
        previews.put(key, Instant.now());
    }

    void putAlbumThumbnail(String key) {
        albumThumbnails.put(key, Instant.now());
    }

    boolean hasThumbnail(String key) {
        return thumbnails.containsKey(key);
    }

    boolean hasPreview(String key) {
        return previews.containsKey(key);
    }

    boolean hasAlbumThumbnail(String key) {
        return albumThumbnails.containsKey(key);
    }

    void removeThumbnail(String key) {
        thumbnails.remove(key);
    }

    void removePreview(String key) {
        previews.remove(key);
    }

    /**
     * Drops every record equal to {@code key} or below it.
     */
    void removeUnder(String key) {
        String prefix = key.isEmpty() ? "" : key + "/";
        for (Map<String, Instant> map : List.of(thumbnails, previews, albumThumbnails)) {
            map.keySet().removeIf(existing -> existing.equals(key) || existing.startsWith(prefix));
        }
    }
}

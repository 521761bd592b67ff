package com.example.mediacache.precache;

import com.example.mediacache.MediaCacheException;
import com.example.mediacache.PermanentlyFailedException;
import com.example.mediacache.cache.ArtifactCache;
import com.example.mediacache.cache.PreviewResult;
import com.example.mediacache.catalog.MediaCatalog;
import com.example.mediacache.catalog.MediaEntry;
import com.example.mediacache.catalog.MediaType;
import com.example.mediacache.image.EmbeddedThumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Walks the media tree and produces thumbnails and previews ahead of client requests.
 * One top-level sweep runs at a time; sub-directories are swept synchronously within it.
 */
public final class PrecacheScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrecacheScheduler.class);

    private final MediaCatalog catalog;
    private final ArtifactCache cache;
    private final EmbeddedThumbnails embeddedThumbnails;
    private final boolean ignoreExifThumbs;
    private final boolean cacheCleanup;
    private final ReentrantLock sweepLock = new ReentrantLock();
    private volatile boolean inProgress;

    public PrecacheScheduler(MediaCatalog catalog,
                             ArtifactCache cache,
                             EmbeddedThumbnails embeddedThumbnails,
                             boolean ignoreExifThumbs,
                             boolean cacheCleanup) {
        this.catalog = catalog;
        this.cache = cache;
        this.embeddedThumbnails = embeddedThumbnails;
        this.ignoreExifThumbs = ignoreExifThumbs;
        this.cacheCleanup = cacheCleanup;
    }

    public boolean isInProgress() {
        return inProgress;
    }

    /**
     * Generates the requested artifacts for every media file in {@code relativePath}, and
     * in all its sub-directories when {@code recursive} is set. An empty path means the
     * media root. The returned totals include every visited sub-directory.
     */
    public PrecacheStatistics sweep(String relativePath, boolean recursive, boolean thumbnails, boolean previews) {
        sweepLock.lock();
        boolean previous = inProgress;
        inProgress = true;
        try {
            return sweepDirectory(relativePath, recursive, thumbnails, previews);
        } finally {
            inProgress = previous;
            sweepLock.unlock();
        }
    }

    private PrecacheStatistics sweepDirectory(String relativePath,
                                              boolean recursive,
                                              boolean thumbnails,
                                              boolean previews) {
        PrecacheCounters counters = new PrecacheCounters();
        List<MediaEntry> entries;
        try {
            entries = catalog.list(relativePath);
        } catch (MediaCacheException ex) {
            LOGGER.warn("Unable to list folder '{}': {}", relativePath, ex.getMessage());
            counters.addFailedFolder();
            return PrecacheStatistics.from(counters);
        }

        for (MediaEntry entry : entries) {
            if (entry.isFolder()) {
                if (recursive) {
                    counters.addFolder();
                    counters.addAll(sweep(entry.path(), true, thumbnails, previews));
                }
                continue;
            }
            boolean video = entry.type() == MediaType.VIDEO;
            if (video) {
                counters.addVideo();
            } else {
                counters.addImage();
            }

            boolean hasExifThumbnail = !ignoreExifThumbs && hasEmbeddedThumbnail(entry);
            if (hasExifThumbnail) {
                counters.addExif();
            }
            if (thumbnails && !hasExifThumbnail && !cache.hasThumbnail(entry.path())) {
                try {
                    cache.generateThumbnail(entry.path());
                    counters.addThumbnail(video);
                } catch (MediaCacheException ex) {
                    logFailure("thumbnail", entry, ex);
                    counters.addFailedThumbnail(video);
                }
            }
            if (previews && !video && !cache.hasPreview(entry.path())) {
                try {
                    PreviewResult result = cache.generatePreview(entry.path());
                    if (result.tooSmall()) {
                        counters.addSmallImage();
                    } else {
                        counters.addPreview();
                    }
                } catch (MediaCacheException ex) {
                    logFailure("preview", entry, ex);
                    counters.addFailedPreview();
                }
            }
        }

        if (cacheCleanup) {
            try {
                counters.addRemovedCacheFiles(cache.cleanupCache(relativePath, entries));
            } catch (MediaCacheException ex) {
                LOGGER.warn("Unable to clean cache folder '{}': {}", relativePath, ex.getMessage());
            }
        }
        return PrecacheStatistics.from(counters);
    }

    private boolean hasEmbeddedThumbnail(MediaEntry entry) {
        if (!MediaType.isJpeg(entry.name())) {
            return false;
        }
        try {
            return embeddedThumbnails.has(catalog.resolver().resolve(entry.path()));
        } catch (MediaCacheException ex) {
            return false;
        }
    }

    private static void logFailure(String artifact, MediaEntry entry, MediaCacheException ex) {
        if (ex instanceof PermanentlyFailedException) {
            LOGGER.trace("Skipped {} for {}: {}", artifact, entry.path(), ex.getMessage());
        } else {
            LOGGER.warn("Unable to create {} for {}: {}", artifact, entry.path(), ex.getMessage());
        }
    }
}

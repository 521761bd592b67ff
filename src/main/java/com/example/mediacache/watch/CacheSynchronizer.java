package com.example.mediacache.watch;

import com.example.mediacache.MediaCacheException;
import com.example.mediacache.PermanentlyFailedException;
import com.example.mediacache.cache.ArtifactCache;
import com.example.mediacache.cache.PreviewResult;
import com.example.mediacache.catalog.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the cache tree in step with the media tree: new media get their artifacts
 * generated, removed media and folders lose theirs.
 */
public final class CacheSynchronizer implements WatchEventHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(CacheSynchronizer.class);

    private final ArtifactCache cache;
    private final boolean thumbnailsOnAdd;
    private final boolean previewsOnAdd;

    public CacheSynchronizer(ArtifactCache cache, boolean thumbnailsOnAdd, boolean previewsOnAdd) {
        this.cache = cache;
        this.thumbnailsOnAdd = thumbnailsOnAdd;
        this.previewsOnAdd = previewsOnAdd;
    }

    @Override
    public void fileAdded(String relativePath) throws MediaCacheException {
        if (MediaType.fromFileName(relativePath).isEmpty()) {
            return;
        }
        try {
            if (thumbnailsOnAdd) {
                cache.generateThumbnail(relativePath);
            }
            if (previewsOnAdd && MediaType.isImage(relativePath)) {
                PreviewResult result = cache.generatePreview(relativePath);
                if (result.tooSmall()) {
                    LOGGER.trace("No preview needed for {}", relativePath);
                }
            }
        } catch (PermanentlyFailedException ex) {
            LOGGER.debug("Skipping added file {}: {}", relativePath, ex.getMessage());
        }
    }

    /**
     * A failure recorded while the file was still being written must not outlive the write.
     */
    @Override
    public void fileChanged(String relativePath) throws MediaCacheException {
        if (MediaType.fromFileName(relativePath).isEmpty()) {
            return;
        }
        if (cache.clearErrorMarkers(relativePath)) {
            LOGGER.debug("{} changed after a failed attempt, it will be retried", relativePath);
        }
    }

    @Override
    public void fileRemoved(String relativePath) throws MediaCacheException {
        if (MediaType.fromFileName(relativePath).isEmpty()) {
            return;
        }
        if (cache.removeArtifacts(relativePath)) {
            LOGGER.info("Removed cached artifacts of {}", relativePath);
        }
    }

    @Override
    public void directoryRemoved(String relativePath) throws MediaCacheException {
        if (cache.removeDirectory(relativePath)) {
            LOGGER.info("Removed cache folder of {}", relativePath);
        }
    }
}

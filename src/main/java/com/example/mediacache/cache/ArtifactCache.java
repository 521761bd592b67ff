package com.example.mediacache.cache;

import com.example.mediacache.DecodeException;
import com.example.mediacache.FileLockedException;
import com.example.mediacache.MediaCacheException;
import com.example.mediacache.NoExtensionException;
import com.example.mediacache.NotFoundException;
import com.example.mediacache.PathEscapeException;
import com.example.mediacache.PermanentlyFailedException;
import com.example.mediacache.UnsupportedTypeException;
import com.example.mediacache.catalog.MediaEntry;
import com.example.mediacache.catalog.MediaType;
import com.example.mediacache.image.ImageCodec;
import com.example.mediacache.image.ImageOps;
import com.example.mediacache.image.OrientationResolver;
import com.example.mediacache.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Owns the cache tree: thumbnails, previews, album collages and the error markers that
 * stop a failed source from being retried. The cache tree mirrors the media tree, so
 * every artifact lives in the directory corresponding to its source's directory.
 *
 * <p>Concurrent requests for the same artifact are collapsed into one generation.
 */
public final class ArtifactCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactCache.class);

    static final int THUMBNAIL_SIZE = 256;

    private final PathResolver cacheResolver;
    private final PathResolver mediaResolver;
    private final ImageCodec codec;
    private final OrientationResolver orientation;
    private final VideoFrameExtractor frameExtractor;
    private final int previewMaxSide;
    private final boolean previewSmallImages;
    private final ArtifactIndex index = new ArtifactIndex();
    private final SingleFlight<String, Path> thumbnailCalls = new SingleFlight<>();
    private final SingleFlight<String, PreviewResult> previewCalls = new SingleFlight<>();
    private final SingleFlight<String, Path> albumCalls = new SingleFlight<>();
    private final BufferedImage videoBadge = VideoBadge.draw();

    public ArtifactCache(PathResolver cacheResolver,
                         PathResolver mediaResolver,
                         ImageCodec codec,
                         OrientationResolver orientation,
                         VideoFrameExtractor frameExtractor,
                         int previewMaxSide,
                         boolean previewSmallImages) {
        this.cacheResolver = cacheResolver;
        this.mediaResolver = mediaResolver;
        this.codec = codec;
        this.orientation = orientation;
        this.frameExtractor = frameExtractor;
        this.previewMaxSide = previewMaxSide;
        this.previewSmallImages = previewSmallImages;
        index.load(cacheResolver);
    }

    public Path thumbnailPath(String relativeMediaPath) throws NoExtensionException, PathEscapeException {
        return cacheResolver.resolve(ArtifactNames.relativeThumbnailPath(relativeMediaPath));
    }

    public Path previewPath(String relativeMediaPath) throws NoExtensionException, PathEscapeException {
        return cacheResolver.resolve(ArtifactNames.relativePreviewPath(relativeMediaPath));
    }

    public boolean hasThumbnail(String relativeMediaPath) {
        try {
            return index.hasThumbnail(ArtifactNames.relativeThumbnailPath(PathResolver.canonical(relativeMediaPath)));
        } catch (NoExtensionException ex) {
            return false;
        }
    }

    public boolean hasPreview(String relativeMediaPath) {
        try {
            return index.hasPreview(ArtifactNames.relativePreviewPath(PathResolver.canonical(relativeMediaPath)));
        } catch (NoExtensionException ex) {
            return false;
        }
    }

    public boolean hasAlbumThumbnail(String relativeAlbumPath, List<String> fileNames) {
        return index.hasAlbumThumbnail(ArtifactNames.relativeAlbumThumbnailPath(relativeAlbumPath, fileNames));
    }

    /**
     * Returns the thumbnail of an image or video, generating it on first request. A source
     * that failed permanently before fails fast with {@link PermanentlyFailedException}.
     */
    public Path generateThumbnail(String relativeMediaPath) throws MediaCacheException {
        String key = PathResolver.canonical(relativeMediaPath);
        Path source = mediaResolver.resolve(key);
        String relativeThumbnail = ArtifactNames.relativeThumbnailPath(key);
        Path target = cacheResolver.resolve(relativeThumbnail);
        MediaType type = MediaType.fromFileName(key)
                .orElseThrow(() -> new UnsupportedTypeException("Unsupported media type: " + key));

        return thumbnailCalls.execute(relativeThumbnail, () -> {
            if (Files.exists(target)) {
                return target;
            }
            Path marker = ArtifactNames.errorMarkerPath(target);
            checkMarker(marker, key);
            requireSource(source, key);

            LOGGER.info("Creating new thumbnail for {}", key);
            long start = System.nanoTime();
            try {
                if (type == MediaType.VIDEO) {
                    writeVideoThumbnail(source, target);
                } else {
                    writeImageThumbnail(source, target);
                }
            } catch (MediaCacheException ex) {
                memoize(marker, key, ex);
                throw ex;
            }
            index.putThumbnail(relativeThumbnail);
            LOGGER.info("Thumbnail done for {} (conversion time: {} ms)", key, elapsedMillis(start));
            return target;
        });
    }

    /**
     * Returns a preview of an image scaled to fit {@code previewMaxSide}. Images already
     * within that bound yield {@link PreviewResult#skippedTooSmall()} unless small images
     * are configured to get previews as well.
     */
    public PreviewResult generatePreview(String relativeMediaPath) throws MediaCacheException {
        String key = PathResolver.canonical(relativeMediaPath);
        if (!MediaType.isImage(key)) {
            throw new UnsupportedTypeException("Only images support previews: " + key);
        }
        Path source = mediaResolver.resolve(key);
        String relativePreview = ArtifactNames.relativePreviewPath(key);
        Path target = cacheResolver.resolve(relativePreview);

        return previewCalls.execute(relativePreview, () -> {
            if (Files.exists(target)) {
                return PreviewResult.of(target);
            }
            Path marker = ArtifactNames.errorMarkerPath(target);
            checkMarker(marker, key);
            requireSource(source, key);

            try {
                Dimension size = readSize(source);
                if (!previewSmallImages && size.width <= previewMaxSide && size.height <= previewMaxSide) {
                    LOGGER.trace("Image {} is {}x{}, no preview needed", key, size.width, size.height);
                    return PreviewResult.skippedTooSmall();
                }
                LOGGER.info("Creating new preview for {}", key);
                long start = System.nanoTime();
                BufferedImage image = decode(source);
                write(ImageOps.fit(image, previewMaxSide, previewMaxSide), target);
                index.putPreview(relativePreview);
                LOGGER.info("Preview done for {} (conversion time: {} ms)", key, elapsedMillis(start));
                return PreviewResult.of(target);
            } catch (MediaCacheException ex) {
                memoize(marker, key, ex);
                throw ex;
            }
        });
    }

    /**
     * Returns the collage for a folder, composing it when no collage for the same file list
     * exists yet.
     */
    public Path generateAlbumThumbnail(String relativeAlbumPath,
                                       List<String> fileNames,
                                       AlbumCollageGenerator collage) throws MediaCacheException {
        String key = PathResolver.canonical(relativeAlbumPath);
        mediaResolver.resolve(key);
        String relativeAlbum = ArtifactNames.relativeAlbumThumbnailPath(key, fileNames);
        Path target = cacheResolver.resolve(relativeAlbum);

        return albumCalls.execute(relativeAlbum, () -> {
            if (Files.exists(target)) {
                return target;
            }
            LOGGER.info("Creating new album thumbnail for {}", key.isEmpty() ? "/" : key);
            long start = System.nanoTime();
            write(collage.compose(key, fileNames), target);
            index.putAlbumThumbnail(relativeAlbum);
            LOGGER.info("Album thumbnail done for {} (conversion time: {} ms)", key, elapsedMillis(start));
            return target;
        });
    }

    /**
     * Deletes every entry of the cache directory matching {@code relativeDirectory} that
     * no longer corresponds to an entry of the media directory. Album collages are kept.
     *
     * @return number of removed cache entries
     */
    public int cleanupCache(String relativeDirectory, List<MediaEntry> entries) throws PathEscapeException {
        String key = PathResolver.canonical(relativeDirectory);
        Path directory = cacheResolver.resolve(key);
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        Set<String> expected = expectedNames(entries);
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                String name = child.getFileName().toString();
                if (expected.contains(name) || ArtifactNames.isAlbumThumbnailName(name)) {
                    continue;
                }
                if (ArtifactNames.isTransientName(name)) {
                    LOGGER.trace("Keeping {}, it may still be written", child);
                    continue;
                }
                try {
                    deleteRecursively(child);
                    index.removeUnder(PathResolver.join(key, name));
                    removed++;
                    LOGGER.debug("Removed stale cache entry {}", child);
                } catch (IOException ex) {
                    LOGGER.warn("Unable to remove stale cache entry {}", child, ex);
                }
            }
        } catch (IOException ex) {
            LOGGER.warn("Unable to list cache directory {}", directory, ex);
        }
        return removed;
    }

    /**
     * Deletes the thumbnail, preview and error markers of a media file.
     *
     * @return true if anything was deleted
     */
    public boolean removeArtifacts(String relativeMediaPath) throws PathEscapeException {
        String key = PathResolver.canonical(relativeMediaPath);
        String relativeThumbnail;
        String relativePreview;
        try {
            relativeThumbnail = ArtifactNames.relativeThumbnailPath(key);
            relativePreview = ArtifactNames.relativePreviewPath(key);
        } catch (NoExtensionException ex) {
            return false;
        }
        boolean removed = false;
        for (String relative : List.of(relativeThumbnail,
                ArtifactNames.errorMarkerPath(relativeThumbnail),
                relativePreview,
                ArtifactNames.errorMarkerPath(relativePreview))) {
            Path file = cacheResolver.resolve(relative);
            try {
                if (Files.deleteIfExists(file)) {
                    LOGGER.debug("Removed {}", file);
                    removed = true;
                }
            } catch (IOException ex) {
                LOGGER.warn("Unable to remove {}", file, ex);
            }
        }
        index.removeThumbnail(relativeThumbnail);
        index.removePreview(relativePreview);
        return removed;
    }

    /**
     * Deletes the error markers of a media file whose content changed, so the next request
     * generates again instead of failing fast.
     *
     * @return true if a marker was deleted
     */
    public boolean clearErrorMarkers(String relativeMediaPath) throws PathEscapeException {
        String key = PathResolver.canonical(relativeMediaPath);
        List<String> markers;
        try {
            markers = List.of(
                    ArtifactNames.errorMarkerPath(ArtifactNames.relativeThumbnailPath(key)),
                    ArtifactNames.errorMarkerPath(ArtifactNames.relativePreviewPath(key)));
        } catch (NoExtensionException ex) {
            return false;
        }
        boolean cleared = false;
        for (String relative : markers) {
            Path marker = cacheResolver.resolve(relative);
            try {
                cleared |= Files.deleteIfExists(marker);
            } catch (IOException ex) {
                LOGGER.warn("Unable to remove error marker {}", marker, ex);
            }
        }
        if (cleared) {
            LOGGER.info("Cleared previous failure of {}", key);
        }
        return cleared;
    }

    /**
     * Deletes the cache directory mirroring a removed media directory.
     */
    public boolean removeDirectory(String relativeDirectory) throws PathEscapeException {
        String key = PathResolver.canonical(relativeDirectory);
        if (key.isEmpty()) {
            return false;
        }
        Path directory = cacheResolver.resolve(key);
        index.removeUnder(key);
        if (!Files.exists(directory)) {
            return false;
        }
        try {
            deleteRecursively(directory);
            LOGGER.debug("Removed cache directory {}", directory);
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Unable to remove cache directory {}", directory, ex);
            return false;
        }
    }

    private Set<String> expectedNames(List<MediaEntry> entries) {
        Set<String> names = new HashSet<>();
        for (MediaEntry entry : entries) {
            if (entry.isFolder()) {
                names.add(entry.name());
                continue;
            }
            try {
                String thumbnail = ArtifactNames.relativeThumbnailPath(entry.name());
                String preview = ArtifactNames.relativePreviewPath(entry.name());
                names.add(thumbnail);
                names.add(ArtifactNames.errorMarkerPath(thumbnail));
                names.add(preview);
                names.add(ArtifactNames.errorMarkerPath(preview));
            } catch (NoExtensionException ex) {
                LOGGER.trace("No artifacts expected for {}", entry.name());
            }
        }
        return names;
    }

    private void writeImageThumbnail(Path source, Path target) throws MediaCacheException {
        BufferedImage image = decode(source);
        write(ImageOps.fit(image, THUMBNAIL_SIZE, THUMBNAIL_SIZE), target);
    }

    private void writeVideoThumbnail(Path source, Path target) throws MediaCacheException {
        Path screenshot = target.resolveSibling(target.getFileName() + ArtifactNames.VIDEO_FRAME_SUFFIX);
        createParent(target);
        frameExtractor.extractFrame(source, screenshot);
        try {
            BufferedImage frame = decodeRaw(screenshot);
            BufferedImage thumbnail = ImageOps.toRgb(ImageOps.fit(frame, THUMBNAIL_SIZE, THUMBNAIL_SIZE));
            ImageOps.overlay(thumbnail, videoBadge, VideoBadge.x(thumbnail.getWidth()), VideoBadge.MARGIN);
            write(thumbnail, target);
        } finally {
            try {
                Files.deleteIfExists(screenshot);
            } catch (IOException ex) {
                LOGGER.warn("Unable to remove video frame {}", screenshot, ex);
            }
        }
    }

    /**
     * Decodes and applies the EXIF orientation correction.
     */
    private BufferedImage decode(Path source) throws MediaCacheException {
        return orientation.autoOrient(source, decodeRaw(source));
    }

    private BufferedImage decodeRaw(Path source) throws MediaCacheException {
        try {
            return codec.read(source);
        } catch (IOException ex) {
            throw readFailure(source, ex);
        } catch (RuntimeException ex) {
            throw new DecodeException("Unable to decode " + source.getFileName() + ": " + ex, ex);
        }
    }

    private Dimension readSize(Path source) throws MediaCacheException {
        try {
            return codec.readSize(source);
        } catch (IOException ex) {
            throw readFailure(source, ex);
        } catch (RuntimeException ex) {
            throw new DecodeException("Unable to decode " + source.getFileName() + ": " + ex, ex);
        }
    }

    private static MediaCacheException readFailure(Path source, IOException ex) {
        if (ex instanceof NoSuchFileException) {
            return new NotFoundException("File not found: " + source.getFileName(), ex);
        }
        if (ex instanceof FileSystemException) {
            return new FileLockedException("File is not readable yet: " + source.getFileName(), ex);
        }
        return new DecodeException("Unable to decode " + source.getFileName() + ": " + ex.getMessage(), ex);
    }

    private void write(BufferedImage image, Path target) throws MediaCacheException {
        createParent(target);
        try {
            codec.writeJpeg(image, target);
        } catch (IOException ex) {
            throw new MediaCacheException("Unable to write " + target, ex);
        }
    }

    private static void createParent(Path target) throws MediaCacheException {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
        } catch (IOException ex) {
            throw new MediaCacheException("Unable to create directories for " + target, ex);
        }
    }

    private static void checkMarker(Path marker, String key) throws PermanentlyFailedException {
        if (!Files.exists(marker)) {
            return;
        }
        String reason;
        try {
            reason = Files.readString(marker, StandardCharsets.UTF_8).strip();
        } catch (IOException ex) {
            reason = "unknown";
        }
        LOGGER.trace("Skipping {}, previous attempt failed: {}", key, reason);
        throw new PermanentlyFailedException("Processing of " + key + " failed permanently: " + reason);
    }

    private static void requireSource(Path source, String key) throws NotFoundException {
        if (!Files.isRegularFile(source)) {
            throw new NotFoundException("File not found: " + key);
        }
    }

    private static void memoize(Path marker, String key, MediaCacheException failure) {
        if (!failure.isMemoizable()) {
            return;
        }
        try {
            Files.createDirectories(marker.toAbsolutePath().getParent());
            Files.writeString(marker, failure.getMessage(), StandardCharsets.UTF_8);
            LOGGER.warn("Processing of {} failed, will not retry: {}", key, failure.getMessage());
        } catch (IOException ex) {
            LOGGER.error("Unable to write error marker {}", marker, ex);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.deleteIfExists(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}

package com.example.mediacache;

import com.example.mediacache.cache.AlbumCollageGenerator;
import com.example.mediacache.cache.ArtifactCache;
import com.example.mediacache.cache.FfmpegFrameExtractor;
import com.example.mediacache.cache.PreviewResult;
import com.example.mediacache.cache.VideoFrameExtractor;
import com.example.mediacache.catalog.MediaCatalog;
import com.example.mediacache.catalog.MediaEntry;
import com.example.mediacache.catalog.MediaType;
import com.example.mediacache.image.EmbeddedThumbnails;
import com.example.mediacache.image.ExifReader;
import com.example.mediacache.image.ImageCodec;
import com.example.mediacache.image.ImageIoCodec;
import com.example.mediacache.image.MetadataExtractorExifReader;
import com.example.mediacache.image.OrientationResolver;
import com.example.mediacache.path.PathResolver;
import com.example.mediacache.precache.PrecacheReport;
import com.example.mediacache.precache.PrecacheScheduler;
import com.example.mediacache.precache.PrecacheStatistics;
import com.example.mediacache.watch.CacheSynchronizer;
import com.example.mediacache.watch.DirectoryWatcher;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Entry points used by the serving layer: listings, thumbnails, previews, album
 * collages and precache control. Also owns the background startup precache and the
 * directory watcher.
 */
public final class MediaService implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaService.class);

    private final MediaCacheConfig config;
    private final ImageCodec codec;
    private final MediaCatalog catalog;
    private final OrientationResolver orientation;
    private final EmbeddedThumbnails embeddedThumbnails;
    private final ArtifactCache cache;
    private final AlbumCollageGenerator collage;
    private final PrecacheScheduler precache;
    private final boolean thumbnailsEnabled;
    private final boolean previewsEnabled;
    private final DirectoryWatcher watcher;
    private final ExecutorService startupExecutor;
    private Future<?> startupPrecache;

    public MediaService(MediaCacheConfig config) {
        this(config,
                new ImageIoCodec(),
                new MetadataExtractorExifReader(new Tika()),
                new FfmpegFrameExtractor(config.ffmpegCommand(), config.videoFrameTimeout()));
    }

    public MediaService(MediaCacheConfig config,
                        ImageCodec codec,
                        ExifReader exifReader,
                        VideoFrameExtractor frameExtractor) {
        this.config = config;
        this.codec = codec;
        PathResolver mediaResolver = new PathResolver(config.mediaPath());
        PathResolver cacheResolver = new PathResolver(config.cachePath());
        this.catalog = new MediaCatalog(mediaResolver);
        this.orientation = new OrientationResolver(exifReader, config.autoRotate());
        this.embeddedThumbnails = new EmbeddedThumbnails(exifReader, codec);

        boolean cacheAvailable = createCacheRoot(config.cachePath());
        this.thumbnailsEnabled = config.enableThumbCache() && cacheAvailable;
        this.previewsEnabled = config.enablePreview() && cacheAvailable;

        this.cache = new ArtifactCache(
                cacheResolver,
                mediaResolver,
                codec,
                orientation,
                frameExtractor,
                config.previewMaxSide(),
                config.genPreviewForSmallImages());
        this.collage = new AlbumCollageGenerator(this::writeThumbnail, codec);
        this.precache = new PrecacheScheduler(
                catalog,
                cache,
                embeddedThumbnails,
                config.ignoreExifThumbs(),
                config.enableCacheCleanup());

        if (thumbnailsEnabled && config.genThumbsOnAdd() || previewsEnabled && config.genPreviewOnAdd()) {
            CacheSynchronizer synchronizer = new CacheSynchronizer(
                    cache,
                    thumbnailsEnabled && config.genThumbsOnAdd(),
                    previewsEnabled && config.genPreviewOnAdd());
            this.watcher = new DirectoryWatcher(mediaResolver, synchronizer, config.watcherSettleDelay());
        } else {
            this.watcher = null;
        }
        this.startupExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "media-precache");
            thread.setDaemon(true);
            return thread;
        });

        if (!frameExtractor.isAvailable()) {
            LOGGER.info("Video thumbnails not supported, {} not found", config.ffmpegCommand());
        }
        LOGGER.info("Media path: {}, cache path: {} (thumbnails: {}, previews: {})",
                config.mediaPath(), config.cachePath(), thumbnailsEnabled, previewsEnabled);
    }

    /**
     * Starts the startup precache in the background and the directory watcher, as configured.
     */
    public synchronized void start() throws IOException {
        boolean thumbnails = thumbnailsEnabled && config.genThumbsOnStartup();
        boolean previews = previewsEnabled && config.genPreviewOnStartup();
        if ((thumbnails || previews) && startupPrecache == null) {
            startupPrecache = startupExecutor.submit(() -> runStartupPrecache(thumbnails, previews));
        }
        if (watcher != null) {
            watcher.start();
        }
    }

    @Override
    public synchronized void close() {
        if (watcher != null) {
            watcher.stop();
        }
        startupExecutor.shutdownNow();
        try {
            startupExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    public List<MediaEntry> listDirectory(String relativePath) throws MediaCacheException {
        return catalog.list(relativePath);
    }

    /**
     * Writes the thumbnail of an image or video. The thumbnail embedded in a JPEG's EXIF
     * block is preferred unless EXIF thumbnails are ignored.
     */
    public void writeThumbnail(OutputStream out, String relativePath) throws MediaCacheException, IOException {
        MediaType type = MediaType.fromFileName(relativePath)
                .orElseThrow(() -> new UnsupportedTypeException("Not an image or video: " + relativePath));
        Path source = catalog.resolver().resolve(relativePath);
        if (!config.ignoreExifThumbs() && type == MediaType.IMAGE) {
            Optional<byte[]> embedded = embeddedThumbnails.oriented(source);
            if (embedded.isPresent()) {
                out.write(embedded.get());
                return;
            }
        }
        if (!thumbnailsEnabled) {
            throw new MediaCacheException("Thumbnail cache is disabled");
        }
        copy(cache.generateThumbnail(relativePath), out);
    }

    /**
     * Writes the preview of an image. Fails with {@link TooSmallForPreviewException} when the
     * image needs no preview; the caller should serve the original instead.
     */
    public void writePreview(OutputStream out, String relativePath) throws MediaCacheException, IOException {
        if (!previewsEnabled) {
            throw new MediaCacheException("Previews are disabled");
        }
        PreviewResult result = cache.generatePreview(relativePath);
        if (result.tooSmall()) {
            throw new TooSmallForPreviewException("Image is small enough to be its own preview: " + relativePath);
        }
        copy(result.path(), out);
    }

    /**
     * Writes the collage of up to nine thumbnails of the media files in a folder.
     */
    public void writeAlbumThumbnail(OutputStream out, String relativeFolder) throws MediaCacheException, IOException {
        if (!config.genAlbumThumbs() || !thumbnailsEnabled) {
            throw new MediaCacheException("Album thumbnails are disabled");
        }
        List<String> fileNames = catalog.list(relativeFolder).stream()
                .filter(entry -> !entry.isFolder())
                .map(MediaEntry::name)
                .toList();
        if (fileNames.isEmpty()) {
            throw new NotFoundException("No media in folder: " + relativeFolder);
        }
        copy(cache.generateAlbumThumbnail(relativeFolder, fileNames, collage), out);
    }

    public boolean isRotationNeeded(String relativePath) throws MediaCacheException {
        return orientation.needsRotation(catalog.resolver().resolve(relativePath));
    }

    /**
     * Writes the full image as JPEG with its EXIF orientation applied.
     */
    public void rotateAndWrite(OutputStream out, String relativePath) throws MediaCacheException, IOException {
        Path source = catalog.resolver().resolve(relativePath);
        BufferedImage image;
        try {
            image = codec.read(source);
        } catch (NoSuchFileException ex) {
            throw new NotFoundException("File not found: " + relativePath, ex);
        } catch (IIOException ex) {
            throw new DecodeException("Unable to decode " + relativePath + ": " + ex.getMessage(), ex);
        }
        codec.writeJpeg(orientation.autoOrient(source, image), out);
    }

    public boolean isPrecacheInProgress() {
        return precache.isInProgress();
    }

    public PrecacheStatistics sweep(String relativePath, boolean recursive, boolean thumbnails, boolean previews) {
        return precache.sweep(relativePath, recursive, thumbnails && thumbnailsEnabled, previews && previewsEnabled);
    }

    public boolean thumbnailsEnabled() {
        return thumbnailsEnabled;
    }

    public boolean previewsEnabled() {
        return previewsEnabled;
    }

    ArtifactCache cache() {
        return cache;
    }

    Optional<Future<?>> startupPrecache() {
        return Optional.ofNullable(startupPrecache);
    }

    private void runStartupPrecache(boolean thumbnails, boolean previews) {
        LOGGER.info("Pre-generating cache (thumbnails: {}, previews: {})", thumbnails, previews);
        Instant startedAt = Instant.now();
        PrecacheStatistics statistics = precache.sweep("", true, thumbnails, previews);
        Duration duration = Duration.between(startedAt, Instant.now());
        LOGGER.info("Generating cache took {} minutes and {} seconds", duration.toMinutes(), duration.toSecondsPart());
        logStatistics(statistics);
        config.statisticsReportFile().ifPresent(file -> {
            try {
                new StatisticsReportWriter(file).save(new PrecacheReport(startedAt, duration, statistics));
                LOGGER.info("Precache report written to {}", file);
            } catch (IOException ex) {
                LOGGER.warn("Unable to write precache report {}", file, ex);
            }
        });
    }

    private static void logStatistics(PrecacheStatistics statistics) {
        LOGGER.info("Number of folders: {}", statistics.folders());
        LOGGER.info("Number of images: {}", statistics.images());
        LOGGER.info("Number of videos: {}", statistics.videos());
        LOGGER.info("Number of images with embedded EXIF: {}", statistics.exif());
        LOGGER.info("Number of generated image thumbnails: {}", statistics.imageThumbnails());
        LOGGER.info("Number of generated video thumbnails: {}", statistics.videoThumbnails());
        LOGGER.info("Number of generated image previews: {}", statistics.imagePreviews());
        LOGGER.info("Number of failed folders: {}", statistics.failedFolders());
        LOGGER.info("Number of failed image thumbnails: {}", statistics.failedImageThumbnails());
        LOGGER.info("Number of failed video thumbnails: {}", statistics.failedVideoThumbnails());
        LOGGER.info("Number of failed image previews: {}", statistics.failedImagePreviews());
        LOGGER.info("Number of small images not requiring preview: {}", statistics.smallImages());
        LOGGER.info("Number of removed cache files: {}", statistics.removedCacheFiles());
    }

    private static void copy(Path file, OutputStream out) throws MediaCacheException, IOException {
        try {
            Files.copy(file, out);
        } catch (NoSuchFileException ex) {
            throw new NotFoundException("Cached file disappeared: " + file.getFileName(), ex);
        }
    }

    private static boolean createCacheRoot(Path cachePath) {
        try {
            Files.createDirectories(cachePath);
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Unable to create cache path {}, thumbnails and previews are disabled", cachePath, ex);
            return false;
        }
    }
}

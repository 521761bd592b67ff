package com.example.mediacache.cache;

import com.example.mediacache.DecodeException;
import com.example.mediacache.ExternalToolException;
import com.example.mediacache.NoExtensionException;
import com.example.mediacache.NotFoundException;
import com.example.mediacache.PathEscapeException;
import com.example.mediacache.PermanentlyFailedException;
import com.example.mediacache.TestMedia;
import com.example.mediacache.UnsupportedTypeException;
import com.example.mediacache.catalog.MediaCatalog;
import com.example.mediacache.catalog.MediaEntry;
import com.example.mediacache.image.ExifReader;
import com.example.mediacache.image.ImageIoCodec;
import com.example.mediacache.image.OrientationResolver;
import com.example.mediacache.path.PathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactCacheTest {
    private Path media;
    private Path cacheRoot;
    private CountingCodec codec;
    private StubFrameExtractor extractor;

    @BeforeEach
    void setUp() throws Exception {
        media = Files.createTempDirectory("artifact-media");
        cacheRoot = Files.createTempDirectory("artifact-cache");
        codec = new CountingCodec();
        extractor = new StubFrameExtractor();
    }

    private ArtifactCache newCache(int previewMaxSide, boolean previewSmallImages) {
        return new ArtifactCache(
                new PathResolver(cacheRoot),
                new PathResolver(media),
                codec,
                new OrientationResolver(ExifReader.none(), true),
                extractor,
                previewMaxSide,
                previewSmallImages);
    }

    @Test
    void thumbnailPathsAlwaysEndInThumbJpg() throws Exception {
        ArtifactCache cache = newCache(1280, false);

        assertEquals(cacheRoot.resolve("img.thumb.jpg").normalize(), cache.thumbnailPath("img.jpg"));
        assertEquals(cacheRoot.resolve("img.thumb.jpg").normalize(), cache.thumbnailPath("img.png"));
        assertEquals(cacheRoot.resolve("dir/img.preview.jpg").normalize(), cache.previewPath("dir/img.tiff"));
        assertThrows(NoExtensionException.class, () -> cache.thumbnailPath("noext"));
    }

    @Test
    void generatesThumbnailExactlyOnce() throws Exception {
        TestMedia.writePng(media.resolve("dir/wide.png"), 600, 300);
        ArtifactCache cache = newCache(1280, false);

        Path first = cache.generateThumbnail("dir/wide.png");
        Path second = cache.generateThumbnail("dir/wide.png");

        assertEquals(first, second);
        assertEquals(cacheRoot.resolve("dir/wide.thumb.jpg").normalize(), first);
        assertEquals(1, codec.fileReads());
        assertTrue(cache.hasThumbnail("dir/wide.png"));
        BufferedImage thumbnail = new ImageIoCodec().read(first);
        assertEquals(256, thumbnail.getWidth());
        assertEquals(128, thumbnail.getHeight());
    }

    @Test
    void smallImagesAreNotUpscaled() throws Exception {
        TestMedia.writePng(media.resolve("tiny.png"), 40, 30);
        ArtifactCache cache = newCache(1280, false);

        BufferedImage thumbnail = new ImageIoCodec().read(cache.generateThumbnail("tiny.png"));

        assertEquals(40, thumbnail.getWidth());
        assertEquals(30, thumbnail.getHeight());
    }

    @Test
    void concurrentRequestsShareOneGeneration() throws Exception {
        TestMedia.writePng(media.resolve("busy.png"), 800, 800);
        codec.slowDown(300);
        ArtifactCache cache = newCache(1280, false);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Path>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(() -> cache.generateThumbnail("busy.png"));
            }
            List<Path> results = new ArrayList<>();
            for (Future<Path> future : executor.invokeAll(calls)) {
                results.add(future.get());
            }
            assertTrue(results.stream().allMatch(results.get(0)::equals));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, codec.fileReads());
    }

    @Test
    void previewOfSmallImageIsSkippedUnlessConfigured() throws Exception {
        TestMedia.writePng(media.resolve("small.png"), 200, 100);

        PreviewResult skipped = newCache(1280, false).generatePreview("small.png");
        assertTrue(skipped.tooSmall());
        assertNull(skipped.path());
        assertFalse(Files.exists(cacheRoot.resolve("small.preview.jpg")));
        assertFalse(Files.exists(cacheRoot.resolve("small.preview.err.txt")));

        PreviewResult generated = newCache(1280, true).generatePreview("small.png");
        assertFalse(generated.tooSmall());
        BufferedImage preview = new ImageIoCodec().read(generated.path());
        assertTrue(preview.getWidth() <= 1280 && preview.getHeight() <= 1280);
        assertEquals(200, preview.getWidth());
    }

    @Test
    void previewFitsMaximumSide() throws Exception {
        TestMedia.writePng(media.resolve("large.png"), 1000, 500);
        ArtifactCache cache = newCache(400, false);

        PreviewResult result = cache.generatePreview("large.png");

        BufferedImage preview = new ImageIoCodec().read(result.path());
        assertEquals(400, preview.getWidth());
        assertEquals(200, preview.getHeight());
        assertTrue(cache.hasPreview("large.png"));
        assertEquals(result.path(), cache.generatePreview("large.png").path());
    }

    @Test
    void corruptImageFailureIsMemoized() throws Exception {
        TestMedia.writeCorrupt(media.resolve("broken.jpg"));
        ArtifactCache cache = newCache(1280, false);

        assertThrows(DecodeException.class, () -> cache.generateThumbnail("broken.jpg"));
        assertTrue(Files.exists(cacheRoot.resolve("broken.thumb.err.txt")));
        assertEquals(1, codec.fileReads());

        PermanentlyFailedException again = assertThrows(PermanentlyFailedException.class,
                () -> cache.generateThumbnail("broken.jpg"));
        assertTrue(again.getMessage().contains("broken.jpg"));
        assertEquals(1, codec.fileReads());

        assertThrows(DecodeException.class, () -> cache.generatePreview("broken.jpg"));
        assertTrue(Files.exists(cacheRoot.resolve("broken.preview.err.txt")));
        assertThrows(PermanentlyFailedException.class, () -> cache.generatePreview("broken.jpg"));
        assertEquals(1, codec.sizeReads());
    }

    @Test
    void missingSourceIsNotMemoized() throws Exception {
        ArtifactCache cache = newCache(1280, false);

        assertThrows(NotFoundException.class, () -> cache.generateThumbnail("later.png"));
        assertFalse(Files.exists(cacheRoot.resolve("later.thumb.err.txt")));

        TestMedia.writePng(media.resolve("later.png"), 20, 20);
        assertTrue(Files.exists(cache.generateThumbnail("later.png")));
    }

    @Test
    void rejectsUnsupportedRequests() throws Exception {
        Files.writeString(media.resolve("clip.mp4"), "video");
        Files.writeString(media.resolve("notes.txt"), "text");
        ArtifactCache cache = newCache(1280, false);

        assertThrows(UnsupportedTypeException.class, () -> cache.generatePreview("clip.mp4"));
        assertThrows(UnsupportedTypeException.class, () -> cache.generateThumbnail("notes.txt"));
        assertThrows(NoExtensionException.class, () -> cache.generateThumbnail("noext"));
        assertThrows(PathEscapeException.class, () -> cache.generateThumbnail("../outside.jpg"));
    }

    @Test
    void videoThumbnailCarriesBadge() throws Exception {
        Files.writeString(media.resolve("clip.mp4"), "video");
        ArtifactCache cache = newCache(1280, false);

        Path thumbnailPath = cache.generateThumbnail("clip.mp4");

        assertEquals(cacheRoot.resolve("clip.thumb.jpg").normalize(), thumbnailPath);
        assertFalse(Files.exists(cacheRoot.resolve("clip.thumb.jpg.sh.jpg")));
        BufferedImage thumbnail = new ImageIoCodec().read(thumbnailPath);
        assertEquals(256, thumbnail.getWidth());
        assertEquals(144, thumbnail.getHeight());
        Color background = new Color(thumbnail.getRGB(20, 100));
        Color badge = new Color(thumbnail.getRGB(256 - 90 - 11 + 45, 11 + 45));
        assertTrue(badge.getRed() > background.getRed() + 50);
    }

    @Test
    void failedVideoExtractionIsMemoized() throws Exception {
        Files.writeString(media.resolve("broken.mp4"), "garbage");
        ArtifactCache cache = newCache(1280, false);

        ExternalToolException failure = assertThrows(ExternalToolException.class,
                () -> cache.generateThumbnail("broken.mp4"));
        assertTrue(failure.getMessage().contains("Invalid data"));
        assertTrue(Files.readString(cacheRoot.resolve("broken.thumb.err.txt")).contains("Invalid data"));

        assertThrows(PermanentlyFailedException.class, () -> cache.generateThumbnail("broken.mp4"));
        assertEquals(1, extractor.calls());
    }

    @Test
    void cleanupRemovesOnlyOrphans() throws Exception {
        TestMedia.writePng(media.resolve("keep.png"), 10, 10);
        Files.createDirectories(media.resolve("album"));
        Files.createDirectories(cacheRoot.resolve("album"));
        Files.createDirectories(cacheRoot.resolve("gone/deeper"));
        Files.writeString(cacheRoot.resolve("gone/deeper/old.thumb.jpg"), "x");
        Files.writeString(cacheRoot.resolve("keep.thumb.jpg"), "x");
        Files.writeString(cacheRoot.resolve("keep.preview.err.txt"), "x");
        Files.writeString(cacheRoot.resolve("orphan.thumb.jpg"), "x");
        Files.writeString(cacheRoot.resolve("1234567890.jpg"), "x");
        ArtifactCache cache = newCache(1280, false);
        assertTrue(cache.hasThumbnail("orphan.jpg"));

        int removed = cache.cleanupCache("", new MediaCatalog(new PathResolver(media)).list(""));

        assertEquals(2, removed);
        assertTrue(Files.exists(cacheRoot.resolve("keep.thumb.jpg")));
        assertTrue(Files.exists(cacheRoot.resolve("keep.preview.err.txt")));
        assertTrue(Files.exists(cacheRoot.resolve("album")));
        assertTrue(Files.exists(cacheRoot.resolve("1234567890.jpg")));
        assertFalse(Files.exists(cacheRoot.resolve("orphan.thumb.jpg")));
        assertFalse(Files.exists(cacheRoot.resolve("gone")));
        assertFalse(cache.hasThumbnail("orphan.jpg"));
        assertEquals(0, cache.cleanupCache("missing", List.of()));
    }

    @Test
    void cleanupKeepsFilesOfGenerationsInProgress() throws Exception {
        Files.writeString(cacheRoot.resolve(".photo.preview.jpg81723.tmp"), "partial");
        Files.writeString(cacheRoot.resolve("clip.thumb.jpg.sh.jpg"), "frame");
        Files.writeString(cacheRoot.resolve("stale.thumb.jpg"), "x");
        ArtifactCache cache = newCache(1280, false);

        int removed = cache.cleanupCache("", List.of());

        assertEquals(1, removed);
        assertTrue(Files.exists(cacheRoot.resolve(".photo.preview.jpg81723.tmp")));
        assertTrue(Files.exists(cacheRoot.resolve("clip.thumb.jpg.sh.jpg")));
        assertFalse(Files.exists(cacheRoot.resolve("stale.thumb.jpg")));
    }

    @Test
    void cleanupDuringVideoExtractionKeepsTheFrame() throws Exception {
        Files.writeString(media.resolve("clip.mp4"), "video");
        AtomicReference<ArtifactCache> cacheRef = new AtomicReference<>();
        AtomicInteger removedDuringExtraction = new AtomicInteger();
        VideoFrameExtractor cleaningExtractor = new VideoFrameExtractor() {
            @Override
            public void extractFrame(Path video, Path output) throws ExternalToolException {
                extractor.extractFrame(video, output);
                try {
                    removedDuringExtraction.set(cacheRef.get().cleanupCache("", List.of()));
                } catch (PathEscapeException ex) {
                    throw new ExternalToolException("cleanup failed", ex);
                }
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
        ArtifactCache cache = new ArtifactCache(new PathResolver(cacheRoot), new PathResolver(media), codec,
                new OrientationResolver(ExifReader.none(), true), cleaningExtractor, 1280, false);
        cacheRef.set(cache);

        Path thumbnail = cache.generateThumbnail("clip.mp4");

        assertEquals(0, removedDuringExtraction.get());
        assertTrue(Files.exists(thumbnail));
        assertFalse(Files.exists(cacheRoot.resolve("clip.thumb.jpg.sh.jpg")));
    }

    @Test
    void previewSurvivesConcurrentCleanup() throws Exception {
        TestMedia.writePng(media.resolve("huge.png"), 3000, 3000);
        ArtifactCache cache = newCache(2900, false);
        List<MediaEntry> entries = new MediaCatalog(new PathResolver(media)).list("");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<PreviewResult> preview = executor.submit(() -> cache.generatePreview("huge.png"));
            int removed = 0;
            while (!preview.isDone()) {
                removed += cache.cleanupCache("", entries);
            }

            PreviewResult result = preview.get(60, TimeUnit.SECONDS);
            assertEquals(0, removed);
            assertFalse(result.tooSmall());
            assertTrue(Files.exists(result.path()));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void clearedMarkerAllowsAnotherAttempt() throws Exception {
        TestMedia.writeCorrupt(media.resolve("late.png"));
        ArtifactCache cache = newCache(1280, false);
        assertThrows(DecodeException.class, () -> cache.generateThumbnail("late.png"));
        assertThrows(PermanentlyFailedException.class, () -> cache.generateThumbnail("late.png"));
        Files.delete(media.resolve("late.png"));
        TestMedia.writePng(media.resolve("late.png"), 40, 40);

        assertTrue(cache.clearErrorMarkers("late.png"));

        assertFalse(Files.exists(cacheRoot.resolve("late.thumb.err.txt")));
        assertTrue(Files.exists(cache.generateThumbnail("late.png")));
        assertFalse(cache.clearErrorMarkers("late.png"));
        assertFalse(cache.clearErrorMarkers("noext"));
    }

    @Test
    void removingMediaRemovesArtifactsAndMarkers() throws Exception {
        TestMedia.writePng(media.resolve("dir/photo.png"), 50, 50);
        TestMedia.writeCorrupt(media.resolve("dir/bad.png"));
        ArtifactCache cache = newCache(10, false);
        cache.generateThumbnail("dir/photo.png");
        cache.generatePreview("dir/photo.png");
        assertThrows(DecodeException.class, () -> cache.generateThumbnail("dir/bad.png"));

        assertTrue(cache.removeArtifacts("dir/photo.png"));
        assertTrue(cache.removeArtifacts("dir/bad.png"));
        assertFalse(cache.removeArtifacts("dir/photo.png"));

        assertFalse(Files.exists(cacheRoot.resolve("dir/photo.thumb.jpg")));
        assertFalse(Files.exists(cacheRoot.resolve("dir/photo.preview.jpg")));
        assertFalse(Files.exists(cacheRoot.resolve("dir/bad.thumb.err.txt")));
        assertFalse(cache.hasThumbnail("dir/photo.png"));
        assertFalse(cache.hasPreview("dir/photo.png"));

        assertTrue(cache.removeDirectory("dir"));
        assertFalse(Files.exists(cacheRoot.resolve("dir")));
        assertFalse(cache.removeDirectory(""));
    }

    @Test
    void indexIsRebuiltFromDisk() throws Exception {
        TestMedia.writePng(media.resolve("a/b.png"), 2000, 100);
        ArtifactCache first = newCache(1280, false);
        first.generateThumbnail("a/b.png");
        first.generatePreview("a/b.png");
        Files.writeString(cacheRoot.resolve("a/42.jpg"), "x");

        ArtifactCache second = newCache(1280, false);

        assertTrue(second.hasThumbnail("a/b.png"));
        assertTrue(second.hasPreview("a/b.png"));
        assertFalse(second.hasThumbnail("a/c.png"));
        assertFalse(second.hasThumbnail("noext"));
    }
}

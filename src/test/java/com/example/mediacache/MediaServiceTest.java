package com.example.mediacache;

import com.example.mediacache.cache.StubFrameExtractor;
import com.example.mediacache.image.ImageIoCodec;
import com.example.mediacache.image.MetadataExtractorExifReader;
import com.example.mediacache.precache.PrecacheReport;
import com.example.mediacache.precache.PrecacheStatistics;
import org.apache.tika.Tika;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaServiceTest {
    private Path dir;
    private Path media;
    private Path cacheRoot;
    private MediaService service;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("service");
        media = Files.createDirectories(dir.resolve("media"));
        cacheRoot = dir.resolve("cache");
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private MediaService open(String extraJson) throws IOException {
        String json = "{"
                + "\"mediaPath\": \"" + TestMedia.jsonPath(media) + "\","
                + "\"cachePath\": \"" + TestMedia.jsonPath(cacheRoot) + "\","
                + "\"watcherSettleMillis\": 50"
                + (extraJson.isEmpty() ? "" : "," + extraJson)
                + "}";
        MediaCacheConfig config = TestMedia.config(dir, json);
        service = new MediaService(config, new ImageIoCodec(), new MetadataExtractorExifReader(new Tika()),
                new StubFrameExtractor());
        return service;
    }

    @Test
    void servesEmbeddedExifThumbnailWithoutCaching() throws Exception {
        byte[] embedded = TestMedia.jpegBytes(TestMedia.solid(40, 30, Color.ORANGE));
        TestMedia.writeJpegWithExif(media.resolve("photo.jpg"), TestMedia.solid(400, 300, Color.BLUE), null, embedded);
        open("");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        service.writeThumbnail(out, "photo.jpg");

        assertArrayEquals(embedded, out.toByteArray());
        assertFalse(Files.exists(cacheRoot.resolve("photo.thumb.jpg")));
    }

    @Test
    void generatesThumbnailWhenExifThumbnailsAreIgnored() throws Exception {
        byte[] embedded = TestMedia.jpegBytes(TestMedia.solid(40, 30, Color.ORANGE));
        TestMedia.writeJpegWithExif(media.resolve("photo.jpg"), TestMedia.solid(400, 300, Color.BLUE), null, embedded);
        open("\"ignoreExifThumbs\": true");

        BufferedImage thumbnail = decode(out -> service.writeThumbnail(out, "photo.jpg"));

        assertTrue(Files.exists(cacheRoot.resolve("photo.thumb.jpg")));
        assertTrue(Math.max(thumbnail.getWidth(), thumbnail.getHeight()) <= 256);
        assertTrue(TestMedia.near(thumbnail, thumbnail.getWidth() / 2, thumbnail.getHeight() / 2, Color.BLUE, 40));
    }

    @Test
    void thumbnailOfVideoComesFromFrameExtractor() throws Exception {
        Files.writeString(media.resolve("clip.mp4"), "not really a video");
        open("");

        BufferedImage thumbnail = decode(out -> service.writeThumbnail(out, "clip.mp4"));

        assertEquals(256, thumbnail.getWidth());
        assertTrue(Files.exists(cacheRoot.resolve("clip.thumb.jpg")));
    }

    @Test
    void rejectsUnsupportedFiles() throws Exception {
        Files.writeString(media.resolve("notes.txt"), "hello");
        open("");

        assertThrows(UnsupportedTypeException.class,
                () -> service.writeThumbnail(new ByteArrayOutputStream(), "notes.txt"));
        assertThrows(PathEscapeException.class,
                () -> service.writeThumbnail(new ByteArrayOutputStream(), "../outside.png"));
    }

    @Test
    void disabledCacheStillServesEmbeddedThumbnails() throws Exception {
        byte[] embedded = TestMedia.jpegBytes(TestMedia.solid(40, 30, Color.ORANGE));
        TestMedia.writeJpegWithExif(media.resolve("photo.jpg"), TestMedia.solid(400, 300, Color.BLUE), null, embedded);
        TestMedia.writePng(media.resolve("plain.png"), 300, 300);
        open("\"enableThumbCache\": false");

        assertFalse(service.thumbnailsEnabled());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        service.writeThumbnail(out, "photo.jpg");
        assertArrayEquals(embedded, out.toByteArray());
        assertThrows(MediaCacheException.class,
                () -> service.writeThumbnail(new ByteArrayOutputStream(), "plain.png"));
    }

    @Test
    void previewsAreBoundedAndSmallImagesAreRefused() throws Exception {
        TestMedia.writePng(media.resolve("big.png"), 2000, 1000);
        TestMedia.writePng(media.resolve("small.png"), 300, 200);
        open("\"enablePreview\": true");

        BufferedImage preview = decode(out -> service.writePreview(out, "big.png"));

        assertEquals(1280, preview.getWidth());
        assertEquals(640, preview.getHeight());
        assertThrows(TooSmallForPreviewException.class,
                () -> service.writePreview(new ByteArrayOutputStream(), "small.png"));
        assertFalse(Files.exists(cacheRoot.resolve("small.preview.jpg")));
    }

    @Test
    void previewsRequireBeingEnabled() throws Exception {
        TestMedia.writePng(media.resolve("big.png"), 2000, 1000);
        open("");

        assertThrows(MediaCacheException.class, () -> service.writePreview(new ByteArrayOutputStream(), "big.png"));
    }

    @Test
    void albumThumbnailIsACollageOfTheFolder() throws Exception {
        Files.createDirectories(media.resolve("trip/empty"));
        TestMedia.write(media.resolve("trip/a.png"), TestMedia.solid(100, 100, Color.RED), "png");
        TestMedia.write(media.resolve("trip/b.png"), TestMedia.solid(100, 100, Color.GREEN), "png");
        open("\"genAlbumThumbs\": true");

        BufferedImage album = decode(out -> service.writeAlbumThumbnail(out, "trip"));

        assertEquals(256, album.getWidth());
        assertEquals(256, album.getHeight());
        assertTrue(TestMedia.near(album, 64, 64, Color.RED, 40));
        assertTrue(TestMedia.near(album, 192, 64, Color.GREEN, 40));
        assertTrue(TestMedia.near(album, 128, 200, Color.BLACK, 10));
        assertThrows(NotFoundException.class,
                () -> service.writeAlbumThumbnail(new ByteArrayOutputStream(), "trip/empty"));
    }

    @Test
    void albumThumbnailsRequireBeingEnabled() throws Exception {
        TestMedia.writePng(media.resolve("a.png"), 100, 100);
        open("");

        assertThrows(MediaCacheException.class,
                () -> service.writeAlbumThumbnail(new ByteArrayOutputStream(), ""));
    }

    @Test
    void rotatesByExifOrientation() throws Exception {
        TestMedia.writeJpegWithExif(media.resolve("turned.jpg"), TestMedia.solid(40, 20, Color.GRAY), 6, null);
        TestMedia.writeJpegWithExif(media.resolve("upright.jpg"), TestMedia.solid(40, 20, Color.GRAY), 1, null);
        open("");

        assertTrue(service.isRotationNeeded("turned.jpg"));
        assertFalse(service.isRotationNeeded("upright.jpg"));
        BufferedImage rotated = decode(out -> service.rotateAndWrite(out, "turned.jpg"));
        assertEquals(20, rotated.getWidth());
        assertEquals(40, rotated.getHeight());
        assertThrows(NotFoundException.class,
                () -> service.rotateAndWrite(new ByteArrayOutputStream(), "missing.jpg"));
    }

    @Test
    void rotationIsNotReportedWhenAutoRotateIsOff() throws Exception {
        TestMedia.writeJpegWithExif(media.resolve("turned.jpg"), TestMedia.solid(40, 20, Color.GRAY), 6, null);
        open("\"autoRotate\": false");

        assertFalse(service.isRotationNeeded("turned.jpg"));
    }

    @Test
    void listsFolderContents() throws Exception {
        Files.createDirectories(media.resolve("b-folder"));
        TestMedia.writePng(media.resolve("a.png"), 10, 10);
        Files.writeString(media.resolve("readme.txt"), "x");
        open("");

        assertEquals(2, service.listDirectory("").size());
        assertThrows(NotFoundException.class, () -> service.listDirectory("nowhere"));
    }

    @Test
    void startupPrecacheWritesReport() throws Exception {
        TestMedia.writePng(media.resolve("a.png"), 300, 200);
        TestMedia.writePng(media.resolve("sub/b.png"), 300, 200);
        Files.writeString(media.resolve("clip.mp4"), "frames");
        Path report = dir.resolve("reports/precache.json");
        open("\"genThumbsOnStartup\": true, \"genThumbsOnAdd\": false,"
                + "\"statisticsReportFile\": \"" + TestMedia.jsonPath(report) + "\"");

        service.start();
        service.startupPrecache().orElseThrow().get(30, TimeUnit.SECONDS);

        assertFalse(service.isPrecacheInProgress());
        assertTrue(Files.exists(cacheRoot.resolve("a.thumb.jpg")));
        assertTrue(Files.exists(cacheRoot.resolve("sub/b.thumb.jpg")));
        PrecacheReport loaded = new StatisticsReportWriter(report).load().orElseThrow();
        PrecacheStatistics statistics = loaded.statistics();
        assertEquals(1, statistics.folders());
        assertEquals(2, statistics.images());
        assertEquals(1, statistics.videos());
        assertEquals(2, statistics.imageThumbnails());
        assertEquals(1, statistics.videoThumbnails());
        assertEquals(0, statistics.imagePreviews());
    }

    @Test
    void noStartupPrecacheUnlessConfigured() throws Exception {
        open("\"genThumbsOnAdd\": false");

        service.start();

        assertTrue(service.startupPrecache().isEmpty());
    }

    @Test
    void sweepSkipsDisabledArtifacts() throws Exception {
        TestMedia.writePng(media.resolve("big.png"), 2000, 1000);
        open("");

        PrecacheStatistics statistics = service.sweep("", true, true, true);

        assertEquals(1, statistics.imageThumbnails());
        assertEquals(0, statistics.imagePreviews());
        assertFalse(Files.exists(cacheRoot.resolve("big.preview.jpg")));
    }

    private interface Writer {
        void write(ByteArrayOutputStream out) throws Exception;
    }

    private static BufferedImage decode(Writer writer) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(out);
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(out.toByteArray()));
        assertTrue(image != null, "output is not an image");
        return image;
    }
}

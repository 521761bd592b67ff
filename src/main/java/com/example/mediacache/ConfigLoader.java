package com.example.mediacache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_PREVIEW_MAX_SIDE = 1280;
    private static final int DEFAULT_VIDEO_FRAME_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_WATCHER_SETTLE_MILLIS = 500;
    private static final String DEFAULT_FFMPEG_COMMAND = "ffmpeg";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MediaCacheConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.mediaPath == null || raw.mediaPath.isBlank()) {
            throw new IllegalArgumentException("Config must include mediaPath.");
        }
        Path mediaPath = Path.of(raw.mediaPath);
        Path cachePath = Path.of(optionalString(raw.cachePath,
                Path.of(System.getProperty("java.io.tmpdir"), "mediacache").toString()));
        if (mediaPath.toAbsolutePath().normalize().equals(cachePath.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("cachePath must differ from mediaPath.");
        }

        int previewMaxSide = raw.previewMaxSide != null && raw.previewMaxSide > 0
                ? raw.previewMaxSide
                : DEFAULT_PREVIEW_MAX_SIDE;
        int videoFrameTimeout = raw.videoFrameTimeoutSeconds != null && raw.videoFrameTimeoutSeconds > 0
                ? raw.videoFrameTimeoutSeconds
                : DEFAULT_VIDEO_FRAME_TIMEOUT_SECONDS;
        int watcherSettle = raw.watcherSettleMillis != null && raw.watcherSettleMillis >= 0
                ? raw.watcherSettleMillis
                : DEFAULT_WATCHER_SETTLE_MILLIS;
        Optional<Path> reportFile = Optional.ofNullable(raw.statisticsReportFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        return new MediaCacheConfig(
                mediaPath,
                cachePath,
                flag(raw.enableThumbCache, true),
                flag(raw.ignoreExifThumbs, false),
                flag(raw.genThumbsOnStartup, false),
                flag(raw.genThumbsOnAdd, true),
                flag(raw.autoRotate, true),
                flag(raw.enablePreview, false),
                previewMaxSide,
                flag(raw.genPreviewForSmallImages, false),
                flag(raw.genPreviewOnStartup, false),
                flag(raw.genPreviewOnAdd, true),
                flag(raw.enableCacheCleanup, false),
                flag(raw.genAlbumThumbs, false),
                optionalString(raw.ffmpegCommand, DEFAULT_FFMPEG_COMMAND),
                Duration.ofSeconds(videoFrameTimeout),
                Duration.ofMillis(watcherSettle),
                reportFile
        );
    }

    private boolean flag(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String mediaPath;
        public String cachePath;
        public Boolean enableThumbCache;
        public Boolean ignoreExifThumbs;
        public Boolean genThumbsOnStartup;
        public Boolean genThumbsOnAdd;
        public Boolean autoRotate;
        public Boolean enablePreview;
        public Integer previewMaxSide;
        public Boolean genPreviewForSmallImages;
        public Boolean genPreviewOnStartup;
        public Boolean genPreviewOnAdd;
        public Boolean enableCacheCleanup;
        public Boolean genAlbumThumbs;
        public String ffmpegCommand;
        public Integer videoFrameTimeoutSeconds;
        public Integer watcherSettleMillis;
        public String statisticsReportFile;
    }
}

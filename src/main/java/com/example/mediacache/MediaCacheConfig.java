package com.example.mediacache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable runtime settings for the media cache.
 */
public record MediaCacheConfig(
        Path mediaPath,
        Path cachePath,
        boolean enableThumbCache,
        boolean ignoreExifThumbs,
        boolean genThumbsOnStartup,
        boolean genThumbsOnAdd,
        boolean autoRotate,
        boolean enablePreview,
        int previewMaxSide,
        boolean genPreviewForSmallImages,
        boolean genPreviewOnStartup,
        boolean genPreviewOnAdd,
        boolean enableCacheCleanup,
        boolean genAlbumThumbs,
        String ffmpegCommand,
        Duration videoFrameTimeout,
        Duration watcherSettleDelay,
        Optional<Path> statisticsReportFile
) {
}

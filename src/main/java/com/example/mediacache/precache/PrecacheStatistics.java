package com.example.mediacache.precache;

/**
 * Immutable totals of a precache sweep, aggregated over every visited directory.
 */
public record PrecacheStatistics(
        long folders,
        long images,
        long videos,
        long exif,
        long imageThumbnails,
        long videoThumbnails,
        long imagePreviews,
        long failedFolders,
        long failedImageThumbnails,
        long failedVideoThumbnails,
        long failedImagePreviews,
        long smallImages,
        long removedCacheFiles
) {
    public static PrecacheStatistics from(PrecacheCounters counters) {
        return new PrecacheStatistics(
                counters.folders(),
                counters.images(),
                counters.videos(),
                counters.exif(),
                counters.imageThumbnails(),
                counters.videoThumbnails(),
                counters.imagePreviews(),
                counters.failedFolders(),
                counters.failedImageThumbnails(),
                counters.failedVideoThumbnails(),
                counters.failedImagePreviews(),
                counters.smallImages(),
                counters.removedCacheFiles()
        );
    }
}

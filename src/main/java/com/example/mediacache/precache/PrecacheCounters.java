package com.example.mediacache.precache;

import java.util.concurrent.atomic.AtomicLong;

public final class PrecacheCounters {
    private final AtomicLong folders = new AtomicLong();
    private final AtomicLong images = new AtomicLong();
    private final AtomicLong videos = new AtomicLong();
    private final AtomicLong exif = new AtomicLong();
    private final AtomicLong imageThumbnails = new AtomicLong();
    private final AtomicLong videoThumbnails = new AtomicLong();
    private final AtomicLong imagePreviews = new AtomicLong();
    private final AtomicLong failedFolders = new AtomicLong();
    private final AtomicLong failedImageThumbnails = new AtomicLong();
    private final AtomicLong failedVideoThumbnails = new AtomicLong();
    private final AtomicLong failedImagePreviews = new AtomicLong();
    private final AtomicLong smallImages = new AtomicLong();
    private final AtomicLong removedCacheFiles = new AtomicLong();

    void addFolder() {
        folders.incrementAndGet();
    }

    void addImage() {
        images.incrementAndGet();
    }

    void addVideo() {
        videos.incrementAndGet();
    }

    void addExif() {
        exif.incrementAndGet();
    }

    void addThumbnail(boolean video) {
        (video ? videoThumbnails : imageThumbnails).incrementAndGet();
    }

    void addFailedThumbnail(boolean video) {
        (video ? failedVideoThumbnails : failedImageThumbnails).incrementAndGet();
    }

    void addPreview() {
        imagePreviews.incrementAndGet();
    }

    void addFailedPreview() {
        failedImagePreviews.incrementAndGet();
    }

    void addSmallImage() {
        smallImages.incrementAndGet();
    }

    void addFailedFolder() {
        failedFolders.incrementAndGet();
    }

    void addRemovedCacheFiles(long count) {
        removedCacheFiles.addAndGet(count);
    }

    /**
     * Folds the totals of a finished sub-directory sweep into this directory's totals.
     */
    void addAll(PrecacheStatistics child) {
        folders.addAndGet(child.folders());
        images.addAndGet(child.images());
        videos.addAndGet(child.videos());
        exif.addAndGet(child.exif());
        imageThumbnails.addAndGet(child.imageThumbnails());
        videoThumbnails.addAndGet(child.videoThumbnails());
        imagePreviews.addAndGet(child.imagePreviews());
        failedFolders.addAndGet(child.failedFolders());
        failedImageThumbnails.addAndGet(child.failedImageThumbnails());
        failedVideoThumbnails.addAndGet(child.failedVideoThumbnails());
        failedImagePreviews.addAndGet(child.failedImagePreviews());
        smallImages.addAndGet(child.smallImages());
        removedCacheFiles.addAndGet(child.removedCacheFiles());
    }

    public long folders() {
        return folders.get();
    }

    public long images() {
        return images.get();
    }

    public long videos() {
        return videos.get();
    }

    public long exif() {
        return exif.get();
    }

    public long imageThumbnails() {
        return imageThumbnails.get();
    }

    public long videoThumbnails() {
        return videoThumbnails.get();
    }

    public long imagePreviews() {
        return imagePreviews.get();
    }

    public long failedFolders() {
        return failedFolders.get();
    }

    public long failedImageThumbnails() {
        return failedImageThumbnails.get();
    }

    public long failedVideoThumbnails() {
        return failedVideoThumbnails.get();
    }

    public long failedImagePreviews() {
        return failedImagePreviews.get();
    }

    public long smallImages() {
        return smallImages.get();
    }

    public long removedCacheFiles() {
        return removedCacheFiles.get();
    }
}

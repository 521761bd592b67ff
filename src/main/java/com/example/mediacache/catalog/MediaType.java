package com.example.mediacache.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum MediaType {
    FOLDER("folder"),
    IMAGE("image"),
    VIDEO("video");

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".tif", ".tiff", ".gif");
    private static final Set<String> VIDEO_EXTENSIONS = Set.of(".avi", ".mov", ".vid", ".mkv", ".mp4");
    private static final Set<String> JPEG_EXTENSIONS = Set.of(".jpg", ".jpeg");

    private final String label;

    MediaType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Classifies a file name (optionally with leading directories) by extension.
     * Folders cannot be detected from a name and are never returned.
     */
    public static Optional<MediaType> fromFileName(String name) {
        String extension = extension(name);
        if (IMAGE_EXTENSIONS.contains(extension)) {
            return Optional.of(IMAGE);
        }
        if (VIDEO_EXTENSIONS.contains(extension)) {
            return Optional.of(VIDEO);
        }
        return Optional.empty();
    }

    public static boolean isImage(String name) {
        return IMAGE_EXTENSIONS.contains(extension(name));
    }

    public static boolean isVideo(String name) {
        return VIDEO_EXTENSIONS.contains(extension(name));
    }

    public static boolean isJpeg(String name) {
        return JPEG_EXTENSIONS.contains(extension(name));
    }

    /**
     * Returns the lower-cased extension of the last path element including the dot,
     * or an empty string if there is none.
     */
    public static String extension(String name) {
        String fileName = name.substring(name.replace('\\', '/').lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}

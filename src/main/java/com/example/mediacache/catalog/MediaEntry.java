package com.example.mediacache.catalog;

/**
 * One listed item of a media directory. {@code path} is relative to the media root
 * and always uses forward slashes.
 */
public record MediaEntry(
        MediaType type,
        String name,
        String path
) {
    public boolean isFolder() {
        return type == MediaType.FOLDER;
    }
}

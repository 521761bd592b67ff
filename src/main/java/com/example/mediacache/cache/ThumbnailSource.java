package com.example.mediacache.cache;

import com.example.mediacache.MediaCacheException;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes the JPEG thumbnail of a media file, identified by its relative path.
 */
@FunctionalInterface
public interface ThumbnailSource {
    void writeThumbnail(OutputStream out, String relativeMediaPath) throws MediaCacheException, IOException;
}

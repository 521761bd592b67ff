package com.example.mediacache.cache;

import com.example.mediacache.ExternalToolException;

import java.nio.file.Path;

/**
 * Extracts a single still frame from a video into an image file.
 */
public interface VideoFrameExtractor {
    void extractFrame(Path video, Path output) throws ExternalToolException;

    boolean isAvailable();
}

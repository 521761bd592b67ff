package com.example.mediacache.image;

import java.nio.file.Path;
import java.util.Optional;

@FunctionalInterface
public interface ExifReader {
    /**
     * Returns the EXIF data of a JPEG file, or empty for any other format, for files
     * without EXIF and for unreadable files.
     */
    Optional<ExifData> read(Path file);

    static ExifReader none() {
        return file -> Optional.empty();
    }
}

package com.example.mediacache.image;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * The parts of a JPEG's EXIF block the cache cares about. Either field may be null.
 */
public record ExifData(
        Integer orientation,
        byte[] thumbnail
) {
    public OptionalInt orientationCode() {
        return orientation == null ? OptionalInt.empty() : OptionalInt.of(orientation);
    }

    public Optional<byte[]> embeddedThumbnail() {
        return thumbnail == null || thumbnail.length == 0 ? Optional.empty() : Optional.of(thumbnail);
    }
}

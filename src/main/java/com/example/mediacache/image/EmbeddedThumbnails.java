package com.example.mediacache.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Access to the small JPEG stored inside a JPEG file's EXIF block.
 */
public final class EmbeddedThumbnails {
    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddedThumbnails.class);

    private final ExifReader exifReader;
    private final ImageCodec codec;

    public EmbeddedThumbnails(ExifReader exifReader, ImageCodec codec) {
        this.exifReader = exifReader;
        this.codec = codec;
    }

    public boolean has(Path file) {
        return exifReader.read(file).flatMap(ExifData::embeddedThumbnail).isPresent();
    }

    /**
     * Returns the embedded thumbnail, re-encoded with the orientation correction applied
     * when the file's orientation code is 2..8. A thumbnail that cannot be decoded for
     * rotation is returned as stored.
     */
    public Optional<byte[]> oriented(Path file) {
        Optional<ExifData> exif = exifReader.read(file);
        Optional<byte[]> stored = exif.flatMap(ExifData::embeddedThumbnail);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Optional<Orientation> orientation = exif.get().orientationCode().isPresent()
                ? Orientation.fromCode(exif.get().orientationCode().getAsInt())
                : Optional.empty();
        if (orientation.isEmpty() || !orientation.get().needsCorrection()) {
            return stored;
        }
        try {
            BufferedImage image = codec.read(new ByteArrayInputStream(stored.get()));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            codec.writeJpeg(orientation.get().apply(image), out);
            return Optional.of(out.toByteArray());
        } catch (IOException ex) {
            LOGGER.warn("Unable to decode EXIF thumbnail for {}", file, ex);
            return stored;
        }
    }
}

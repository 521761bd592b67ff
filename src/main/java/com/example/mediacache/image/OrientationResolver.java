package com.example.mediacache.image;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decides whether a JPEG needs geometric correction before it is shown, based on its
 * EXIF orientation tag. Non-JPEG files never need correction.
 */
public final class OrientationResolver {
    private final ExifReader exifReader;
    private final boolean autoRotate;

    public OrientationResolver(ExifReader exifReader, boolean autoRotate) {
        this.exifReader = exifReader;
        this.autoRotate = autoRotate;
    }

    public OptionalInt orientationCode(Path image) {
        return exifReader.read(image)
                .map(ExifData::orientationCode)
                .orElse(OptionalInt.empty());
    }

    public Optional<Orientation> orientation(Path image) {
        OptionalInt code = orientationCode(image);
        return code.isPresent() ? Orientation.fromCode(code.getAsInt()) : Optional.empty();
    }

    /**
     * True if the image has an orientation code 2..8 and serving with auto-rotation is on.
     */
    public boolean needsRotation(Path image) {
        return autoRotate && orientation(image).map(Orientation::needsCorrection).orElse(false);
    }

    /**
     * Applies the correction for {@code source}'s orientation to an already decoded image.
     * Used by every generation path, independently of the serving auto-rotate switch.
     */
    public BufferedImage autoOrient(Path source, BufferedImage decoded) {
        return orientation(source).map(orientation -> orientation.apply(decoded)).orElse(decoded);
    }

    public static BufferedImage orient(BufferedImage image, int code) {
        return Orientation.fromCode(code).map(orientation -> orientation.apply(image)).orElse(image);
    }
}

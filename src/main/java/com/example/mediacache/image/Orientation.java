package com.example.mediacache.image;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * EXIF orientation codes and the correction applied for each of them.
 */
public enum Orientation {
    NORMAL(1),
    FLIP_VERTICAL(2),
    ROTATE_180(3),
    ROTATE_180_FLIP(4),
    ROTATE_270_FLIP(5),
    ROTATE_270(6),
    ROTATE_90_FLIP(7),
    ROTATE_90(8);

    private final int code;

    Orientation(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean needsCorrection() {
        return this != NORMAL;
    }

    public static Optional<Orientation> fromCode(int code) {
        for (Orientation orientation : values()) {
            if (orientation.code == code) {
                return Optional.of(orientation);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a corrected copy of the image; {@link #NORMAL} returns the input itself.
     */
    public BufferedImage apply(BufferedImage image) {
        switch (this) {
            case FLIP_VERTICAL:
                return ImageOps.flipVertical(image);
            case ROTATE_180:
                return ImageOps.rotate180(image);
            case ROTATE_180_FLIP:
                return ImageOps.rotate180(ImageOps.flipVertical(image));
            case ROTATE_270_FLIP:
                return ImageOps.rotate270(ImageOps.flipVertical(image));
            case ROTATE_270:
                return ImageOps.rotate270(image);
            case ROTATE_90_FLIP:
                return ImageOps.rotate90(ImageOps.flipVertical(image));
            case ROTATE_90:
                return ImageOps.rotate90(image);
            default:
                return image;
        }
    }
}

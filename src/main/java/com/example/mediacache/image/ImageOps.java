package com.example.mediacache.image;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.image.BufferedImage;

/**
 * Pixel-level helpers. Rotations are counter-clockwise; "flip" mirrors top to bottom.
 */
public final class ImageOps {
    private ImageOps() {
    }

    /**
     * Scales the image to fit inside {@code maxWidth x maxHeight} keeping its aspect ratio.
     * Images that already fit are returned unchanged (no upscaling).
     */
    public static BufferedImage fit(BufferedImage source, int maxWidth, int maxHeight) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (width <= maxWidth && height <= maxHeight) {
            return source;
        }
        double ratio = Math.min((double) maxWidth / width, (double) maxHeight / height);
        int targetWidth = Math.max(1, (int) Math.round(width * ratio));
        int targetHeight = Math.max(1, (int) Math.round(height * ratio));
        return resize(source, targetWidth, targetHeight);
    }

    /**
     * Box-filter (area averaging) resize to exactly the given size.
     */
    public static BufferedImage resize(BufferedImage source, int width, int height) {
        if (source.getWidth() == width && source.getHeight() == height) {
            return source;
        }
        Image scaled = source.getScaledInstance(width, height, Image.SCALE_AREA_AVERAGING);
        BufferedImage result = new BufferedImage(width, height, typeOf(source));
        Graphics2D g2d = result.createGraphics();
        try {
            g2d.drawImage(scaled, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return result;
    }

    public static BufferedImage canvas(int width, int height, Color background) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = canvas.createGraphics();
        try {
            g2d.setColor(background);
            g2d.fillRect(0, 0, width, height);
        } finally {
            g2d.dispose();
        }
        return canvas;
    }

    /**
     * Draws {@code top} onto {@code base} at the given position, blending by the top
     * image's alpha channel. {@code base} is modified in place and returned.
     */
    public static BufferedImage overlay(BufferedImage base, BufferedImage top, int x, int y) {
        Graphics2D g2d = base.createGraphics();
        try {
            g2d.setComposite(AlphaComposite.SrcOver);
            g2d.drawImage(top, x, y, null);
        } finally {
            g2d.dispose();
        }
        return base;
    }

    public static BufferedImage flipVertical(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage result = new BufferedImage(width, height, typeOf(source));
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                result.setRGB(x, height - 1 - y, source.getRGB(x, y));
            }
        }
        return result;
    }

    public static BufferedImage rotate90(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage result = new BufferedImage(height, width, typeOf(source));
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                result.setRGB(y, width - 1 - x, source.getRGB(x, y));
            }
        }
        return result;
    }

    public static BufferedImage rotate180(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage result = new BufferedImage(width, height, typeOf(source));
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                result.setRGB(width - 1 - x, height - 1 - y, source.getRGB(x, y));
            }
        }
        return result;
    }

    public static BufferedImage rotate270(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage result = new BufferedImage(height, width, typeOf(source));
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                result.setRGB(height - 1 - y, x, source.getRGB(x, y));
            }
        }
        return result;
    }

    /**
     * Returns an opaque RGB copy (transparent areas become black), as JPEG has no alpha.
     */
    public static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = rgb.createGraphics();
        try {
            g2d.drawImage(source, 0, 0, Color.BLACK, null);
        } finally {
            g2d.dispose();
        }
        return rgb;
    }

    private static int typeOf(BufferedImage source) {
        return source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }
}

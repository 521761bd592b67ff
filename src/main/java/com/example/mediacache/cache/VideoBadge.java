package com.example.mediacache.cache;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Play-button badge stamped onto video thumbnails.
 */
final class VideoBadge {
    static final int SIZE = 90;
    static final int MARGIN = 11;

    private VideoBadge() {
    }

    static BufferedImage draw() {
        BufferedImage badge = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = badge.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setColor(new Color(0, 0, 0, 140));
            g2d.fillOval(2, 2, SIZE - 4, SIZE - 4);
            g2d.setColor(new Color(255, 255, 255, 220));
            g2d.setStroke(new BasicStroke(4f));
            g2d.drawOval(4, 4, SIZE - 8, SIZE - 8);
            Polygon triangle = new Polygon(
                    new int[]{34, 34, 66},
                    new int[]{26, 64, 45},
                    3);
            g2d.fillPolygon(triangle);
        } finally {
            g2d.dispose();
        }
        return badge;
    }

    /**
     * Top-right anchor of the badge on an image of the given width.
     */
    static int x(int imageWidth) {
        return Math.max(0, imageWidth - SIZE - MARGIN);
    }
}

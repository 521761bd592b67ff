package com.example.mediacache.cache;

import com.example.mediacache.MediaCacheException;
import com.example.mediacache.image.ImageCodec;
import com.example.mediacache.image.ImageOps;
import com.example.mediacache.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Composes a folder's thumbnails into one square collage: a 2x2 grid for up to four
 * files, 3x3 otherwise. Files whose thumbnail cannot be produced are skipped and the
 * next file takes their cell.
 */
public final class AlbumCollageGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlbumCollageGenerator.class);

    static final int SIZE = 256;
    private static final int SMALL_GRID_CELL = 128;
    private static final int LARGE_GRID_CELL = 86;

    private final ThumbnailSource thumbnails;
    private final ImageCodec codec;

    public AlbumCollageGenerator(ThumbnailSource thumbnails, ImageCodec codec) {
        this.thumbnails = thumbnails;
        this.codec = codec;
    }

    public BufferedImage compose(String relativeAlbumPath, List<String> fileNames) {
        int grid = fileNames.size() <= 4 ? 2 : 3;
        int cell = grid == 2 ? SMALL_GRID_CELL : LARGE_GRID_CELL;
        BufferedImage canvas = ImageOps.canvas(SIZE, SIZE, Color.BLACK);

        int placed = 0;
        for (String fileName : fileNames) {
            if (placed >= grid * grid) {
                break;
            }
            String relativePath = PathResolver.join(PathResolver.canonical(relativeAlbumPath), fileName);
            BufferedImage tile;
            try {
                tile = loadTile(relativePath, cell);
            } catch (MediaCacheException | IOException ex) {
                LOGGER.debug("Skipping {} in album thumbnail: {}", relativePath, ex.getMessage());
                continue;
            }
            int x = (placed % grid) * cell + (cell - tile.getWidth()) / 2;
            int y = (placed / grid) * cell + (cell - tile.getHeight()) / 2;
            ImageOps.overlay(canvas, tile, x, y);
            placed++;
        }
        LOGGER.debug("Album thumbnail for {} uses {} of {} files", relativeAlbumPath, placed, fileNames.size());
        return canvas;
    }

    private BufferedImage loadTile(String relativePath, int cell) throws MediaCacheException, IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        thumbnails.writeThumbnail(out, relativePath);
        BufferedImage thumbnail = codec.read(new ByteArrayInputStream(out.toByteArray()));
        double ratio = Math.min((double) cell / thumbnail.getWidth(), (double) cell / thumbnail.getHeight());
        int width = Math.max(1, (int) Math.round(thumbnail.getWidth() * ratio));
        int height = Math.max(1, (int) Math.round(thumbnail.getHeight() * ratio));
        return ImageOps.resize(thumbnail, width, height);
    }
}

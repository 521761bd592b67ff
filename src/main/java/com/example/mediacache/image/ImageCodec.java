package com.example.mediacache.image;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Decode and encode primitives used by the cache. Implementations report an unreadable
 * payload with {@link javax.imageio.IIOException} and file system problems with the
 * matching {@link java.nio.file.FileSystemException} subtype.
 */
public interface ImageCodec {
    BufferedImage read(Path source) throws IOException;

    BufferedImage read(InputStream source) throws IOException;

    /**
     * Reads the pixel dimensions without decoding the full raster where the format allows it.
     */
    Dimension readSize(Path source) throws IOException;

    void writeJpeg(BufferedImage image, Path target) throws IOException;

    void writeJpeg(BufferedImage image, OutputStream target) throws IOException;
}

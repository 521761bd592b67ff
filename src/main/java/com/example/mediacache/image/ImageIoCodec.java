package com.example.mediacache.image;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;

/**
 * {@link ImageCodec} backed by the JDK's ImageIO readers (PNG, JPEG, GIF, TIFF, BMP).
 */
public final class ImageIoCodec implements ImageCodec {
    private static final float JPEG_QUALITY = 0.95f;

    static {
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage read(Path source) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(source))) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new IIOException("No image reader understands " + source);
            }
            return image;
        }
    }

    @Override
    public BufferedImage read(InputStream source) throws IOException {
        BufferedImage image = ImageIO.read(source);
        if (image == null) {
            throw new IIOException("No image reader understands the stream");
        }
        return image;
    }

    @Override
    public Dimension readSize(Path source) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(source));
             ImageInputStream iis = ImageIO.createImageInputStream(in)) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new IIOException("No image reader understands " + source);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Writes through a temporary sibling file and moves it into place, so concurrent
     * readers never observe a partially written artifact.
     */
    @Override
    public void writeJpeg(BufferedImage image, Path target) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temporary = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temporary)) {
                writeJpeg(image, out);
            }
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    @Override
    public void writeJpeg(BufferedImage image, OutputStream target) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IIOException("No JPEG writer installed");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(JPEG_QUALITY);
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(target)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(ImageOps.toRgb(image), null, null), param);
        } finally {
            writer.dispose();
        }
    }
}

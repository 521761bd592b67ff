package com.example.mediacache.cache;

import com.example.mediacache.image.ImageCodec;
import com.example.mediacache.image.ImageIoCodec;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ImageIoCodec} that counts file decodes, optionally slowing them down.
 */
public final class CountingCodec implements ImageCodec {
    private final ImageCodec delegate = new ImageIoCodec();
    private final AtomicInteger fileReads = new AtomicInteger();
    private final AtomicInteger sizeReads = new AtomicInteger();
    private volatile long delayMillis;

    public CountingCodec slowDown(long millis) {
        this.delayMillis = millis;
        return this;
    }

    @Override
    public BufferedImage read(Path source) throws IOException {
        fileReads.incrementAndGet();
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        return delegate.read(source);
    }

    @Override
    public BufferedImage read(InputStream source) throws IOException {
        return delegate.read(source);
    }

    @Override
    public Dimension readSize(Path source) throws IOException {
        sizeReads.incrementAndGet();
        return delegate.readSize(source);
    }

    @Override
    public void writeJpeg(BufferedImage image, Path target) throws IOException {
        delegate.writeJpeg(image, target);
    }

    @Override
    public void writeJpeg(BufferedImage image, OutputStream target) throws IOException {
        delegate.writeJpeg(image, target);
    }

    public int fileReads() {
        return fileReads.get();
    }

    public int sizeReads() {
        return sizeReads.get();
    }
}

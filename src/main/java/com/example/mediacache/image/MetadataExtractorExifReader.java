package com.example.mediacache.image;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.imaging.jpeg.JpegSegmentData;
import com.drew.imaging.jpeg.JpegSegmentReader;
import com.drew.imaging.jpeg.JpegSegmentType;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifThumbnailDirectory;
import com.example.mediacache.catalog.MediaType;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reads orientation and the embedded thumbnail with metadata-extractor. Content is
 * sniffed with Tika first, so a file merely named {@code .jpg} is treated as having no EXIF.
 */
public final class MetadataExtractorExifReader implements ExifReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataExtractorExifReader.class);
    private static final byte[] EXIF_PREAMBLE = "Exif\0\0".getBytes(StandardCharsets.ISO_8859_1);

    private final Tika tika;

    public MetadataExtractorExifReader(Tika tika) {
        this.tika = tika;
    }

    @Override
    public Optional<ExifData> read(Path file) {
        if (!MediaType.isJpeg(file.getFileName().toString()) || !isJpegContent(file)) {
            return Optional.empty();
        }
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            ExifThumbnailDirectory thumbnailDirectory = metadata.getFirstDirectoryOfType(ExifThumbnailDirectory.class);
            if (ifd0 == null && thumbnailDirectory == null) {
                LOGGER.debug("No EXIF in {}", file);
                return Optional.empty();
            }
            Integer orientation = ifd0 == null ? null : ifd0.getInteger(ExifDirectoryBase.TAG_ORIENTATION);
            byte[] thumbnail = thumbnailDirectory == null ? null : thumbnailBytes(file, thumbnailDirectory);
            return Optional.of(new ExifData(orientation, thumbnail));
        } catch (ImageProcessingException | IOException ex) {
            LOGGER.debug("No EXIF in {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    private boolean isJpegContent(Path file) {
        try {
            return "image/jpeg".equals(tika.detect(file));
        } catch (IOException ex) {
            LOGGER.warn("Could not open {} for EXIF decoding", file, ex);
            return false;
        }
    }

    // The offset is relative to the TIFF header that follows the APP1 preamble. Some
    // metadata-extractor releases report it relative to the file instead, so both are tried.
    private byte[] thumbnailBytes(Path file, ExifThumbnailDirectory directory)
            throws ImageProcessingException, IOException {
        Integer offset = directory.getInteger(ExifThumbnailDirectory.TAG_THUMBNAIL_OFFSET);
        Integer length = directory.getInteger(ExifThumbnailDirectory.TAG_THUMBNAIL_LENGTH);
        if (offset == null || length == null || offset < 0 || length <= 0) {
            return null;
        }
        JpegSegmentData segments = JpegSegmentReader.readSegments(file.toFile(), List.of(JpegSegmentType.APP1));
        for (byte[] segment : segments.getSegments(JpegSegmentType.APP1)) {
            if (!startsWith(segment, EXIF_PREAMBLE)) {
                continue;
            }
            int start = EXIF_PREAMBLE.length + offset;
            if (start + length <= segment.length) {
                byte[] thumbnail = Arrays.copyOfRange(segment, start, start + length);
                if (isJpeg(thumbnail)) {
                    return thumbnail;
                }
            }
        }
        byte[] fromFile = readRange(file, offset, length);
        return isJpeg(fromFile) ? fromFile : null;
    }

    private static byte[] readRange(Path file, long position, int length) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            if (position + length > channel.size()) {
                return new byte[0];
            }
            ByteBuffer buffer = ByteBuffer.allocate(length);
            int read;
            do {
                read = channel.read(buffer, position + buffer.position());
            } while (read > 0 && buffer.hasRemaining());
            return buffer.array();
        }
    }

    private static boolean isJpeg(byte[] data) {
        return data.length > 2 && data[0] == (byte) 0xFF && data[1] == (byte) 0xD8;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}

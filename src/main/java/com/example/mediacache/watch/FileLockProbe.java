package com.example.mediacache.watch;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Checks whether a file written by another process is complete enough to read.
 */
final class FileLockProbe {
    private FileLockProbe() {
    }

    /**
     * Size and modification time of a file at one point in time.
     */
    record FileState(long size, Instant modified) {
        static FileState of(Path file) throws IOException {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileState(attrs.size(), attrs.lastModifiedTime().toInstant());
        }
    }

    /**
     * True if the file can be opened and share-locked for reading right now.
     */
    static boolean isReadable(Path file) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            FileLock lock = channel.tryLock(0L, Long.MAX_VALUE, true);
            if (lock == null) {
                return false;
            }
            lock.release();
            return true;
        } catch (OverlappingFileLockException | IOException ex) {
            return false;
        }
    }
}

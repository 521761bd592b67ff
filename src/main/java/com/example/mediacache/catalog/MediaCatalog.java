package com.example.mediacache.catalog;

import com.example.mediacache.NotFoundException;
import com.example.mediacache.PathEscapeException;
import com.example.mediacache.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lists one directory level below a root and keeps folders, images and videos.
 */
public final class MediaCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaCatalog.class);

    private final PathResolver resolver;

    public MediaCatalog(PathResolver resolver) {
        this.resolver = resolver;
    }

    public PathResolver resolver() {
        return resolver;
    }

    /**
     * Returns the entries of {@code relativePath} ordered by name. Directories and symbolic
     * links are folders; other files are kept only if their extension is a known image or
     * video extension.
     */
    public List<MediaEntry> list(String relativePath) throws PathEscapeException, NotFoundException {
        Path directory = resolver.resolve(relativePath);
        String key = PathResolver.canonical(relativePath);
        List<MediaEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                String name = child.getFileName().toString();
                Optional<MediaType> type;
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS) || Files.isSymbolicLink(child)) {
                    type = Optional.of(MediaType.FOLDER);
                } else {
                    type = MediaType.fromFileName(name);
                }
                if (type.isEmpty()) {
                    LOGGER.debug("Omitting {}", child);
                    continue;
                }
                entries.add(new MediaEntry(type.get(), name, PathResolver.join(key, name)));
            }
        } catch (NoSuchFileException | NotDirectoryException ex) {
            throw new NotFoundException("No such directory: " + relativePath, ex);
        } catch (IOException ex) {
            throw new NotFoundException("Unable to list " + relativePath + ": " + ex.getMessage(), ex);
        }
        entries.sort(Comparator.comparing(MediaEntry::name));
        return List.copyOf(entries);
    }
}

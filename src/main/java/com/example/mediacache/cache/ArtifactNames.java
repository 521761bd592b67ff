package com.example.mediacache.cache;

import com.example.mediacache.NoExtensionException;
import com.example.mediacache.path.PathResolver;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Naming rules of the cache tree. All keys are relative and use forward slashes.
 */
public final class ArtifactNames {
    public static final String THUMBNAIL_SUFFIX = ".thumb.jpg";
    public static final String PREVIEW_SUFFIX = ".preview.jpg";
    public static final String ERROR_MARKER_SUFFIX = ".err.txt";
    public static final String VIDEO_FRAME_SUFFIX = ".sh.jpg";
    static final String TEMPORARY_SUFFIX = ".tmp";

    private static final Pattern ALBUM_THUMBNAIL = Pattern.compile("\\d+\\.jpg");

    private ArtifactNames() {
    }

    /**
     * {@code dir/img.png -> dir/img.thumb.jpg}.
     */
    public static String relativeThumbnailPath(String relativeMediaPath) throws NoExtensionException {
        return replaceExtension(relativeMediaPath, THUMBNAIL_SUFFIX);
    }

    /**
     * {@code dir/img.png -> dir/img.preview.jpg}.
     */
    public static String relativePreviewPath(String relativeMediaPath) throws NoExtensionException {
        return replaceExtension(relativeMediaPath, PREVIEW_SUFFIX);
    }

    /**
     * {@code dir/img.thumb.jpg -> dir/img.thumb.err.txt}.
     */
    public static String errorMarkerPath(String artifactPath) {
        String slashed = PathResolver.toSlash(artifactPath);
        int slash = slashed.lastIndexOf('/');
        int dot = slashed.lastIndexOf('.');
        if (dot <= slash) {
            return slashed + ERROR_MARKER_SUFFIX;
        }
        return slashed.substring(0, dot) + ERROR_MARKER_SUFFIX;
    }

    public static Path errorMarkerPath(Path artifact) {
        return artifact.resolveSibling(errorMarkerPath(artifact.getFileName().toString()));
    }

    /**
     * Names of files that exist only while an artifact is being written: the codec's
     * hidden temporary file and the frame grabbed from a video.
     */
    public static boolean isTransientName(String fileName) {
        return fileName.startsWith(".") && fileName.endsWith(TEMPORARY_SUFFIX)
                || fileName.endsWith(VIDEO_FRAME_SUFFIX);
    }

    /**
     * Collage name: FNV-1 64 of the folder's base name followed by the concatenated file
     * names, in decimal, plus {@code .jpg}.
     */
    public static String albumThumbnailName(String relativeAlbumPath, List<String> fileNames) {
        String slashed = PathResolver.toSlash(relativeAlbumPath);
        String folder = slashed.substring(slashed.lastIndexOf('/') + 1);
        return Fnv64.hashToDecimal(folder + String.join("", fileNames)) + ".jpg";
    }

    public static String relativeAlbumThumbnailPath(String relativeAlbumPath, List<String> fileNames) {
        return PathResolver.join(PathResolver.canonical(relativeAlbumPath), albumThumbnailName(relativeAlbumPath, fileNames));
    }

    public static boolean isAlbumThumbnailName(String fileName) {
        return ALBUM_THUMBNAIL.matcher(fileName).matches();
    }

    private static String replaceExtension(String relativeMediaPath, String suffix) throws NoExtensionException {
        String slashed = PathResolver.toSlash(relativeMediaPath);
        int slash = slashed.lastIndexOf('/');
        int dot = slashed.lastIndexOf('.');
        if (dot <= slash) {
            throw new NoExtensionException("File has no extension: " + slashed.substring(slash + 1));
        }
        return slashed.substring(0, dot) + suffix;
    }
}

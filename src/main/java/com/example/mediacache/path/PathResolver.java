package com.example.mediacache.path;

import com.example.mediacache.NotASubpathException;
import com.example.mediacache.PathEscapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Maps relative, forward-slash keys onto a trusted root directory and back.
 * Any key that would leave the root is rejected.
 */
public final class PathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathResolver.class);

    private final Path root;
    private final Path absoluteRoot;

    public PathResolver(Path root) {
        this.root = root.normalize();
        this.absoluteRoot = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Joins the relative path onto the root. Parent segments, absolute paths and drive
     * prefixes that escape the root fail with {@link PathEscapeException}. The root itself
     * is reachable through the empty string.
     */
    public Path resolve(String relativePath) throws PathEscapeException {
        String slashed = toSlash(relativePath == null ? "" : relativePath);
        Path candidate;
        try {
            candidate = Path.of(slashed);
        } catch (InvalidPathException ex) {
            throw escape(relativePath);
        }
        if (candidate.isAbsolute() || candidate.getRoot() != null) {
            throw escape(relativePath);
        }
        Path joined = root.resolve(candidate).normalize();
        Path offset;
        try {
            offset = absoluteRoot.relativize(joined.toAbsolutePath().normalize());
        } catch (IllegalArgumentException ex) {
            throw escape(relativePath);
        }
        String offsetText = toSlash(offset.toString());
        if (offsetText.equals("..") || offsetText.startsWith("../")) {
            throw escape(relativePath);
        }
        return joined;
    }

    /**
     * Inverse of {@link #resolve}: returns the forward-slash key of a path below the root.
     * The root itself maps to the empty string, not {@code "."}: the empty key is the one
     * {@link #resolve}, {@link #canonical} and {@link #join} treat as the root.
     */
    public String relativize(Path fullPath) throws NotASubpathException {
        Path normalized = fullPath.toAbsolutePath().normalize();
        String relative;
        try {
            relative = toSlash(absoluteRoot.relativize(normalized).toString());
        } catch (IllegalArgumentException ex) {
            throw new NotASubpathException(fullPath + " is not a sub-path of " + root, ex);
        }
        if (relative.equals("..") || relative.startsWith("../")) {
            throw new NotASubpathException(fullPath + " is not a sub-path of " + root);
        }
        return relative;
    }

    /**
     * Normalizes a relative key: forward slashes, no {@code .} segments, no trailing slash.
     * Call only with keys that {@link #resolve} accepted.
     */
    public static String canonical(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            return "";
        }
        return toSlash(Path.of(toSlash(relativePath)).normalize().toString());
    }

    public static String toSlash(String path) {
        return path.replace('\\', '/');
    }

    /**
     * Joins two forward-slash keys; an empty parent yields the child unchanged.
     */
    public static String join(String parent, String child) {
        if (parent == null || parent.isEmpty()) {
            return child;
        }
        if (parent.endsWith("/")) {
            return parent + child;
        }
        return parent + "/" + child;
    }

    private PathEscapeException escape(String relativePath) {
        LOGGER.warn("Rejected path '{}' escaping root {}", relativePath, root);
        return new PathEscapeException("Path " + relativePath + " is outside of " + root);
    }
}

package com.scipatom.atomizer.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Read-only view of the analyzed source tree. All paths handed in are
 * index-relative ("src/lib.rs") and are resolved against the root; paths that
 * would escape the root are treated as absent.
 */
public class SourceTree {

    private final Path root;

    private SourceTree(Path root) {
        this.root = root;
    }

    /**
     * Opens the tree rooted at {@code root}.
     *
     * @throws SourceTreeException if the root is missing, not a directory, or unreadable
     */
    public static SourceTree open(Path root) {
        Path absolute = root.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new SourceTreeException("Source root does not exist: " + absolute);
        }
        if (!Files.isDirectory(absolute)) {
            throw new SourceTreeException("Source root is not a directory: " + absolute);
        }
        if (!Files.isReadable(absolute)) {
            throw new SourceTreeException("Source root is not readable: " + absolute);
        }
        return new SourceTree(absolute);
    }

    public Path root() { return root; }

    /** Name of the root directory, used for the root folder atom. */
    public String rootName() {
        Path name = root.getFileName();
        return name != null ? name.toString() : root.toString();
    }

    public boolean exists(String relativePath) {
        Path p = resolve(relativePath);
        return p != null && Files.isRegularFile(p);
    }

    /**
     * Reads a file as UTF-8 text, replacing undecodable bytes.
     *
     * @throws IOException if the file is absent, outside the root, or unreadable
     */
    public String read(String relativePath) throws IOException {
        Path p = resolve(relativePath);
        if (p == null) {
            throw new IOException("Path escapes source root: " + relativePath);
        }
        // malformed bytes become U+FFFD; they must not cost the file its spans
        return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    }

    private Path resolve(String relativePath) {
        Path p = root.resolve(relativePath).normalize();
        return p.startsWith(root) ? p : null;
    }

    public static class SourceTreeException extends RuntimeException {
        public SourceTreeException(String message) { super(message); }
    }
}

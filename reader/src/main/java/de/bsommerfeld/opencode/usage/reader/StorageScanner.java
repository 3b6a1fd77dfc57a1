package de.bsommerfeld.opencode.usage.reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates OpenCode usage part files below a storage root.
 *
 * <p>
 * OpenCode writes one small JSON file per message part, grouped in one
 * directory per message ({@code part/msg_.../prt_....json}). A long-lived
 * installation easily accumulates 10<sup>4</sup> to 10<sup>5</sup> of them,
 * so the walk reads each file's attributes exactly once from the directory
 * traversal and never opens the files themselves.
 *
 * <h3>Failure handling</h3>
 * Only the root is load-bearing: a missing root fails with
 * {@link ScanException.Kind#NOT_FOUND}, a root that is not a readable
 * directory with {@link ScanException.Kind#IO}. Unreadable subdirectories and
 * files are logged and skipped. Symbolic links below the root are not
 * followed; a root that is itself a link is resolved before the walk, and the
 * returned paths stay below the root as configured.
 */
public class StorageScanner {

    private static final Logger LOG = LoggerFactory.getLogger(StorageScanner.class);

    private static final String JSON_SUFFIX = ".json";

    private final Path root;

    public StorageScanner(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Returns every {@code *.json} file below the root, at any depth, in no
     * particular order.
     */
    public List<Path> scan() throws ScanException {
        List<ScannedFile> files = scanWithMetadata();
        List<Path> paths = new ArrayList<>(files.size());
        for (ScannedFile file : files)
            paths.add(file.path());
        return paths;
    }

    /**
     * Like {@link #scan()} but keeps each file's modification time.
     */
    public List<ScannedFile> scanWithMetadata() throws ScanException {
        checkRoot();

        List<ScannedFile> files = new ArrayList<>();
        int[] skipped = { 0 };
        try {
            Path walkRoot = root.toRealPath();
            Files.walkFileTree(walkRoot, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile() && isJson(file)) {
                                Path configured = root.resolve(walkRoot.relativize(file));
                                files.add(new ScannedFile(configured, attrs.lastModifiedTime().toInstant()));
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                            if (file.equals(walkRoot)) {
                                throw exc;
                            }
                            skipped[0]++;
                            LOG.debug("Skipping unreadable entry {}: {}", file, exc.toString());
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            throw new ScanException(ScanException.Kind.IO, root,
                    "Failed to access storage directory: " + root, e);
        }

        if (skipped[0] > 0) {
            LOG.warn("Scan of {} skipped {} unreadable entries.", root, skipped[0]);
        }
        LOG.debug("Scan of {} found {} part files.", root, files.size());
        return files;
    }

    /**
     * Returns only the part files modified at or after {@code cutoff}.
     */
    public List<ScannedFile> scanModifiedSince(Instant cutoff) throws ScanException {
        Objects.requireNonNull(cutoff, "cutoff");
        List<ScannedFile> recent = new ArrayList<>();
        for (ScannedFile file : scanWithMetadata()) {
            if (!file.lastModified().isBefore(cutoff))
                recent.add(file);
        }
        return recent;
    }

    private void checkRoot() throws ScanException {
        if (!Files.exists(root)) {
            throw new ScanException(ScanException.Kind.NOT_FOUND, root,
                    "Storage directory not found: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new ScanException(ScanException.Kind.IO, root,
                    "Storage path is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new ScanException(ScanException.Kind.IO, root,
                    "Storage directory is not readable: " + root);
        }
    }

    private static boolean isJson(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().endsWith(JSON_SUFFIX);
    }
}

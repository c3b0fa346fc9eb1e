package composition.analyzer.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds every {@code .yaml} / {@code .yml} file below the root, sorted by path.
 */
public final class ManifestFileFinder {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestFileFinder.class);

    private final Path root;

    public ManifestFileFinder(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public List<Path> findManifests() throws IOException {
        if (!Files.exists(root)) {
            throw new IOException("Root path not found: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Root path is not a directory: " + root);
        }

        final List<Path> manifests = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (".git".equals(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isManifest(file)) {
                    manifests.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOG.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(manifests);
        return manifests;
    }

    static boolean isManifest(Path file) {
        final String name = file.getFileName() != null ? file.getFileName().toString() : "";
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}

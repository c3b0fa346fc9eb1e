package composition.analyzer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Command-line settings of one run.
 */
public record AnalyzerOptions(Path root, Path output, boolean verbose) {

    public static final Path DEFAULT_OUTPUT = Paths.get("composition_extraction.xlsx");

    public AnalyzerOptions {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(output, "output");
    }
}

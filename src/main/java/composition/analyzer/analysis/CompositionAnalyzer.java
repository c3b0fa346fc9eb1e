package composition.analyzer.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import composition.analyzer.extract.CompositionExtraction;
import composition.analyzer.extract.CompositionExtractor;
import composition.analyzer.model.ExtractionRecord;
import composition.analyzer.model.FunctionCatalog;
import composition.analyzer.scan.ManifestFileFinder;
import composition.analyzer.scan.ManifestLoader;

/**
 * Runs the extraction over a directory tree, one file at a time.
 * A file that cannot be read or parsed is logged and left out entirely; the run goes on.
 */
public final class CompositionAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CompositionAnalyzer.class);

    private final ManifestFileFinder fileFinder;
    private final ManifestLoader loader;
    private final CompositionExtractor extractor;

    public CompositionAnalyzer(Path root) {
        this(new ManifestFileFinder(root), new ManifestLoader(), new CompositionExtractor());
    }

    public CompositionAnalyzer(ManifestFileFinder fileFinder, ManifestLoader loader, CompositionExtractor extractor) {
        this.fileFinder = Objects.requireNonNull(fileFinder, "fileFinder");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public AnalysisResult analyze() throws IOException {
        LOG.debug("Starting composition extraction process");
        final List<Path> files = fileFinder.findManifests();
        LOG.debug("Found {} YAML files to process", files.size());

        final List<ExtractionRecord> records = new ArrayList<>();
        final FunctionCatalog functions = new FunctionCatalog();
        int compositions = 0;
        int failedFiles = 0;

        for (Path file : files) {
            // buffered per file so a failure half-way leaves no partial rows behind
            final List<ExtractionRecord> fileRecords = new ArrayList<>();
            final List<String> fileFunctions = new ArrayList<>();
            int fileCompositions = 0;
            try {
                for (JsonNode document : loader.load(file)) {
                    final CompositionExtraction extraction = extractor.extract(document, file.toString());
                    if (!extraction.matched()) {
                        continue;
                    }
                    fileCompositions++;
                    fileRecords.addAll(extraction.records());
                    fileFunctions.addAll(extraction.functionRefs());
                }
            } catch (IOException | RuntimeException ex) {
                failedFiles++;
                LOG.error("Error processing {}: {}", file, ex.getMessage());
                continue;
            }
            records.addAll(fileRecords);
            functions.addAll(fileFunctions);
            compositions += fileCompositions;
        }

        LOG.info("Processed {} files: {} compositions, {} entries, {} failed",
                files.size(), compositions, records.size(), failedFiles);
        return new AnalysisResult(records, functions.sortedNames(), files.size(), compositions, failedFiles);
    }
}

package composition.analyzer.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import composition.analyzer.analysis.AnalysisResult;
import composition.analyzer.model.AggregatedStatistic;
import composition.analyzer.model.ExtractionRecord;
import composition.analyzer.model.FileMappingEntry;
import composition.analyzer.stats.AggregatedReport;

public final class JsonReportWriter implements ReportWriter {

    public static final String SCHEMA_VERSION = "composition-report/v1";

    private final ObjectMapper jsonMapper;

    public JsonReportWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void write(AnalysisResult result, AggregatedReport report, Path output) throws IOException {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(output, "output");

        final Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        final Summary summary = new Summary(
                result.filesScanned(),
                result.compositions(),
                result.failedFiles(),
                result.records().size(),
                report.statistics().size(),
                result.functions().size()
        );

        final Report doc = new Report(
                SCHEMA_VERSION,
                Instant.now().toString(),
                summary,
                result.records(),
                report.statistics(),
                report.fileMapping(),
                result.functions()
        );

        jsonMapper.writeValue(output.toFile(), doc);
    }

    // --- document records ---

    public record Report(
            String schema,
            String generatedAt,
            Summary summary,
            List<ExtractionRecord> records,
            List<AggregatedStatistic> statistics,
            List<FileMappingEntry> fileMapping,
            List<String> functions
    ) {
    }

    public record Summary(
            int filesScanned,
            int compositions,
            int failedFiles,
            int records,
            int managedResources,
            int functions
    ) {
    }
}

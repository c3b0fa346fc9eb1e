package composition.analyzer.io;

import java.io.IOException;
import java.nio.file.Path;

import composition.analyzer.analysis.AnalysisResult;
import composition.analyzer.stats.AggregatedReport;

/**
 * Serializes the four report tables: raw records, statistics, file mapping, functions.
 */
public interface ReportWriter {

    void write(AnalysisResult result, AggregatedReport report, Path output) throws IOException;
}

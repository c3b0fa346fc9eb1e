package composition.analyzer.analysis;

import java.util.List;

import composition.analyzer.model.ExtractionRecord;

/**
 * Everything one run extracted, ready for aggregation and writing.
 */
public record AnalysisResult(
        List<ExtractionRecord> records,
        List<String> functions, // unique function references, alphabetical
        int filesScanned,
        int compositions,
        int failedFiles
) {

    public AnalysisResult {
        records = List.copyOf(records);
        functions = List.copyOf(functions);
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}

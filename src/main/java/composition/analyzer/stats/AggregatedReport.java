package composition.analyzer.stats;

import java.util.List;

import composition.analyzer.model.AggregatedStatistic;
import composition.analyzer.model.FileMappingEntry;

public record AggregatedReport(
        List<AggregatedStatistic> statistics, // highest totalOccurrences first
        List<FileMappingEntry> fileMapping    // by kindApiVersion
) {

    public AggregatedReport {
        statistics = List.copyOf(statistics);
        fileMapping = List.copyOf(fileMapping);
    }
}

package composition.analyzer.stats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import composition.analyzer.model.AggregatedStatistic;
import composition.analyzer.model.ExtractionRecord;
import composition.analyzer.model.FileMappingEntry;
import composition.analyzer.model.ResourceAssociation;

/**
 * Folds raw records into occurrence statistics and a file mapping.
 * Every record lands in exactly one statistic, so the occurrence totals add up to the record count.
 */
public final class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    public AggregatedReport aggregate(List<ExtractionRecord> records) {
        return new AggregatedReport(statistics(records), fileMapping(records));
    }

    /**
     * One row per distinct association, highest occurrence count first; ties keep first-seen order.
     */
    public List<AggregatedStatistic> statistics(List<ExtractionRecord> records) {
        Objects.requireNonNull(records, "records");
        LOG.debug("Generating MR statistics");

        final Map<ResourceAssociation, StatisticAccumulator> groups = new LinkedHashMap<>();
        for (ExtractionRecord record : records) {
            groups.computeIfAbsent(record.resource(), k -> new StatisticAccumulator()).add(record);
        }

        final List<AggregatedStatistic> stats = new ArrayList<>(groups.size());
        for (var e : groups.entrySet()) {
            final ResourceAssociation resource = e.getKey();
            final StatisticAccumulator acc = e.getValue();
            stats.add(new AggregatedStatistic(
                    resource.kindApiVersion(),
                    resource.kind(),
                    resource.apiVersion(),
                    resource.category(),
                    acc.occurrences,
                    acc.files.size(),
                    acc.compositions.size()
            ));
        }
        // List.sort is stable
        stats.sort(Comparator.comparingInt(AggregatedStatistic::totalOccurrences).reversed());

        LOG.debug("Generated statistics for {} managed resources", stats.size());
        return stats;
    }

    /**
     * One row per kindApiVersion, listing the files it occurs in, busiest file first.
     */
    public List<FileMappingEntry> fileMapping(List<ExtractionRecord> records) {
        Objects.requireNonNull(records, "records");
        LOG.debug("Creating file mapping");

        final Map<String, Map<String, Integer>> countsByResource = new TreeMap<>();
        for (ExtractionRecord record : records) {
            countsByResource
                    .computeIfAbsent(record.resource().kindApiVersion(), k -> new LinkedHashMap<>())
                    .merge(record.filePath(), 1, Integer::sum);
        }

        final List<FileMappingEntry> mapping = new ArrayList<>(countsByResource.size());
        for (var e : countsByResource.entrySet()) {
            final List<Map.Entry<String, Integer>> perFile = new ArrayList<>(e.getValue().entrySet());
            perFile.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

            final List<String> locations = new ArrayList<>(perFile.size());
            int total = 0;
            for (var fileCount : perFile) {
                locations.add(fileCount.getKey() + " (" + fileCount.getValue() + " occurrences)");
                total += fileCount.getValue();
            }
            mapping.add(new FileMappingEntry(e.getKey(), perFile.size(), total, locations));
        }

        LOG.debug("Created mapping for {} managed resources", mapping.size());
        return mapping;
    }

    private static final class StatisticAccumulator {
        int occurrences;
        final Set<String> files = new HashSet<>();
        final Set<String> compositions = new HashSet<>();

        void add(ExtractionRecord record) {
            occurrences++;
            files.add(record.filePath());
            compositions.add(record.compositionKindApiVersion());
        }
    }
}

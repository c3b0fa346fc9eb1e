package composition.analyzer.model;

/**
 * Row of the MR Statistics table, one per distinct (kindApiVersion, kind, apiVersion, category).
 */
public record AggregatedStatistic(
        String kindApiVersion,
        String kind,
        String apiVersion,
        String category,
        int totalOccurrences,
        int foundInNFiles,
        int usedByNCompositions
) {
}
